package org.github.zzf.mqttd.bootstrap;

import lombok.extern.slf4j.Slf4j;
import org.github.zzf.mqttd.protocol.server.Authenticator;
import org.github.zzf.mqttd.protocol.server.Relay;
import org.github.zzf.mqttd.server.BrokerBootstrap;
import org.github.zzf.mqttd.server.BrokerConfig;
import org.github.zzf.mqttd.server.DefaultBroker;
import org.github.zzf.mqttd.server.metric.BrokerMetrics;
import org.github.zzf.mqttd.server.metric.MicroMeterMetrics;
import org.github.zzf.mqttd.server.relay.RedisRelay;

@Slf4j
public class Application {

    public static void main(String[] args) {
        BrokerConfig config = BrokerConfig.fromSystemProperties();
        log.info("mqtt.server config: {}", config);
        // metric
        String appName = System.getProperty("appName", "mqttd");
        log.info("appName: {}", appName);
        MicroMeterMetrics.builder().appName(appName).build().init();
        //
        Relay relay = null;
        if (config.getRelayAddress() != null) {
            relay = RedisRelay.connect(config.getRelayAddress(), config.getNodeId());
        }
        DefaultBroker broker = new DefaultBroker(config, Authenticator.ALLOW_ALL, BrokerMetrics.global(), relay);
        BrokerBootstrap bootstrap = BrokerBootstrap.builder()
                .broker(broker)
                .config(config)
                .build()
                .start();
        // ShutdownHook
        Runtime.getRuntime().addShutdownHook(new Thread(bootstrap::shutdown, "mqttd-shutdown"));
    }

}
