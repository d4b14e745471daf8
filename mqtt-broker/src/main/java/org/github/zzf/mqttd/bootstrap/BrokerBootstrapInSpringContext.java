package org.github.zzf.mqttd.bootstrap;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.github.zzf.mqttd.protocol.server.Authenticator;
import org.github.zzf.mqttd.protocol.server.Broker;
import org.github.zzf.mqttd.server.BrokerBootstrap;
import org.github.zzf.mqttd.server.BrokerConfig;
import org.github.zzf.mqttd.server.DefaultBroker;
import org.github.zzf.mqttd.server.metric.BrokerMetrics;
import org.github.zzf.mqttd.server.relay.RedisRelay;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * @author zhanfeng.zhang@icloud.com
 * @date 2022/07/01
 */
@Slf4j
@Configuration
public class BrokerBootstrapInSpringContext {

    public static void main(String[] args) {
        AnnotationConfigApplicationContext context =
            new AnnotationConfigApplicationContext(BrokerBootstrapInSpringContext.class);
        context.registerShutdownHook();
        log.info("Broker started in spring context: {}", context.getBean(BrokerBootstrap.class).listenedServers());
    }

    @Bean
    public BrokerConfig brokerConfig() {
        return BrokerConfig.fromSystemProperties();
    }

    @Bean
    public MeterRegistry meterRegistry() {
        return Metrics.globalRegistry;
    }

    @Bean
    public Authenticator authenticator() {
        return Authenticator.ALLOW_ALL;
    }

    @Bean
    public DefaultBroker defaultBroker(BrokerConfig config, Authenticator authenticator, MeterRegistry registry) {
        RedisRelay relay = config.getRelayAddress() == null
            ? null
            : RedisRelay.connect(config.getRelayAddress(), config.getNodeId());
        return new DefaultBroker(config, authenticator, new BrokerMetrics(registry), relay);
    }

    @Bean(destroyMethod = "shutdown")
    public BrokerBootstrap brokerBootstrap(Broker broker, BrokerConfig config) {
        return BrokerBootstrap.builder()
            .broker(broker)
            .config(config)
            .build()
            .start();
    }

}
