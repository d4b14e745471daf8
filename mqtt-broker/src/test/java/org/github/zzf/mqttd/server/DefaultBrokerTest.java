package org.github.zzf.mqttd.server;

import static org.assertj.core.api.BDDAssertions.then;
import static org.github.zzf.mqttd.protocol.model.MqttVersion.MQTT_5;
import static org.github.zzf.mqttd.server.DefaultServerSessionHandler.HANDLER_NAME;
import static org.github.zzf.mqttd.server.DefaultServerSessionHandlerTest.read;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.netty.channel.embedded.EmbeddedChannel;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import lombok.SneakyThrows;
import org.github.zzf.mqttd.protocol.codec.MqttCodec;
import org.github.zzf.mqttd.protocol.model.Connect;
import org.github.zzf.mqttd.protocol.model.Disconnect;
import org.github.zzf.mqttd.protocol.model.ReasonCode;
import org.github.zzf.mqttd.protocol.server.Authenticator;
import org.github.zzf.mqttd.protocol.server.BrokerHealth;
import org.github.zzf.mqttd.server.metric.BrokerMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

/**
 * @author zhanfeng.zhang@icloud.com
 * @date 2024-11-06
 */
class DefaultBrokerTest {

    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    DefaultBroker broker;

    DefaultBroker broker(BrokerConfig config) {
        broker = new DefaultBroker(config, Authenticator.ALLOW_ALL, new BrokerMetrics(registry), null);
        return broker;
    }

    @AfterEach
    void tearDown() {
        if (broker != null) {
            broker.close();
        }
    }

    EmbeddedChannel client(String clientId) {
        EmbeddedChannel ch = new EmbeddedChannel();
        ch.pipeline()
            .addLast(new MqttCodec())
            .addLast(HANDLER_NAME, new DefaultServerSessionHandler(broker, broker.config()));
        ch.writeInbound(Connect.from(MQTT_5, clientId, true, 0).toByteBuf());
        // ConnAck
        read(ch, MQTT_5);
        return ch;
    }

    @Test
    void givenMaxConnections_whenAccept_thenRefusedOnceReached() {
        broker(BrokerConfig.builder().maxConnections(2).build());
        EmbeddedChannel c1 = new EmbeddedChannel();
        EmbeddedChannel c2 = new EmbeddedChannel();
        then(broker.accept(c1)).isTrue();
        then(broker.health().status()).isEqualTo(BrokerHealth.Status.HEALTHY);
        then(broker.accept(c2)).isTrue();
        then(broker.accept(new EmbeddedChannel())).isFalse();
        then(broker.health().status()).isEqualTo(BrokerHealth.Status.DEGRADED);
        then(broker.connectionCount()).isEqualTo(2);
        broker.release(c1);
        // released twice is a no-op
        broker.release(c1);
        then(broker.connectionCount()).isEqualTo(1);
        then(broker.accept(new EmbeddedChannel())).isTrue();
        then(registry.get(BrokerMetrics.PREFIX + ".connection").tags("result", "refused").counter().count())
            .isEqualTo(1.0);
    }

    @Test
    @SneakyThrows
    void givenMaxConnections_whenConcurrentAccept_thenNeverExceeded() {
        int max = 4, n = 32;
        broker(BrokerConfig.builder().maxConnections(max).build());
        ExecutorService pool = Executors.newFixedThreadPool(n);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            EmbeddedChannel ch = new EmbeddedChannel();
            results.add(pool.submit(() -> {
                start.await();
                return broker.accept(ch);
            }));
        }
        start.countDown();
        int accepted = 0;
        for (Future<Boolean> f : results) {
            if (f.get(5, TimeUnit.SECONDS)) {
                accepted += 1;
            }
        }
        pool.shutdown();
        then(accepted).isEqualTo(max);
        then(broker.connectionCount()).isEqualTo(max);
    }

    @Test
    void givenMaxConnectionsPerIp_whenAccept_thenRefusedOnceReached() {
        broker(BrokerConfig.builder().maxConnectionsPerIp(1).build());
        // every EmbeddedChannel has the same remote address
        EmbeddedChannel c1 = new EmbeddedChannel();
        then(broker.accept(c1)).isTrue();
        then(broker.accept(new EmbeddedChannel())).isFalse();
        broker.release(c1);
        then(broker.accept(new EmbeddedChannel())).isTrue();
    }

    @Test
    void givenConnectedClient_whenDeleteSession_thenAdministrativeAction() {
        broker(BrokerConfig.builder().build());
        EmbeddedChannel ch = client("c1");
        then(broker.deleteSession("c1")).isTrue();
        Disconnect disconnect = read(ch, MQTT_5);
        then(disconnect.reasonCode()).isEqualTo(ReasonCode.ADMINISTRATIVE_ACTION);
        then(ch.isOpen()).isFalse();
        then(broker.session("c1")).isEmpty();
        then(broker.deleteSession("c1")).isFalse();
    }

    @Test
    void givenGauges_whenClientsConnect_thenCounted() {
        broker(BrokerConfig.builder().build());
        client("c1");
        client("c2");
        then(registry.get(BrokerMetrics.PREFIX + ".connections").gauge().value()).isEqualTo(2.0);
        then(registry.get(BrokerMetrics.PREFIX + ".sessions").gauge().value()).isEqualTo(2.0);
        then(registry.get(BrokerMetrics.PREFIX + ".subscriptions").gauge().value()).isEqualTo(0.0);
    }

    /**
     * Connections get DISCONNECT 0x8B (Server shutting down), Network Connections without CONNECT are closed
     */
    @Test
    void givenClients_whenClose_thenDisconnectedAndNotAccepting() {
        broker(BrokerConfig.builder().build());
        EmbeddedChannel connected = client("c1");
        EmbeddedChannel pending = new EmbeddedChannel();
        then(broker.accept(pending)).isTrue();

        broker.close();
        Disconnect disconnect = read(connected, MQTT_5);
        then(disconnect.reasonCode()).isEqualTo(ReasonCode.SERVER_SHUTTING_DOWN);
        then(connected.isOpen()).isFalse();
        then(pending.isOpen()).isFalse();
        then(broker.health().running()).isFalse();
        then(broker.health().status()).isEqualTo(BrokerHealth.Status.DEGRADED);
        then(broker.accept(new EmbeddedChannel())).isFalse();
        // idempotent
        broker.close();
    }

}
