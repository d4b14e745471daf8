package org.github.zzf.mqttd.server.metric;

import static org.assertj.core.api.BDDAssertions.then;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class BrokerMetricsTest {

    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final BrokerMetrics metrics = new BrokerMetrics(registry);

    @Test
    void givenEvents_whenCount_thenCountersTaggedByResult() {
        metrics.connectionAccepted();
        metrics.connectionAccepted();
        metrics.connectionRefused();
        metrics.published();
        metrics.delivered(3);
        metrics.dropped(1);
        metrics.relayed();
        then(registry.get(BrokerMetrics.PREFIX + ".connection").tags("result", "accepted").counter().count())
            .isEqualTo(2.0);
        then(registry.get(BrokerMetrics.PREFIX + ".connection").tags("result", "refused").counter().count())
            .isEqualTo(1.0);
        then(registry.get(BrokerMetrics.PREFIX + ".msg.in").counter().count()).isEqualTo(1.0);
        then(registry.get(BrokerMetrics.PREFIX + ".msg.out").tags("result", "delivered").counter().count())
            .isEqualTo(3.0);
        then(registry.get(BrokerMetrics.PREFIX + ".msg.out").tags("result", "dropped").counter().count())
            .isEqualTo(1.0);
        then(registry.get(BrokerMetrics.PREFIX + ".msg.relayed").counter().count()).isEqualTo(1.0);
    }

    @Test
    void givenGauge_whenValueChanges_thenGaugeFollows() {
        AtomicInteger connections = new AtomicInteger();
        metrics.gauge("connections", connections::get);
        connections.set(5);
        then(registry.get(BrokerMetrics.PREFIX + ".connections").gauge().value()).isEqualTo(5.0);
    }

}
