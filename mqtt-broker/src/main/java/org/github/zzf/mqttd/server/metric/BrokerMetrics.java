package org.github.zzf.mqttd.server.metric;

import static com.google.common.base.Preconditions.checkNotNull;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import java.util.function.Supplier;

/**
 * @author zhanfeng.zhang@icloud.com
 * @date 2026-10-19
 */
public class BrokerMetrics {

    public static final String PREFIX = "org.github.zzf.mqttd.broker";

    private final MeterRegistry registry;
    private final Counter connectionAccepted;
    private final Counter connectionRefused;
    private final Counter messagePublished;
    private final Counter messageDelivered;
    private final Counter messageDropped;
    private final Counter messageRelayed;

    public BrokerMetrics(MeterRegistry registry) {
        this.registry = checkNotNull(registry, "registry");
        this.connectionAccepted = Counter.builder(PREFIX + ".connection")
            .tag("result", "accepted")
            .register(registry);
        this.connectionRefused = Counter.builder(PREFIX + ".connection")
            .tag("result", "refused")
            .register(registry);
        this.messagePublished = Counter.builder(PREFIX + ".msg.in").register(registry);
        this.messageDelivered = Counter.builder(PREFIX + ".msg.out")
            .tag("result", "delivered")
            .register(registry);
        this.messageDropped = Counter.builder(PREFIX + ".msg.out")
            .tag("result", "dropped")
            .register(registry);
        this.messageRelayed = Counter.builder(PREFIX + ".msg.relayed").register(registry);
    }

    public static BrokerMetrics global() {
        return new BrokerMetrics(Metrics.globalRegistry);
    }

    public void connectionAccepted() {
        connectionAccepted.increment();
    }

    public void connectionRefused() {
        connectionRefused.increment();
    }

    public void published() {
        messagePublished.increment();
    }

    public void delivered(int n) {
        messageDelivered.increment(n);
    }

    public void dropped(int n) {
        messageDropped.increment(n);
    }

    public void relayed() {
        messageRelayed.increment();
    }

    /**
     * @param name connections / sessions / subscriptions
     */
    public void gauge(String name, Supplier<Number> value) {
        Gauge.builder(PREFIX + "." + name, value)
            .strongReference(true)
            .register(registry);
    }

    public MeterRegistry registry() {
        return registry;
    }

}
