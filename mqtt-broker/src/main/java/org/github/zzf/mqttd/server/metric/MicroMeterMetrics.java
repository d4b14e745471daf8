package org.github.zzf.mqttd.server.metric;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.binder.jvm.ClassLoaderMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

/**
 * JVM meters on the global registry. Exporters are plugged in by the deployment with
 * {@link Metrics#addRegistry(MeterRegistry)}.
 */
@Slf4j
@Builder
public class MicroMeterMetrics {

    final String appName;

    public void init() {
        log.info("MicroMeterConfiguration appName: {}", appName);
        Metrics.globalRegistry.config().commonTags("application", appName);
        MeterRegistry registry = Metrics.globalRegistry;
        new ClassLoaderMetrics().bindTo(registry);
        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
    }

}
