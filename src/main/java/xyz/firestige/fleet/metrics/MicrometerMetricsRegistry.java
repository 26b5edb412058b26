package xyz.firestige.fleet.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer 实现
 * <p>
 * 所有指标带 component=fleet-update 标签；仪表值以 double 位模式存放在 AtomicLong 中。
 */
public class MicrometerMetricsRegistry implements MetricsRegistry {

    static final Tags COMMON_TAGS = Tags.of("component", "fleet-update");

    private final MeterRegistry registry;
    private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, AtomicLong> gauges = new ConcurrentHashMap<>();

    public MicrometerMetricsRegistry(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void incrementCounter(String name) {
        counters.computeIfAbsent(name, n -> Counter.builder(n).tags(COMMON_TAGS).register(registry)).increment();
    }

    @Override
    public void setGauge(String name, double value) {
        AtomicLong bits = gauges.computeIfAbsent(name, n -> {
            AtomicLong holder = new AtomicLong(Double.doubleToLongBits(0.0));
            Gauge.builder(n, holder, h -> Double.longBitsToDouble(h.get()))
                    .tags(COMMON_TAGS)
                    .register(registry);
            return holder;
        });
        bits.set(Double.doubleToLongBits(value));
    }
}
