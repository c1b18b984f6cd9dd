package com.pulse.metrics;

import com.pulse.entity.dto.call.CallEndReason;
import com.pulse.entity.dto.call.CallStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 通话相关的计数与耗时
 */
@Component
public class CallMetrics {

    private final MeterRegistry registry;
    private final Counter started;
    private final Counter renegotiations;
    private final Counter droppedCandidates;
    private final Timer setup;

    public CallMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.started = Counter.builder("pulse.call.started").register(registry);
        this.renegotiations = Counter.builder("pulse.call.renegotiation").register(registry);
        this.droppedCandidates = Counter.builder("pulse.call.candidates.dropped").register(registry);
        this.setup = Timer.builder("pulse.call.setup").register(registry);
    }

    public void callStarted() {
        started.increment();
    }

    public void outcome(CallStatus status, CallEndReason reason) {
        registry.counter("pulse.call.outcome", "status", status.name(), "reason", reason.name()).increment();
    }

    public void glare(String decision) {
        registry.counter("pulse.call.glare", "decision", decision).increment();
    }

    public void renegotiation() {
        renegotiations.increment();
    }

    public void candidateDropped() {
        droppedCandidates.increment();
    }

    public void setupTime(long millis) {
        setup.record(Duration.ofMillis(Math.max(0L, millis)));
    }

    public double count(String name, String... tags) {
        Counter counter = registry.find(name).tags(tags).counter();
        return counter == null ? 0d : counter.count();
    }
}
