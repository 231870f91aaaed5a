/*
 * Copyright (c) 2025 Scrubflow4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.scrubflow4j.spring;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;
import io.scrubflow4j.core.api.model.Finding;
import io.scrubflow4j.core.report.Reporter;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/** Counts redactions per category and keeps the most recent findings for the actuator endpoint. */
public final class MicrometerReporter implements Reporter {
    public static final String METER_NAME = "scrubflow4j_redactions_total";

    private final MeterRegistry registry;
    private final Deque<Finding> ring = new ArrayDeque<>();
    private final int capacity;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "MeterRegistry is a framework-managed, thread-safe component and is not exposed.")
    public MicrometerReporter(MeterRegistry registry, int capacity) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.capacity = Math.max(10, capacity);
    }

    @Override
    public synchronized void report(List<Finding> findings) {
        if (findings == null || findings.isEmpty()) return;
        for (Finding f : findings) {
            registry.counter(METER_NAME, "type", f.type()).increment(f.count());
            if (ring.size() >= capacity) ring.removeFirst();
            ring.addLast(f);
        }
    }

    /** Unmodifiable snapshot, oldest first. */
    public synchronized List<Finding> recentFindings() {
        return List.copyOf(ring);
    }
}
