package com.cadforge.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for constraint solving, merging and coordination.
 */
@Service
public class CadforgeMetrics {

    private final MeterRegistry registry;

    public CadforgeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordConstraintApplied(String constraintType, String status) {
        Counter.builder("cadforge.constraints.applied")
                .tag("type", constraintType)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    /**
     * Records a rejected constraint.
     *
     * @param reason "contradiction" or "over_constrained"
     */
    public void recordConstraintConflict(String reason) {
        Counter.builder("cadforge.constraints.conflicts")
                .description("Constraints rejected before touching the graph")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordPropagation(int constraintsEvaluated, long nanos) {
        Timer.builder("cadforge.propagation.duration")
                .register(registry)
                .record(Duration.ofNanos(nanos));
        DistributionSummary.builder("cadforge.propagation.constraints")
                .description("Constraints re-evaluated per propagation")
                .register(registry)
                .record(constraintsEvaluated);
    }

    /**
     * Records a merge attempt.
     *
     * @param strategy merge strategy value
     * @param outcome  "merged", "conflict" or "rejected"
     */
    public void recordMerge(String strategy, String outcome) {
        Counter.builder("cadforge.merges.total")
                .tag("strategy", strategy)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordMergeConflicts(int conflicts) {
        DistributionSummary.builder("cadforge.merges.conflicts")
                .description("Conflicting entities found per merge")
                .register(registry)
                .record(conflicts);
    }

    public void recordLockAcquire(String resourceType, boolean granted) {
        Counter.builder("cadforge.locks.acquisitions")
                .tag("resource_type", resourceType)
                .tag("granted", String.valueOf(granted))
                .register(registry)
                .increment();
    }

    public void recordUndo(String operationType) {
        Counter.builder("cadforge.history.undo")
                .tag("operation", operationType)
                .register(registry)
                .increment();
    }
}
