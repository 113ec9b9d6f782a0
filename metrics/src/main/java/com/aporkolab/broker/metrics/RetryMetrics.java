package com.aporkolab.broker.metrics;

import java.time.Duration;

import com.aporkolab.broker.deadletter.FailedWork;
import com.aporkolab.broker.deadletter.FailedWorkStore;
import com.aporkolab.broker.deadletter.FailureType;
import com.aporkolab.broker.deadletter.RetryListener;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;

/**
 * Micrometer metrics for the retry/dead-letter protocol.
 *
 * Provides the following metrics:
 * - retry_succeeded_total: work items completed
 * - retry_attempts_succeeded: attempt number on which items succeeded
 * - retry_scheduled_total: retries scheduled, by attempt number
 * - retry_dead_lettered_total: items parked as dead, by failure type
 * - retry_resubmitted_total: manual resubmissions
 * - retry_failed_store_size: records currently held by the failure store
 */
public class RetryMetrics implements RetryListener {

    private static final String METRIC_PREFIX = "retry";

    private final MeterRegistry registry;
    private final Tags baseTags;
    private final Counter succeededCounter;
    private final Counter resubmittedCounter;
    private final DistributionSummary succeededAttempts;

    public RetryMetrics(MeterRegistry registry, String queue, FailedWorkStore store) {
        this(registry, Tags.of("queue", queue), store);
    }

    public RetryMetrics(MeterRegistry registry, Tags tags, FailedWorkStore store) {
        this.registry = registry;
        this.baseTags = tags;

        this.succeededCounter = Counter.builder(METRIC_PREFIX + "_succeeded_total")
                .description("Work items processed successfully")
                .tags(baseTags)
                .register(registry);

        this.resubmittedCounter = Counter.builder(METRIC_PREFIX + "_resubmitted_total")
                .description("Dead work items manually resubmitted")
                .tags(baseTags)
                .register(registry);

        this.succeededAttempts = DistributionSummary.builder(METRIC_PREFIX + "_attempts_succeeded")
                .description("Attempt number on which work items succeeded")
                .tags(baseTags)
                .register(registry);

        Gauge.builder(METRIC_PREFIX + "_failed_store_size", store, FailedWorkStore::size)
                .description("Failed work items awaiting manual intervention")
                .tags(baseTags)
                .register(registry);
    }

    @Override
    public void onSucceeded(String workId, int attempt) {
        succeededCounter.increment();
        succeededAttempts.record(attempt);
    }

    @Override
    public void onRetryScheduled(String workId, int nextAttempt, Duration delay) {
        Counter.builder(METRIC_PREFIX + "_scheduled_total")
                .description("Retries scheduled through the delay queue")
                .tags(baseTags.and("attempt", String.valueOf(nextAttempt)))
                .register(registry)
                .increment();
    }

    @Override
    public void onDeadLettered(FailedWork failedWork) {
        FailureType type = failedWork.getFailureType() != null ? failedWork.getFailureType() : FailureType.UNKNOWN;
        Counter.builder(METRIC_PREFIX + "_dead_lettered_total")
                .description("Work items parked in the dead queue")
                .tags(baseTags.and("failure_type", type.name()))
                .register(registry)
                .increment();
    }

    @Override
    public void onResubmitted(String workId) {
        resubmittedCounter.increment();
    }

    public double getDeadLetteredCount() {
        return registry.find(METRIC_PREFIX + "_dead_lettered_total").tags(baseTags).counters().stream()
                .mapToDouble(Counter::count)
                .sum();
    }
}
