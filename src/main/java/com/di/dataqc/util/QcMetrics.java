package com.di.dataqc.util;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Micrometer meters for rule runs, comparisons and reconciliations.
 */
@Slf4j
@Component
public class QcMetrics {

    private final MeterRegistry meterRegistry;

    private final Counter reconciliationCounter;
    private final Counter comparisonCounter;

    public QcMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.reconciliationCounter = Counter.builder("dataqc.reconciliations")
                .description("Total number of multi-source reconciliations")
                .register(meterRegistry);

        this.comparisonCounter = Counter.builder("dataqc.comparisons")
                .description("Total number of pairwise dataset comparisons")
                .register(meterRegistry);

        log.info("QcMetrics initialized");
    }

    public void recordRuleExecution(String ruleId, boolean passed) {
        Counter.builder("dataqc.rules.executed")
                .description("Rule executions by outcome")
                .tag("rule", ruleId)
                .tag("outcome", passed ? "passed" : "failed")
                .register(meterRegistry)
                .increment();
    }

    public void recordRuleError(String ruleId) {
        Counter.builder("dataqc.rules.errors")
                .description("Rules that could not run (configuration or missing column)")
                .tag("rule", ruleId)
                .register(meterRegistry)
                .increment();
    }

    public void recordReconciliation() {
        reconciliationCounter.increment();
    }

    public void recordComparison() {
        comparisonCounter.increment();
    }

    /**
     * Times {@code operation} under {@code dataqc.operation.duration}, tagged with the operation name.
     */
    public <T> T timeOperation(String operation, Supplier<T> action) {
        Timer timer = Timer.builder("dataqc.operation.duration")
                .description("Duration of quality-check operations")
                .tag("operation", operation)
                .register(meterRegistry);
        return timer.record(action);
    }
}
