package com.di.dataqc.rule;

import com.di.dataqc.aspect.LogOperation;
import com.di.dataqc.dataset.Dataset;
import com.di.dataqc.exception.QcException;
import com.di.dataqc.util.QcMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs a list of rules against one dataset.
 * <p>
 * A rule that fails to configure or references a missing column becomes its own failed {@link RuleResult};
 * the remaining rules still run and the batch outcome counts that rule as failed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RuleBatchService {

    private final RuleRegistry registry;
    private final QcMetrics metrics;

    @LogOperation(eventType = "RULE_BATCH", parameterNames = {"dataset", "rules"})
    public RuleBatchResult run(Dataset dataset, List<RuleRequest> requests) {
        log.info("[BATCH] Running {} rule(s) against {}", requests.size(), dataset);
        List<RuleResult> results = new ArrayList<>(requests.size());
        for (RuleRequest request : requests) {
            results.add(runOne(dataset, request));
        }
        int passed = (int) results.stream().filter(RuleResult::isPassed).count();
        RuleBatchResult batch = RuleBatchResult.builder()
                .allPassed(passed == results.size())
                .totalRules(results.size())
                .passedCount(passed)
                .failedCount(results.size() - passed)
                .results(List.copyOf(results))
                .build();
        log.info("[BATCH] Completed: {}/{} rule(s) passed", passed, results.size());
        return batch;
    }

    private RuleResult runOne(Dataset dataset, RuleRequest request) {
        String ruleId = request.getRuleId();
        if (ruleId == null || ruleId.isBlank()) {
            metrics.recordRuleError("unknown");
            return RuleResult.error("Unknown", "Missing required field: rule_id");
        }
        String displayName = ruleId;
        try {
            QcRule rule = registry.getRule(ruleId);
            displayName = rule.name();
            RuleResult result = metrics.timeOperation("rule." + rule.kind().id(),
                    () -> rule.execute(dataset, RuleConfig.of(request.getConfig())));
            metrics.recordRuleExecution(rule.kind().id(), result.isPassed());
            log.debug("[BATCH] {} -> passed={} ({})", ruleId, result.isPassed(), result.getMessage());
            return result;
        } catch (QcException e) {
            log.warn("[BATCH] Rule {} could not run: {}", ruleId, e.getMessage());
            metrics.recordRuleError(ruleId);
            return RuleResult.error(displayName, e.getMessage());
        } catch (RuntimeException e) {
            log.error("[BATCH] Rule {} failed unexpectedly", ruleId, e);
            metrics.recordRuleError(ruleId);
            return RuleResult.error(displayName, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
