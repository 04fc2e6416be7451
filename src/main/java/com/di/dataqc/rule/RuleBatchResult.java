package com.di.dataqc.rule;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Results of a multi-rule run, in request order.
 */
@Value
@Builder
public class RuleBatchResult {

    boolean allPassed;

    int totalRules;

    int passedCount;

    int failedCount;

    List<RuleResult> results;
}
