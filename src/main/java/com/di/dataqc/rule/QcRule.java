package com.di.dataqc.rule;

import com.di.dataqc.dataset.Dataset;

/**
 * A stateless validation check against one dataset.
 * <p>
 * Implementations are Spring beans discovered by the {@link RuleRegistry}. They never mutate the dataset
 * they are given and return the same result for the same dataset and configuration.
 */
public interface QcRule {

    /**
     * The registry key of this rule.
     */
    RuleKind kind();

    /**
     * Display name, used as the result's {@code rule_name}.
     */
    String name();

    String description();

    ConfigSchema configSchema();

    /**
     * Checks required and enumerated options.
     *
     * @throws com.di.dataqc.exception.RuleConfigurationException when an option is missing or invalid
     */
    void validateConfig(RuleConfig config);

    /**
     * Validates the configuration, then runs the check.
     *
     * @throws com.di.dataqc.exception.RuleConfigurationException  on an invalid configuration, before any data is read
     * @throws com.di.dataqc.exception.ColumnNotFoundException if a referenced column is absent
     */
    RuleResult execute(Dataset dataset, RuleConfig config);
}
