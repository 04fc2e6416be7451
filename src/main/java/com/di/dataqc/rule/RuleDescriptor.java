package com.di.dataqc.rule;

/**
 * Catalog entry returned by {@link RuleRegistry#listRules()}.
 */
public record RuleDescriptor(String id, String name, String description, ConfigSchema configSchema) {

    static RuleDescriptor of(QcRule rule) {
        return new RuleDescriptor(rule.kind().id(), rule.name(), rule.description(), rule.configSchema());
    }
}
