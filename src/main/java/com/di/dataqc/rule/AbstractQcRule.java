package com.di.dataqc.rule;

import com.di.dataqc.dataset.Dataset;
import com.di.dataqc.exception.ColumnNotFoundException;
import com.di.dataqc.exception.RuleConfigurationException;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Base for the built-in rules: validates the configuration against the declared schema before
 * {@link #evaluate} ever sees the dataset.
 */
public abstract class AbstractQcRule implements QcRule {

    private final RuleKind kind;
    private final String name;
    private final String description;
    private final ConfigSchema schema;

    protected AbstractQcRule(RuleKind kind, String name, String description) {
        this.kind = kind;
        this.name = name;
        this.description = description;
        this.schema = buildSchema();
    }

    protected abstract ConfigSchema buildSchema();

    protected abstract RuleResult evaluate(Dataset dataset, RuleConfig config);

    @Override
    public RuleKind kind() {
        return kind;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String description() {
        return description;
    }

    @Override
    public ConfigSchema configSchema() {
        return schema;
    }

    @Override
    public void validateConfig(RuleConfig config) {
        for (String field : schema.getRequired()) {
            if (!config.has(field)) {
                throw RuleConfigurationException.missingField(field);
            }
        }
        for (Map.Entry<String, ConfigProperty> entry : schema.getProperties().entrySet()) {
            List<String> allowed = entry.getValue().getAllowedValues();
            String value = config.getString(entry.getKey());
            if (allowed != null && value != null && !allowed.contains(value.trim().toLowerCase(Locale.ROOT))) {
                throw new RuleConfigurationException(String.format(
                        "Invalid value for '%s': '%s'. Allowed: %s", entry.getKey(), value, allowed));
            }
        }
    }

    @Override
    public final RuleResult execute(Dataset dataset, RuleConfig config) {
        validateConfig(config);
        return evaluate(dataset, config);
    }

    protected static void requireColumns(Dataset dataset, Collection<String> columns) {
        List<String> missing = dataset.missingColumns(columns);
        if (!missing.isEmpty()) {
            throw new ColumnNotFoundException(missing);
        }
    }

    protected RuleResult.RuleResultBuilder result(boolean passed, String message) {
        return RuleResult.builder().ruleName(name).passed(passed).message(message);
    }
}
