package com.di.dataqc.rule;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Closed set of rule identifiers. Each kind is bound to exactly one {@link QcRule} in the {@link RuleRegistry}.
 */
public enum RuleKind {
    NULL_CHECK("null_check"),
    DUPLICATE_CHECK("duplicate_check"),
    RANGE_CHECK("range_check"),
    DATATYPE_CHECK("datatype_check"),
    COUNT_CHECK("count_check"),
    AGGREGATION_CHECK("aggregation_check"),
    PATTERN_CHECK("pattern_check"),
    UNIQUENESS_CHECK("uniqueness_check"),
    VALUE_SET_CHECK("value_set_check");

    private final String id;

    RuleKind(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static Optional<RuleKind> fromId(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(k -> k.id.equals(normalized)).findFirst();
    }

    public static List<String> ids() {
        return Arrays.stream(values()).map(RuleKind::id).collect(Collectors.toList());
    }
}
