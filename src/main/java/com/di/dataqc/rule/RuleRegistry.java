package com.di.dataqc.rule;

import com.di.dataqc.exception.RuleConfigurationException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Maps every {@link RuleKind} to its {@link QcRule} bean.
 *
 * <p>All rule beans are injected by Spring and registered once at startup. Startup fails when two beans claim
 * the same kind or a kind has no bean, so a running registry always serves the complete rule catalog.
 *
 * @author DataQC
 * @since 1.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RuleRegistry {

    private final List<QcRule> rules;

    private Map<RuleKind, QcRule> rulesByKind;

    /**
     * Builds a registry outside a Spring context.
     */
    public static RuleRegistry of(List<QcRule> rules) {
        RuleRegistry registry = new RuleRegistry(rules);
        registry.initialize();
        return registry;
    }

    @PostConstruct
    void initialize() {
        log.info("[RULE] Registering {} rule bean(s)...", rules.size());
        Map<RuleKind, List<QcRule>> grouped = rules.stream()
                .collect(Collectors.groupingBy(QcRule::kind, () -> new EnumMap<>(RuleKind.class), Collectors.toList()));

        String duplicates = grouped.entrySet().stream()
                .filter(e -> e.getValue().size() > 1)
                .map(e -> String.format("'%s' -> [%s]", e.getKey().id(), e.getValue().stream()
                        .map(r -> r.getClass().getName())
                        .collect(Collectors.joining(", "))))
                .collect(Collectors.joining(" ; "));
        if (!duplicates.isEmpty()) {
            throw new IllegalStateException("Duplicate QcRule kind() values detected: " + duplicates);
        }

        List<String> unregistered = Arrays.stream(RuleKind.values())
                .filter(k -> !grouped.containsKey(k))
                .map(RuleKind::id)
                .collect(Collectors.toList());
        if (!unregistered.isEmpty()) {
            throw new IllegalStateException("No QcRule registered for: " + unregistered);
        }

        Map<RuleKind, QcRule> byKind = new EnumMap<>(RuleKind.class);
        grouped.forEach((kind, list) -> byKind.put(kind, list.get(0)));
        rulesByKind = Collections.unmodifiableMap(byKind);
        rulesByKind.forEach((kind, rule) ->
                log.info("[RULE]   - {} -> {}", kind.id(), rule.getClass().getSimpleName()));
    }

    /**
     * Looks up a rule by its string id (case-insensitive).
     *
     * @throws RuleConfigurationException if the id names no rule
     */
    public QcRule getRule(String id) {
        RuleKind kind = RuleKind.fromId(id)
                .orElseThrow(() -> new RuleConfigurationException(
                        String.format("Unknown rule: %s. Available rules: %s", id, RuleKind.ids())));
        return getRule(kind);
    }

    public QcRule getRule(RuleKind kind) {
        return rulesByKind.get(kind);
    }

    public boolean hasRule(String id) {
        return RuleKind.fromId(id).isPresent();
    }

    public Set<RuleKind> getRegisteredKinds() {
        return rulesByKind.keySet();
    }

    /**
     * Rule catalog in {@link RuleKind} declaration order.
     */
    public List<RuleDescriptor> listRules() {
        return rulesByKind.values().stream().map(RuleDescriptor::of).collect(Collectors.toList());
    }
}
