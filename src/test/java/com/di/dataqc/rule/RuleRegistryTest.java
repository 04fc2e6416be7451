package com.di.dataqc.rule;

import com.di.dataqc.exception.RuleConfigurationException;
import com.di.dataqc.rule.checks.AggregationCheckRule;
import com.di.dataqc.rule.checks.CountCheckRule;
import com.di.dataqc.rule.checks.DataTypeCheckRule;
import com.di.dataqc.rule.checks.DuplicateCheckRule;
import com.di.dataqc.rule.checks.NullCheckRule;
import com.di.dataqc.rule.checks.PatternCheckRule;
import com.di.dataqc.rule.checks.RangeCheckRule;
import com.di.dataqc.rule.checks.UniquenessCheckRule;
import com.di.dataqc.rule.checks.ValueSetCheckRule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for RuleRegistry.
 */
@DisplayName("RuleRegistry Tests")
class RuleRegistryTest {

    static List<QcRule> allRules() {
        return List.of(
                new ValueSetCheckRule(),
                new NullCheckRule(),
                new DuplicateCheckRule(),
                new RangeCheckRule(),
                new DataTypeCheckRule(),
                new CountCheckRule(),
                new AggregationCheckRule(),
                new PatternCheckRule(),
                new UniquenessCheckRule());
    }

    @Test
    @DisplayName("Should register every rule kind")
    void testRegistersAll() {
        RuleRegistry registry = RuleRegistry.of(allRules());
        assertEquals(RuleKind.values().length, registry.getRegisteredKinds().size());
    }

    @Test
    @DisplayName("Should list rules in kind order regardless of bean order")
    void testListRules() {
        List<RuleDescriptor> descriptors = RuleRegistry.of(allRules()).listRules();

        assertEquals(RuleKind.ids(), descriptors.stream().map(RuleDescriptor::id).collect(Collectors.toList()));
        assertEquals("Null Check", descriptors.get(0).name());
        assertNotNull(descriptors.get(0).configSchema());
    }

    @Test
    @DisplayName("Should look up rules case-insensitively")
    void testLookup() {
        RuleRegistry registry = RuleRegistry.of(allRules());

        assertTrue(registry.getRule(" NULL_CHECK ") instanceof NullCheckRule);
        assertTrue(registry.hasRule("value_set_check"));
        assertFalse(registry.hasRule("freshness_check"));
    }

    @Test
    @DisplayName("Should reject unknown rule ids")
    void testUnknownRule() {
        RuleRegistry registry = RuleRegistry.of(allRules());
        RuleConfigurationException ex = assertThrows(RuleConfigurationException.class,
                () -> registry.getRule("freshness_check"));
        assertTrue(ex.getMessage().startsWith("Unknown rule: freshness_check"));
    }

    @Test
    @DisplayName("Should fail startup when a kind has no rule")
    void testMissingRule() {
        List<QcRule> rules = new ArrayList<>(allRules());
        rules.removeIf(r -> r instanceof PatternCheckRule);

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> RuleRegistry.of(rules));
        assertTrue(ex.getMessage().contains("pattern_check"));
    }

    @Test
    @DisplayName("Should fail startup when two rules claim the same kind")
    void testDuplicateRule() {
        List<QcRule> rules = new ArrayList<>(allRules());
        rules.add(new NullCheckRule());

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> RuleRegistry.of(rules));
        assertTrue(ex.getMessage().startsWith("Duplicate QcRule kind() values detected"));
    }
}
