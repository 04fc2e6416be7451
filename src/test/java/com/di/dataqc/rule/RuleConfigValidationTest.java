package com.di.dataqc.rule;

import com.di.dataqc.dataset.Dataset;
import com.di.dataqc.exception.RuleConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for configuration validation across every registered rule.
 */
@DisplayName("Rule Configuration Validation Tests")
class RuleConfigValidationTest {

    private final RuleRegistry registry = RuleRegistry.of(RuleRegistryTest.allRules());

    @ParameterizedTest
    @EnumSource(value = RuleKind.class, mode = EnumSource.Mode.EXCLUDE, names = {"NULL_CHECK", "DUPLICATE_CHECK"})
    @DisplayName("Should reject an empty configuration before reading the dataset")
    void testEmptyConfigRejected(RuleKind kind) {
        QcRule rule = registry.getRule(kind);

        // a null dataset proves validation runs first
        assertThrows(RuleConfigurationException.class, () -> rule.execute(null, RuleConfig.empty()));
    }

    @ParameterizedTest
    @EnumSource(value = RuleKind.class, names = {"NULL_CHECK", "DUPLICATE_CHECK"})
    @DisplayName("Should default to every column when no configuration is given")
    void testEmptyConfigAccepted(RuleKind kind) {
        QcRule rule = registry.getRule(kind);
        Dataset dataset = Dataset.builder().column("id").row(1).row(2).build();

        assertTrue(rule.configSchema().getRequired().isEmpty());
        assertTrue(rule.execute(dataset, RuleConfig.empty()).isPassed());
    }

    @ParameterizedTest
    @EnumSource(value = RuleKind.class, names = {"RANGE_CHECK", "DATATYPE_CHECK", "PATTERN_CHECK",
            "UNIQUENESS_CHECK", "VALUE_SET_CHECK"})
    @DisplayName("Should name the first missing required field")
    void testRequiredFieldNamed(RuleKind kind) {
        QcRule rule = registry.getRule(kind);

        RuleConfigurationException ex = assertThrows(RuleConfigurationException.class,
                () -> rule.validateConfig(RuleConfig.empty()));
        assertEquals("Missing required config field: " + rule.configSchema().getRequired().get(0), ex.getMessage());
    }
}
