package com.di.dataqc.rule.checks;

import com.di.dataqc.dataset.Dataset;
import com.di.dataqc.exception.RuleConfigurationException;
import com.di.dataqc.rule.RuleConfig;
import com.di.dataqc.rule.RuleResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for DataTypeCheckRule.
 */
@DisplayName("DataTypeCheckRule Tests")
class DataTypeCheckRuleTest {

    private final DataTypeCheckRule rule = new DataTypeCheckRule();

    private final Dataset dataset = Dataset.builder()
            .column("value")
            .row(1)
            .row(2.5)
            .row("x")
            .row((Object) null)
            .build();

    private RuleResult check(Dataset data, String type, boolean allowNulls) {
        return rule.execute(data, RuleConfig.of(Map.of(
                "column", "value", "expected_type", type, "allow_nulls", allowNulls)));
    }

    @Test
    @DisplayName("Should accept only integral numbers as integer")
    void testInteger() {
        RuleResult result = check(dataset, "integer", true);

        assertFalse(result.isPassed());
        assertEquals(2, result.getStatistics().get("invalid_count"));
        assertEquals(2, result.getStatistics().get("valid_count"));
        assertEquals(Arrays.asList(2.5, "x"), result.getDetails().get("sample_invalid_values"));
    }

    @Test
    @DisplayName("Should count nulls as invalid when nulls are not allowed")
    void testNullsNotAllowed() {
        assertEquals(3, check(dataset, "integer", false).getStatistics().get("invalid_count"));
    }

    @Test
    @DisplayName("Should accept numeric text as numeric")
    void testNumeric() {
        Dataset data = Dataset.builder().column("value").row(1).row("2.5").row("abc").build();
        RuleResult result = check(data, "numeric", true);
        assertEquals(1, result.getStatistics().get("invalid_count"));
    }

    @Test
    @DisplayName("Should parse date text")
    void testDate() {
        Dataset data = Dataset.builder().column("value").row("2024-01-15").row("15/01/2024").row("soon").build();
        RuleResult result = check(data, "date", true);
        assertEquals(1, result.getStatistics().get("invalid_count"));
    }

    @Test
    @DisplayName("Should validate email addresses")
    void testEmail() {
        Dataset data = Dataset.builder().column("value").row("a@b.com").row("not-an-email").build();
        RuleResult result = check(data, "email", true);
        assertEquals(1, result.getStatistics().get("invalid_count"));
        assertEquals("1 values in 'value' do not match type 'email'", result.getMessage());
    }

    @Test
    @DisplayName("Should accept booleans and their 0/1 forms")
    void testBoolean() {
        Dataset data = Dataset.builder().column("value").row(true).row(0).row("1").row("yes").build();
        assertEquals(1, check(data, "boolean", true).getStatistics().get("invalid_count"));
    }

    @Test
    @DisplayName("Should accept the expected type in any case")
    void testTypeCase() {
        Dataset data = Dataset.builder().column("value").row("a").build();
        assertTrue(check(data, "STRING", true).isPassed());
    }

    @Test
    @DisplayName("Should reject an unknown expected type")
    void testUnknownType() {
        RuleConfigurationException ex = assertThrows(RuleConfigurationException.class,
                () -> check(dataset, "uuid", true));
        assertTrue(ex.getMessage().startsWith("Invalid value for 'expected_type'"));
    }
}
