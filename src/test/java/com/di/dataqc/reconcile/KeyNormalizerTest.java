package com.di.dataqc.reconcile;

import com.di.dataqc.dataset.CellValue;
import com.di.dataqc.dataset.Dataset;
import com.di.dataqc.exception.RuleConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for KeyNormalizer and KeyTransform.
 */
@DisplayName("KeyNormalizer Tests")
class KeyNormalizerTest {

    @Test
    @DisplayName("Should apply transforms in configured order")
    void testTransformOrder() {
        MatchOptions options = MatchOptions.builder()
                .transformations(List.of(KeyTransform.REMOVE_SPECIAL, KeyTransform.NORMALIZE_SPACES, KeyTransform.UPPER))
                .build();
        KeyNormalizer normalizer = new KeyNormalizer(List.of("code"), options);

        assertEquals("AB 12", normalizer.normalize(CellValue.text("  a-b   1.2 ")));
    }

    @Test
    @DisplayName("Should stringify nulls and numbers canonically")
    void testCanonicalText() {
        KeyNormalizer normalizer = new KeyNormalizer(List.of("id"), MatchOptions.defaults());

        assertEquals("", normalizer.normalize(CellValue.nullValue()));
        assertEquals("42", normalizer.normalize(CellValue.number(42.0)));
    }

    @Test
    @DisplayName("Should build composite keys joined for display")
    void testCompositeKey() {
        Dataset dataset = Dataset.builder().column("region").column("id").row("EU ", 7).build();
        KeyNormalizer normalizer = new KeyNormalizer(List.of("region", "id"),
                MatchOptions.builder().ignoreCase(true).ignoreWhitespace(true).build());

        RowKey key = normalizer.keyFor(dataset, 0);
        assertEquals(List.of("eu", "7"), key.parts());
        assertEquals("eu|7", key.display());
        assertEquals(new RowKey(List.of("eu", "7")), key);
    }

    @Test
    @DisplayName("Should resolve transform ids and reject unknown ones")
    void testFromId() {
        assertEquals(KeyTransform.NORMALIZE_SPACES, KeyTransform.fromId(" Normalize_Spaces "));
        assertEquals("abc", KeyTransform.TRIM.apply(" abc "));
        assertEquals("abc", KeyTransform.LOWER.apply("ABC"));
        RuleConfigurationException ex = assertThrows(RuleConfigurationException.class,
                () -> KeyTransform.fromId("reverse"));
        assertTrue(ex.getMessage().startsWith("Unknown transformation: reverse"));
    }
}
