package com.di.dataqc.aspect;

import com.di.dataqc.dataset.Dataset;
import com.di.dataqc.rule.RuleKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for OperationEventAspect context extraction.
 */
@DisplayName("OperationEventAspect Tests")
class OperationEventAspectTest {

    @LogOperation(eventType = "TEST_CONNECTION", parameterNames = {"host", "password", "rows"})
    void annotated(String host, String password, List<String> rows) {
    }

    @Test
    @DisplayName("Should name the method and mask secret parameters")
    void testExtractContext() throws Exception {
        Method method = OperationEventAspectTest.class.getDeclaredMethod("annotated", String.class, String.class, List.class);
        LogOperation annotation = method.getAnnotation(LogOperation.class);

        Map<String, Object> context = OperationEventAspect.extractContext(
                new Object[]{"db.local", "hunter2", List.of("a", "b")}, method, annotation);

        assertEquals("OperationEventAspectTest.annotated", context.get("method"));
        assertEquals("db.local", context.get("host"));
        assertEquals("***", context.get("password"));
        assertEquals("size=2", context.get("rows"));
    }

    @Test
    @DisplayName("Should describe arguments briefly")
    void testDescribe() {
        assertNull(OperationEventAspect.describe(null));
        assertEquals(5, OperationEventAspect.describe(5));
        assertSame(RuleKind.NULL_CHECK, OperationEventAspect.describe(RuleKind.NULL_CHECK));
        assertEquals("host=x;password=***", OperationEventAspect.describe("host=x;password=abc"));
        assertEquals("Dataset[1 rows x 1 columns [id]]",
                OperationEventAspect.describe(Dataset.builder().column("id").row(1).build()));
        assertEquals("size=1", OperationEventAspect.describe(Map.of("k", "v")));
        assertEquals("Object", OperationEventAspect.describe(new Object()));
        assertEquals(203, ((String) OperationEventAspect.describe("x".repeat(500))).length());
    }
}
