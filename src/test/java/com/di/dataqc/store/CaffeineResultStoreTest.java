package com.di.dataqc.store;

import com.di.dataqc.config.QcProperties;
import com.di.dataqc.exception.ResourceNotFoundException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for CaffeineResultStore and StoredResult.
 */
@DisplayName("CaffeineResultStore Tests")
class CaffeineResultStoreTest {

    private final CaffeineResultStore store = new CaffeineResultStore(10, 60);

    private static StoredResult result(Object payload) {
        return StoredResult.builder()
                .type(ResultType.FORMULA)
                .sourceIds(List.of("s1", "s2"))
                .payload(payload)
                .build();
    }

    @Test
    @DisplayName("Should assign an id on save")
    void testSave() {
        String id = store.save(result("payload"));

        StoredResult stored = store.getRequired(id);
        assertEquals(id, stored.getId());
        assertEquals(List.of("s1", "s2"), stored.getSourceIds());
        assertEquals("payload", stored.payload(String.class));
        assertNotEquals(id, store.save(result("payload")));
    }

    @Test
    @DisplayName("Should report missing results")
    void testMissing() {
        assertTrue(store.findById("nope").isEmpty());
        assertTrue(store.findById(null).isEmpty());
        ResourceNotFoundException ex = assertThrows(ResourceNotFoundException.class, () -> store.getRequired("nope"));
        assertTrue(ex.getMessage().contains("nope"));
    }

    @Test
    @DisplayName("Should delete a result once")
    void testDelete() {
        String id = store.save(result("payload"));

        assertTrue(store.delete(id));
        assertFalse(store.delete(id));
        assertFalse(store.delete(null));
        assertTrue(store.findById(id).isEmpty());
    }

    @Test
    @DisplayName("Should refuse a payload of another type")
    void testPayloadType() {
        StoredResult stored = result(42);
        assertEquals(42, stored.payload(Integer.class));
        assertThrows(IllegalStateException.class, () -> stored.payload(String.class));
    }

    @Test
    @DisplayName("Should expose stable type ids")
    void testTypeIds() {
        assertEquals("qc_run", ResultType.RULE_BATCH.id());
        assertEquals("multi_comparison", ResultType.RECONCILIATION.id());
    }

    @Test
    @DisplayName("Should be built by Spring from the configured properties")
    void testPropertiesConstructor() throws NoSuchMethodException {
        assertTrue(CaffeineResultStore.class.getConstructor(QcProperties.class).isAnnotationPresent(Autowired.class));

        CaffeineResultStore configured = new CaffeineResultStore(new QcProperties());
        String id = configured.save(result("payload"));
        assertEquals("payload", configured.getRequired(id).payload(String.class));
    }
}
