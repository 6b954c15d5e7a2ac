package com.storage.manager.algorithm;

import com.storage.manager.core.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AlgorithmType catalog")
class AlgorithmTypeTest {

    @Test
    @DisplayName("looks up every built-in strategy by identifier, ignoring case")
    void lookup() {
        assertEquals(AlgorithmType.MAX_SIZE, AlgorithmType.fromId("max_size"));
        assertEquals(AlgorithmType.REMOVE_BEFORE_DATE, AlgorithmType.fromId(" Remove_Before_Date "));
        assertEquals(AlgorithmType.KEEP_N_LATEST, AlgorithmType.fromId("KEEP_N_LATEST"));
        assertEquals("keep_n_latest", AlgorithmType.catalog().get("keep_n_latest").id());
    }

    @Test
    @DisplayName("unknown identifiers are validation errors that list the allowed values")
    void unknown() {
        ValidationException e = assertThrows(ValidationException.class, () -> AlgorithmType.fromId("shred"));
        assertTrue(e.getMessage().contains("max_size"));
        assertThrows(ValidationException.class, () -> AlgorithmType.fromId(""));
        assertThrows(ValidationException.class, () -> AlgorithmType.catalog().get("nope"));
    }

    @Test
    @DisplayName("validation returns canonical parameters with defaults applied")
    void canonicalParams() {
        Map<String, Object> params = AlgorithmType.catalog().get("max_size").validate(Map.of("max_bytes", "1000"));
        assertEquals(1000L, ((Number) params.get("max_bytes")).longValue());
        assertEquals("mtime", params.get("sort_by"));

        assertThrows(ValidationException.class,
                () -> AlgorithmType.catalog().get("max_size").validate(Map.of("max_bytes", 1, "bogus", 2)));
    }
}
