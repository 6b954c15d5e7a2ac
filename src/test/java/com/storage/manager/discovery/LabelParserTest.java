package com.storage.manager.discovery;

import com.storage.manager.algorithm.AlgorithmType;
import com.storage.manager.core.model.RegistrationDraft;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LabelParser")
class LabelParserTest {

    private final LabelParser parser = new LabelParser(AlgorithmType.catalog());

    @Test
    @DisplayName("extracts indexed groups in index order and ignores foreign labels")
    void indexedGroups() {
        Map<String, String> labels = new HashMap<>();
        labels.put("storage-manager.1.volume", "camera-footage");
        labels.put("storage-manager.1.path", "/recordings");
        labels.put("storage-manager.1.algorithm", "max_size");
        labels.put("storage-manager.1.max_bytes", "12345");
        labels.put("storage-manager.0.volume", "protected-container_logs");
        labels.put("storage-manager.0.path", "/");
        labels.put("storage-manager.0.algorithm", "remove_before_date");
        labels.put("storage-manager.0.max_age_days", "14");
        labels.put("storage-manager.0.description", "keep logs");
        labels.put("other.label", "ignored");
        labels.put("storage-manager.enabled", "true");

        LabelParseResult result = parser.parse("app", labels);

        assertTrue(result.rejections().isEmpty());
        assertEquals(List.of(0, 1), result.drafts().stream().map(LabelParseResult.Discovered::index).toList());

        RegistrationDraft first = result.drafts().get(0).draft();
        assertEquals("protected-container_logs", first.volumeName());
        assertEquals("/", first.path());
        assertEquals("remove_before_date", first.algorithm());
        assertEquals(Map.of("max_age_days", "14"), first.params());
        assertEquals("keep logs", first.description());

        RegistrationDraft second = result.drafts().get(1).draft();
        assertEquals("camera-footage", second.volumeName());
        assertEquals("/recordings", second.path());
        assertEquals(Map.of("max_bytes", "12345"), second.params());
        assertNull(second.description());
        assertEquals("app", result.drafts().get(1).container());
    }

    @Test
    @DisplayName("an invalid group is rejected without affecting the others")
    void independentGroups() {
        Map<String, String> labels = new HashMap<>();
        labels.put("storage-manager.0.volume", "logs");
        labels.put("storage-manager.0.algorithm", "max_size");
        labels.put("storage-manager.0.max_bytes", "10");
        labels.put("storage-manager.1.volume", "logs");
        labels.put("storage-manager.1.path", "/ok");
        labels.put("storage-manager.1.algorithm", "keep_n_latest");
        labels.put("storage-manager.1.keep_count", "3");
        labels.put("storage-manager.2.volume", "logs");
        labels.put("storage-manager.2.path", "../../etc");
        labels.put("storage-manager.2.algorithm", "max_size");
        labels.put("storage-manager.2.max_bytes", "10");
        labels.put("storage-manager.3.volume", "logs");
        labels.put("storage-manager.3.path", "/x");
        labels.put("storage-manager.3.algorithm", "max_size");
        labels.put("storage-manager.3.max_bytes", "lots");

        LabelParseResult result = parser.parse("web", labels);

        assertEquals(1, result.drafts().size());
        assertEquals("/ok", result.drafts().get(0).draft().path());
        assertEquals(List.of(0, 2, 3), result.rejections().stream().map(LabelParseResult.Rejection::index).toList());
        assertTrue(result.rejections().get(0).reason().contains("path"));
        assertEquals("web", result.rejections().get(0).container());
    }

    @Test
    @DisplayName("unknown parameters and algorithms reject the group")
    void schemaErrors() {
        LabelParseResult result = parser.parse("c", Map.of(
                "storage-manager.0.volume", "v",
                "storage-manager.0.path", "/",
                "storage-manager.0.algorithm", "shred",
                "storage-manager.1.volume", "v",
                "storage-manager.1.path", "/a",
                "storage-manager.1.algorithm", "max_size",
                "storage-manager.1.max_bytes", "1",
                "storage-manager.1.colour", "blue"));

        assertTrue(result.drafts().isEmpty());
        assertEquals(2, result.rejections().size());
    }

    @Test
    @DisplayName("honors a custom prefix")
    void customPrefix() {
        LabelParser custom = new LabelParser("acme.cleanup", AlgorithmType.catalog());
        Map<String, String> labels = Map.of(
                "acme.cleanup.0.volume", "v",
                "acme.cleanup.0.path", "/",
                "acme.cleanup.0.algorithm", "keep_n_latest",
                "acme.cleanup.0.keep_count", "1",
                "storage-manager.1.volume", "other");

        LabelParseResult result = custom.parse("c", labels);

        assertEquals(1, result.drafts().size());
        assertTrue(result.rejections().isEmpty());
        assertTrue(parser.parse("c", labels).drafts().isEmpty());
    }

    @Test
    @DisplayName("no labels yields an empty result")
    void noLabels() {
        assertTrue(parser.parse("c", Map.of()).isEmpty());
        assertTrue(parser.parse("c", null).isEmpty());
    }
}
