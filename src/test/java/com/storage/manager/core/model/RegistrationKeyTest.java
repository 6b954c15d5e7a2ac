package com.storage.manager.core.model;

import com.storage.manager.core.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Registration key and result model")
class RegistrationKeyTest {

    @Nested
    @DisplayName("Path normalization")
    class Normalization {

        @Test
        @DisplayName("keeps a leading slash and collapses duplicate and trailing separators")
        void collapsesSeparators() {
            assertEquals("/logs/app", RegistrationKey.normalizePath("logs//app/"));
            assertEquals("/logs/app", RegistrationKey.normalizePath("/logs/./app"));
        }

        @Test
        @DisplayName("'/' and '.' denote the whole volume")
        void volumeRoot() {
            assertEquals("/", RegistrationKey.normalizePath("/"));
            assertEquals("/", RegistrationKey.normalizePath("."));
            assertTrue(RegistrationKey.of("vol", "/").isVolumeRoot());
        }

        @Test
        @DisplayName("folds '..' that stays inside the volume")
        void foldsParentSegments() {
            assertEquals("/b", RegistrationKey.normalizePath("/a/../b"));
        }

        @Test
        @DisplayName("rejects traversal above the volume root")
        void rejectsEscape() {
            ValidationException e = assertThrows(ValidationException.class,
                    () -> RegistrationKey.normalizePath("../../etc"));
            assertTrue(e.getMessage().contains("escapes"));
            assertThrows(ValidationException.class, () -> RegistrationKey.normalizePath("/a/../../b"));
        }

        @Test
        @DisplayName("rejects blank paths and NUL bytes")
        void rejectsBlankAndNul() {
            assertThrows(ValidationException.class, () -> RegistrationKey.normalizePath("  "));
            assertThrows(ValidationException.class, () -> RegistrationKey.normalizePath("/a\0b"));
        }
    }

    @Nested
    @DisplayName("Key identity")
    class Identity {

        @Test
        @DisplayName("equivalent paths produce equal keys")
        void equivalentPathsAreEqual() {
            assertEquals(RegistrationKey.of("vol", "logs/"), RegistrationKey.of(" vol ", "/logs"));
        }

        @Test
        @DisplayName("blank volume names are rejected")
        void blankVolume() {
            assertThrows(ValidationException.class, () -> RegistrationKey.of("", "/"));
        }

        @Test
        @DisplayName("orders by volume name, then path")
        void ordering() {
            List<RegistrationKey> keys = new ArrayList<>(List.of(
                    RegistrationKey.of("b", "/a"),
                    RegistrationKey.of("a", "/z"),
                    RegistrationKey.of("a", "/b")));
            Collections.sort(keys);
            assertEquals(List.of(RegistrationKey.of("a", "/b"), RegistrationKey.of("a", "/z"),
                    RegistrationKey.of("b", "/a")), keys);
        }

        @Test
        @DisplayName("relative path strips the leading separator")
        void relativePath() {
            assertEquals("logs/app", RegistrationKey.of("vol", "/logs/app").relativePath());
            assertEquals("", RegistrationKey.of("vol", "/").relativePath());
        }
    }

    @Nested
    @DisplayName("CleanupResult")
    class Results {

        @Test
        @DisplayName("error summaries are bounded")
        void errorsBounded() {
            List<String> errors = new ArrayList<>();
            for (int i = 0; i < 50; i++) {
                errors.add("error " + i);
            }
            CleanupResult result = new CleanupResult(1, 10, 50, errors, Duration.ofMillis(5),
                    CleanupStatus.COMPLETED, Instant.EPOCH);
            assertEquals(CleanupResult.MAX_ERRORS, result.errors().size());
            assertTrue(result.hasPartialFailures());
        }

        @Test
        @DisplayName("withResult keeps the definition and sets lastRunAt")
        void withResult() {
            Instant created = Instant.parse("2026-03-01T00:00:00Z");
            Registration registration = Registration.create(RegistrationKey.of("vol", "/"), "max_size",
                    Map.of("max_bytes", 10L), null, Provenance.API, created);
            Instant completed = created.plusSeconds(60);
            Registration updated = registration.withResult(CleanupResult.compliant(Duration.ZERO, completed));

            assertEquals(completed, updated.lastRunAt());
            assertEquals(created, updated.createdAt());
            assertTrue(updated.hasResult());
            assertFalse(updated.lastResult().hasPartialFailures());
        }
    }
}
