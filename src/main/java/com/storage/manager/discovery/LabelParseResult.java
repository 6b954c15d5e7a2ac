package com.storage.manager.discovery;

import com.storage.manager.core.model.RegistrationDraft;

import java.util.List;

/**
 * Outcome of parsing one container's labels: valid drafts and rejected groups, each
 * ordered by label index.
 */
public record LabelParseResult(List<Discovered> drafts, List<Rejection> rejections) {

    public LabelParseResult {
        drafts = drafts != null ? List.copyOf(drafts) : List.of();
        rejections = rejections != null ? List.copyOf(rejections) : List.of();
    }

    public static LabelParseResult empty() {
        return new LabelParseResult(List.of(), List.of());
    }

    public boolean isEmpty() {
        return drafts.isEmpty() && rejections.isEmpty();
    }

    /**
     * A label group that passed validation.
     */
    public record Discovered(int index, String container, RegistrationDraft draft) {
    }

    /**
     * A label group that failed validation. Other groups of the same container are unaffected.
     */
    public record Rejection(int index, String container, String reason) {
    }
}
