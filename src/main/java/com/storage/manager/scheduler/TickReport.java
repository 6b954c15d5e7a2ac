package com.storage.manager.scheduler;

import com.storage.manager.core.model.RegistrationKey;

import java.time.Instant;
import java.util.List;

/**
 * What one tick did: keys dispatched to workers and keys skipped because they were still locked.
 */
public record TickReport(Instant startedAt, List<RegistrationKey> dispatched, List<RegistrationKey> skipped) {

    public TickReport {
        dispatched = dispatched != null ? List.copyOf(dispatched) : List.of();
        skipped = skipped != null ? List.copyOf(skipped) : List.of();
    }
}
