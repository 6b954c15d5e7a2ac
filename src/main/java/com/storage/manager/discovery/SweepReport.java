package com.storage.manager.discovery;

import com.storage.manager.core.model.RegistrationKey;

import java.time.Duration;
import java.util.List;

/**
 * Summary of one discovery sweep.
 *
 * @param containers number of containers inspected
 * @param applied    drafts stored (new, changed or unchanged) with LABEL provenance
 * @param discarded  drafts dropped because an API registration or an earlier container holds the key
 * @param rejected   label groups that failed validation
 * @param pruned     LABEL registrations removed because their labels disappeared
 * @param duration   wall-clock time of the sweep
 */
public record SweepReport(int containers, int applied, int discarded, List<LabelParseResult.Rejection> rejected,
                          List<RegistrationKey> pruned, Duration duration) {

    public SweepReport {
        rejected = rejected != null ? List.copyOf(rejected) : List.of();
        pruned = pruned != null ? List.copyOf(pruned) : List.of();
    }

    @Override
    public String toString() {
        return "SweepReport{containers=" + containers +
                ", applied=" + applied +
                ", discarded=" + discarded +
                ", rejected=" + rejected.size() +
                ", pruned=" + pruned.size() +
                ", durationMs=" + duration.toMillis() + '}';
    }
}
