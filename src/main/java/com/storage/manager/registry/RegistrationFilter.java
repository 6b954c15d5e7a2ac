package com.storage.manager.registry;

import com.storage.manager.core.model.Provenance;
import com.storage.manager.core.model.Registration;

import java.util.Locale;
import java.util.function.Predicate;

/**
 * Criteria for {@link RegistryService#list(RegistrationFilter)}. Null fields match everything.
 *
 * @param volumeContains case-insensitive substring of the volume name
 * @param provenance     required provenance
 * @param hasResult      whether a last result must (true) or must not (false) be present
 */
public record RegistrationFilter(String volumeContains, Provenance provenance, Boolean hasResult)
        implements Predicate<Registration> {

    public RegistrationFilter {
        if (volumeContains != null && volumeContains.isBlank()) {
            volumeContains = null;
        }
    }

    public static RegistrationFilter all() {
        return new RegistrationFilter(null, null, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean test(Registration registration) {
        if (volumeContains != null && !registration.volumeName().toLowerCase(Locale.ROOT)
                .contains(volumeContains.toLowerCase(Locale.ROOT))) {
            return false;
        }
        if (provenance != null && registration.provenance() != provenance) {
            return false;
        }
        return hasResult == null || registration.hasResult() == hasResult;
    }

    public static class Builder {
        private String volumeContains;
        private Provenance provenance;
        private Boolean hasResult;

        public Builder volumeContains(String volumeContains) {
            this.volumeContains = volumeContains;
            return this;
        }

        public Builder provenance(Provenance provenance) {
            this.provenance = provenance;
            return this;
        }

        public Builder hasResult(Boolean hasResult) {
            this.hasResult = hasResult;
            return this;
        }

        public RegistrationFilter build() {
            return new RegistrationFilter(volumeContains, provenance, hasResult);
        }
    }
}
