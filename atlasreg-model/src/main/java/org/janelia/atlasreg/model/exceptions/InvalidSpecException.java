package org.janelia.atlasreg.model.exceptions;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Raised when an atlas or sample description breaks one or more of its invariants.
 * All violations found are reported at once.
 */
public class InvalidSpecException extends AtlasRegistrationException {

    private final String specId;
    private final List<String> violations;

    public InvalidSpecException(String specId, List<String> violations) {
        super("Invalid specification " + specId + ": " + String.join("; ", violations));
        this.specId = specId;
        this.violations = ImmutableList.copyOf(violations);
    }

    public InvalidSpecException(String specId, String violation) {
        this(specId, ImmutableList.of(violation));
    }

    public String getSpecId() {
        return specId;
    }

    public List<String> getViolations() {
        return violations;
    }
}
