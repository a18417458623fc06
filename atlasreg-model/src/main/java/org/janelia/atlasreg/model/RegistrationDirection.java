package org.janelia.atlasreg.model;

import org.apache.commons.lang3.StringUtils;

public enum RegistrationDirection {
    FORWARD(true, false),
    INVERSE(false, true),
    BOTH(true, true);

    private final boolean forward;
    private final boolean inverse;

    RegistrationDirection(boolean forward, boolean inverse) {
        this.forward = forward;
        this.inverse = inverse;
    }

    public boolean includesForward() {
        return forward;
    }

    public boolean includesInverse() {
        return inverse;
    }

    /**
     * Accepts the enum names and the "source-to-target" / "target-to-source" aliases, case insensitive.
     */
    public static RegistrationDirection fromString(String value) {
        String normalized = StringUtils.trimToEmpty(value).toLowerCase().replace('_', '-');
        switch (normalized) {
            case "forward":
            case "source-to-target":
                return FORWARD;
            case "inverse":
            case "target-to-source":
                return INVERSE;
            case "both":
                return BOTH;
            default:
                throw new IllegalArgumentException("Unknown registration direction: " + value);
        }
    }
}
