package com.stagegraph.definition.model;

import java.util.Objects;

/**
 * Warning shown when a user tries to move past an optional stage without running it.
 * The skip is permitted once {@link #getMaxWarnings()} warnings were shown.
 */
public final class SkipWarning {

    public static final int DEFAULT_MAX_WARNINGS = 2;

    private final String shortText;
    private final String reason;
    private final int maxWarnings;

    public SkipWarning(String shortText, String reason, Integer maxWarnings) {
        this.shortText = shortText != null ? shortText : "";
        this.reason = reason != null ? reason : "";
        this.maxWarnings = maxWarnings != null ? maxWarnings : DEFAULT_MAX_WARNINGS;
    }

    /** One-line warning text. */
    public String getShortText() {
        return shortText;
    }

    /** Detailed explanation, shown from the second warning on. */
    public String getReason() {
        return reason;
    }

    public int getMaxWarnings() {
        return maxWarnings;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SkipWarning that = (SkipWarning) o;
        return maxWarnings == that.maxWarnings && shortText.equals(that.shortText) && reason.equals(that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(shortText, reason, maxWarnings);
    }
}
