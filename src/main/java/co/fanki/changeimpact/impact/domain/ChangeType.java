package co.fanki.changeimpact.impact.domain;

import java.util.Locale;

/**
 * The character of a proposed change.
 *
 * <p>Each type scales the propagated impact of every component in the
 * graph. Values that do not name a known type fall back to
 * {@link #OTHER}, which leaves scores untouched.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum ChangeType {

    /** Changes to a published contract. */
    CONTRACT("contract", 1.5),

    /** Changes to an implementation behind a stable contract. */
    IMPLEMENTATION("implementation", 1.2),

    /** Changes to resource usage (memory, connections, storage). */
    RESOURCE("resource", 1.3),

    /** Anything else, including unrecognized values. */
    OTHER("other", 1.0);

    private final String value;

    private final double multiplier;

    ChangeType(final String theValue, final double theMultiplier) {
        this.value = theValue;
        this.multiplier = theMultiplier;
    }

    /**
     * Returns the lowercase name used in change specification documents.
     *
     * @return the document value
     */
    public String value() {
        return value;
    }

    /**
     * Returns the factor applied to every propagated score.
     *
     * @return the multiplier, at least 1.0
     */
    public double multiplier() {
        return multiplier;
    }

    /**
     * Checks whether the given raw value names one of the known types.
     *
     * @param raw the raw value, may be null
     * @return true if it matches the value of one of the types
     */
    public static boolean isRecognized(final String raw) {
        return raw != null && fromValue(raw).value.equals(
                raw.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Resolves a raw document value, ignoring case.
     *
     * @param raw the raw value, may be null
     * @return the matching type, or {@link #OTHER} when unknown
     */
    public static ChangeType fromValue(final String raw) {
        if (raw == null) {
            return OTHER;
        }
        final String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (final ChangeType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        return OTHER;
    }

}
