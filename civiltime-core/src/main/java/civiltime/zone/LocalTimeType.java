package civiltime.zone;

import java.util.Objects;

/**
 * One local time regime of a zone: the offset east of UTC, the DST flag and the abbreviation.
 * Instances are interned by the rule compiler, many transitions share one of them.
 */
public record LocalTimeType(int utcOffset, boolean dst, String abbreviation) {

    public static final LocalTimeType UTC = new LocalTimeType(0, false, "UTC");

    // RFC 8536 advises keeping offsets within [-25h, +26h)
    static final int MAX_OFFSET = 26 * 3600;

    public LocalTimeType {
        Objects.requireNonNull(abbreviation);
        if (utcOffset <= -MAX_OFFSET || utcOffset >= MAX_OFFSET) {
            throw new IllegalArgumentException("UTC offset out of range: " + utcOffset);
        }
    }

    /**
     * True if both types give the same wall clock reading, ignoring the abbreviation.
     */
    public boolean sameOffset(LocalTimeType other) {
        return utcOffset == other.utcOffset;
    }

    @Override
    public String toString() {
        return String.format("%s(%+d%s)", abbreviation, utcOffset, dst ? ", dst" : "");
    }

}
