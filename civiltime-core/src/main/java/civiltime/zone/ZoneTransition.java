package civiltime.zone;

import java.time.Instant;

/**
 * A resolved transition, either read from the table or synthesized from the extrapolation rule.
 */
public record ZoneTransition(long epochSecond, LocalTimeType before, LocalTimeType after) {

    public Instant instant() {
        return Instant.ofEpochSecond(epochSecond);
    }

    /**
     * A transition that only changes the abbreviation or nothing at all doesn't move the wall clock.
     */
    public boolean isNoop() {
        return before.equals(after);
    }

    @Override
    public String toString() {
        return String.format("%s: %s -> %s", instant(), before, after);
    }

}
