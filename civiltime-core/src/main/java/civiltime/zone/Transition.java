package civiltime.zone;

import java.time.Instant;

/**
 * An explicit entry of a transition table: from {@code epochSecond} on, the type at {@code typeIndex} applies.
 */
public record Transition(long epochSecond, int typeIndex) {

    /**
     * The first entry of every compiled table, standing for "since the beginning of time".
     */
    public static final long BIG_BANG = Instant.MIN.getEpochSecond();

    public Instant effectiveInstant() {
        return Instant.ofEpochSecond(epochSecond);
    }

}
