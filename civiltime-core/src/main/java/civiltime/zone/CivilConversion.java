package civiltime.zone;

import java.time.Instant;
import java.util.Objects;

/**
 * Result of a civil to absolute conversion.
 * <ul>
 * <li>{@code pre}: the civil fields read with the offset in force before the nearest transition,</li>
 * <li>{@code trans}: the instant of that transition,</li>
 * <li>{@code post}: the civil fields read with the offset in force after it.</li>
 * </ul>
 * For {@link Kind#UNIQUE}, the three are the same instant. For {@link Kind#SKIPPED}, {@code pre} is later
 * than {@code trans} and {@code post} is earlier. For {@link Kind#REPEATED}, {@code pre} is earlier than
 * {@code trans} and {@code post} is not.
 */
public record CivilConversion(Kind kind, Instant pre, Instant trans, Instant post) {

    public enum Kind {
        UNIQUE,
        SKIPPED,
        REPEATED,
    }

    public CivilConversion {
        Objects.requireNonNull(kind);
        Objects.requireNonNull(pre);
        Objects.requireNonNull(trans);
        Objects.requireNonNull(post);
    }

    public static CivilConversion unique(Instant instant) {
        return new CivilConversion(Kind.UNIQUE, instant, instant, instant);
    }

}
