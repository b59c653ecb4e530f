package civiltime.zone;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * The two conversion algorithms, on top of a {@link TransitionLookup}.
 */
final class CivilConverter {

    static final int MAX_REFINEMENTS = 3;

    private static final long MIN_LOCAL = LocalDateTime.MIN.toEpochSecond(ZoneOffset.UTC);
    private static final long MAX_LOCAL = LocalDateTime.MAX.toEpochSecond(ZoneOffset.UTC);

    private final TransitionLookup lookup;

    CivilConverter(TransitionLookup lookup) {
        this.lookup = lookup;
    }

    TimeConversion toCivil(Instant instant) {
        LocalTimeType type = lookup.typeAt(instant.getEpochSecond());
        long local = instant.getEpochSecond() + type.utcOffset();
        if (local < MIN_LOCAL || local > MAX_LOCAL) {
            throw new TimeRangeException("Civil time of " + instant + " in " + type.abbreviation() + " is out of range");
        }
        LocalDateTime civil = LocalDateTime.ofEpochSecond(local, instant.getNano(), ZoneOffset.UTC);
        return new TimeConversion(civil, type.utcOffset(), type.dst(), type.abbreviation());
    }

    CivilConversion toAbsolute(LocalDateTime civil) {
        long local = civil.toEpochSecond(ZoneOffset.UTC);
        int nano = civil.getNano();

        // Trial instant, using the civil fields as if they were UTC, then refined since the offset and the
        // instant depend on each other near a transition
        long candidate = local - lookup.typeAt(local).utcOffset();
        for (int i = 0; i < MAX_REFINEMENTS; i++) {
            long refined = local - lookup.typeAt(candidate).utcOffset();
            if (refined == candidate) {
                break;
            }
            candidate = refined;
        }

        // The transitions bracketing the candidate are the only ones that can hide or repeat the civil time
        ZoneTransition current = lookup.inForce(candidate);
        ZoneTransition previous = current.epochSecond() == Transition.BIG_BANG ? null : lookup.inForce(current.epochSecond() - 1);
        ZoneTransition next = lookup.following(candidate);
        for (ZoneTransition zt : new ZoneTransition[] {previous, current, next}) {
            if (zt == null) {
                continue;
            }
            int before = zt.before().utcOffset();
            int after = zt.after().utcOffset();
            long wallBefore = zt.epochSecond() + before;
            long wallAfter = zt.epochSecond() + after;
            if (after > before && local >= wallBefore && local < wallAfter) {
                return new CivilConversion(CivilConversion.Kind.SKIPPED,
                                           Instant.ofEpochSecond(local - before, nano),
                                           Instant.ofEpochSecond(zt.epochSecond()),
                                           Instant.ofEpochSecond(local - after, nano));
            } else if (after < before && local >= wallAfter && local < wallBefore) {
                return new CivilConversion(CivilConversion.Kind.REPEATED,
                                           Instant.ofEpochSecond(local - before, nano),
                                           Instant.ofEpochSecond(zt.epochSecond()),
                                           Instant.ofEpochSecond(local - after, nano));
            }
        }

        // No interference, find the segment that maps back to the requested fields
        if (local - lookup.typeAt(candidate).utcOffset() != candidate) {
            for (ZoneTransition zt : new ZoneTransition[] {current, previous, next}) {
                if (zt == null) {
                    continue;
                }
                long tried = local - zt.after().utcOffset();
                if (lookup.typeAt(tried).utcOffset() == zt.after().utcOffset()) {
                    candidate = tried;
                    break;
                }
            }
        }
        return CivilConversion.unique(Instant.ofEpochSecond(candidate, nano));
    }

}
