package civiltime.zone;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A compiled zone: a sorted table of transitions, the interned local time types they reference and an
 * optional extrapolation rule for instants past the table. Immutable, so it can be shared freely between
 * threads.
 * <p>
 * Every zone has at least one transition, the first one is at {@link Transition#BIG_BANG}.
 */
public final class TimeZone {

    private static final TimeZone UTC = new TimeZone("UTC",
                                                     List.of(new Transition(Transition.BIG_BANG, 0)),
                                                     List.of(LocalTimeType.UTC),
                                                     null);

    private final String name;
    private final List<Transition> transitions;
    private final List<LocalTimeType> types;
    private final PosixTzRule extrapolationRule;
    private final TransitionLookup lookup;
    private final CivilConverter converter;

    /**
     * @throws IllegalArgumentException if the table is empty, unsorted, or references a missing type
     */
    public TimeZone(String name, List<Transition> transitions, List<LocalTimeType> types, PosixTzRule extrapolationRule) {
        this.name = Objects.requireNonNull(name);
        this.transitions = List.copyOf(transitions);
        this.types = List.copyOf(types);
        this.extrapolationRule = extrapolationRule;
        if (this.transitions.isEmpty()) {
            throw new IllegalArgumentException("Zone " + name + " without transitions");
        }
        if (this.transitions.get(0).epochSecond() != Transition.BIG_BANG) {
            throw new IllegalArgumentException("Zone " + name + " doesn't start at the big bang");
        }
        long previous = Long.MIN_VALUE;
        for (Transition t : this.transitions) {
            if (t.epochSecond() <= previous) {
                throw new IllegalArgumentException("Zone " + name + " transitions not in increasing order at " + t.epochSecond());
            }
            if (t.typeIndex() < 0 || t.typeIndex() >= this.types.size()) {
                throw new IllegalArgumentException("Zone " + name + " references unknown type " + t.typeIndex());
            }
            previous = t.epochSecond();
        }
        if (extrapolationRule != null && extrapolationRule.hasTransitions()
                    && (! this.types.contains(extrapolationRule.getStandard()) || ! this.types.contains(extrapolationRule.getDaylight()))) {
            throw new IllegalArgumentException("Zone " + name + " rule types are not interned");
        }
        this.lookup = new TransitionLookup(this.transitions, this.types, extrapolationRule);
        this.converter = new CivilConverter(lookup);
    }

    /**
     * The zero-offset zone, no DST, abbreviation "UTC". The same as a zone built without any rules.
     */
    public static TimeZone utc() {
        return UTC;
    }

    public String getName() {
        return name;
    }

    public List<Transition> getTransitions() {
        return transitions;
    }

    public List<LocalTimeType> getTypes() {
        return types;
    }

    public Optional<PosixTzRule> getExtrapolationRule() {
        return Optional.ofNullable(extrapolationRule);
    }

    /**
     * The single answer to "which local time type applies at this instant".
     */
    public LocalTimeType typeAt(Instant instant) {
        return lookup.typeAt(instant.getEpochSecond());
    }

    /**
     * Absolute to civil, never ambiguous.
     * @throws TimeRangeException if the local time doesn't fit in a {@link LocalDateTime}
     */
    public TimeConversion convert(Instant instant) {
        return converter.toCivil(instant);
    }

    /**
     * Civil to absolute, the ambiguity is described in the result.
     */
    public CivilConversion convert(LocalDateTime civil) {
        return converter.toAbsolute(civil);
    }

    /**
     * The first transition strictly after {@code instant} that changes the offset, the DST flag or the abbreviation.
     */
    public Optional<ZoneTransition> nextTransition(Instant instant) {
        long from = instant.getEpochSecond();
        ZoneTransition next = lookup.following(from);
        while (next != null && next.isNoop()) {
            next = lookup.following(next.epochSecond());
        }
        return Optional.ofNullable(next);
    }

    /**
     * The last transition strictly before {@code instant} that changes the offset, the DST flag or the abbreviation.
     */
    public Optional<ZoneTransition> previousTransition(Instant instant) {
        long from = instant.getNano() == 0 ? instant.getEpochSecond() - 1 : instant.getEpochSecond();
        ZoneTransition previous = lookup.inForce(from);
        while (previous.epochSecond() != Transition.BIG_BANG && previous.isNoop()) {
            previous = lookup.inForce(previous.epochSecond() - 1);
        }
        return previous.epochSecond() == Transition.BIG_BANG ? Optional.empty() : Optional.of(previous);
    }

    @Override
    public boolean equals(Object o) {
        if (o == this) {
            return true;
        }
        if (! (o instanceof TimeZone other)) {
            return false;
        }
        return name.equals(other.name) && transitions.equals(other.transitions) && types.equals(other.types)
                       && Objects.equals(extrapolationRule, other.extrapolationRule);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, transitions, types, extrapolationRule);
    }

    @Override
    public String toString() {
        return name;
    }

}
