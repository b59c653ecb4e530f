package civiltime.zone;

import java.util.ArrayList;
import java.util.List;

/**
 * Answers "what applies at instant X" for one zone. A binary search over the table, or past its end,
 * an evaluation of the extrapolation rule around the requested year.
 */
final class TransitionLookup {

    private final long[] times;
    private final int[] typeIndexes;
    private final LocalTimeType[] types;
    private final PosixTzRule rule;
    private final int standardIndex;
    private final int daylightIndex;

    TransitionLookup(List<Transition> transitions, List<LocalTimeType> types, PosixTzRule rule) {
        int size = transitions.size();
        this.times = new long[size];
        this.typeIndexes = new int[size];
        for (int i = 0; i < size; i++) {
            Transition t = transitions.get(i);
            times[i] = t.epochSecond();
            typeIndexes[i] = t.typeIndex();
        }
        this.types = types.toArray(LocalTimeType[]::new);
        if (rule != null && rule.hasTransitions()) {
            this.rule = rule;
            this.standardIndex = types.indexOf(rule.getStandard());
            this.daylightIndex = types.indexOf(rule.getDaylight());
        } else {
            this.rule = null;
            this.standardIndex = -1;
            this.daylightIndex = -1;
        }
    }

    /**
     * Index of the latest table entry at or before {@code epochSecond}, the first one if it's earlier.
     */
    int indexOf(long epochSecond) {
        int low = 0;
        int high = times.length - 1;
        if (epochSecond < times[0]) {
            return 0;
        }
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (times[mid] <= epochSecond) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return low;
    }

    private long lastTime() {
        return times[times.length - 1];
    }

    /**
     * The transition in force at {@code epochSecond}, from the table or synthesized.
     */
    Transition transitionAt(long epochSecond) {
        if (rule != null && epochSecond > lastTime()) {
            Transition found = null;
            for (Transition t : virtualAround(epochSecond)) {
                if (t.epochSecond() <= epochSecond) {
                    found = t;
                }
            }
            if (found != null) {
                return found;
            }
        }
        int index = indexOf(epochSecond);
        return new Transition(times[index], typeIndexes[index]);
    }

    LocalTimeType typeAt(long epochSecond) {
        return types[transitionAt(epochSecond).typeIndex()];
    }

    /**
     * The transition in force at {@code epochSecond}, with the types on both sides.
     */
    ZoneTransition inForce(long epochSecond) {
        Transition t = transitionAt(epochSecond);
        LocalTimeType after = types[t.typeIndex()];
        LocalTimeType before = t.epochSecond() == times[0] ? after : typeAt(t.epochSecond() - 1);
        return new ZoneTransition(t.epochSecond(), before, after);
    }

    /**
     * The earliest transition strictly after {@code epochSecond}, or null if there is none.
     */
    ZoneTransition following(long epochSecond) {
        Transition next = null;
        if (epochSecond < lastTime()) {
            int index = indexOf(epochSecond) + 1;
            if (epochSecond < times[0]) {
                index = 0;
            }
            next = new Transition(times[index], typeIndexes[index]);
        } else if (rule != null) {
            long from = Math.max(epochSecond, lastTime());
            for (Transition t : virtualAround(from)) {
                if (t.epochSecond() > from) {
                    next = t;
                    break;
                }
            }
        }
        if (next == null) {
            return null;
        } else {
            return new ZoneTransition(next.epochSecond(), typeAt(next.epochSecond() - 1), types[next.typeIndex()]);
        }
    }

    /**
     * Synthesized transitions from the year before to the year after the one holding {@code epochSecond},
     * sorted, limited to the ones after the table.
     */
    private List<Transition> virtualAround(long epochSecond) {
        long year = CivilMath.yearFromSeconds(epochSecond + rule.getStandard().utcOffset());
        List<Transition> found = new ArrayList<>(6);
        long last = lastTime();
        for (long y = year - 1; y <= year + 1; y++) {
            long start = rule.dstStart(y);
            long end = rule.dstEnd(y);
            Transition first = new Transition(Math.min(start, end), start < end ? daylightIndex : standardIndex);
            Transition second = new Transition(Math.max(start, end), start < end ? standardIndex : daylightIndex);
            if (first.epochSecond() > last) {
                found.add(first);
            }
            if (second.epochSecond() > last) {
                found.add(second);
            }
        }
        return found;
    }

}
