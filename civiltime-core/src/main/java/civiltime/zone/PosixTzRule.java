package civiltime.zone;

import java.util.Objects;

/**
 * The recurring rule found in a TZif footer, a POSIX TZ string like {@code EST5EDT,M3.2.0,M11.1.0}.
 * It projects the zone's transitions past the last tabulated one.
 * <p>
 * Start time is expressed in standard local time, end time in daylight local time. Rule times may
 * use the extended hour range -167..167 of TZif version 3.
 */
public final class PosixTzRule {

    public enum DateForm {
        /** {@code Jn}, 1..365, February 29 is never counted */
        JULIAN,
        /** {@code n}, 0..365, February 29 is counted */
        ZERO_BASED,
        /** {@code Mm.w.d}, day d (0 = Sunday) of week w (5 = last) of month m */
        MONTH_WEEK_DAY
    }

    /**
     * When in the year a change happens, and at what local time of that day.
     */
    public record DateRule(DateForm form, int month, int week, int day, int time) {

        long epochDay(long year) {
            switch (form) {
            case JULIAN: {
                long jan1 = CivilMath.daysFromCivil(year, 1, 1);
                int shift = (CivilMath.isLeapYear(year) && day >= 60) ? 1 : 0;
                return jan1 + day - 1 + shift;
            }
            case ZERO_BASED:
                return CivilMath.daysFromCivil(year, 1, 1) + day;
            default: {
                long first = CivilMath.daysFromCivil(year, month, 1);
                long found = first + Math.floorMod(day - CivilMath.dayOfWeek(first), 7) + (week - 1) * 7L;
                long limit = first + CivilMath.daysInMonth(year, month);
                while (found >= limit) {
                    found -= 7;
                }
                return found;
            }
            }
        }

        /**
         * Local seconds of the change in the given year.
         */
        long localSeconds(long year) {
            return epochDay(year) * CivilMath.SECONDS_PER_DAY + time;
        }

        @Override
        public String toString() {
            String date;
            switch (form) {
            case JULIAN:
                date = "J" + day;
                break;
            case ZERO_BASED:
                date = Integer.toString(day);
                break;
            default:
                date = "M" + month + "." + week + "." + day;
            }
            return date + "/" + formatHms(time);
        }
    }

    private static final int DEFAULT_TIME = 2 * 3600;
    // glibc and most readers fall back to the US rules when a DST name has no rule
    private static final String DEFAULT_RULES = ",M3.2.0,M11.1.0";
    private static final int MAX_OFFSET_HOURS = 24;
    private static final int MAX_TIME_HOURS = 167;

    private final String source;
    private final LocalTimeType standard;
    private final LocalTimeType daylight;
    private final DateRule start;
    private final DateRule end;
    private final boolean permanentDst;

    private PosixTzRule(String source, LocalTimeType standard, LocalTimeType daylight, DateRule start, DateRule end) {
        this.source = source;
        this.standard = standard;
        this.daylight = daylight;
        this.start = start;
        this.end = end;
        this.permanentDst = daylight != null && checkPermanentDst();
    }

    public String getSource() {
        return source;
    }

    public LocalTimeType getStandard() {
        return standard;
    }

    /**
     * @return the daylight saving type, or null if the rule has no DST
     */
    public LocalTimeType getDaylight() {
        return daylight;
    }

    public DateRule getStart() {
        return start;
    }

    public DateRule getEnd() {
        return end;
    }

    /**
     * True if the rule changes the wall clock twice a year.
     */
    public boolean hasTransitions() {
        return daylight != null && ! permanentDst;
    }

    /**
     * The type that applies all year long for rules without transitions.
     */
    public LocalTimeType getFixedType() {
        return permanentDst ? daylight : standard;
    }

    /**
     * UTC instant at which daylight saving starts in the given year.
     */
    public long dstStart(long year) {
        return start.localSeconds(year) - standard.utcOffset();
    }

    /**
     * UTC instant at which daylight saving ends in the given year.
     */
    public long dstEnd(long year) {
        return end.localSeconds(year) - daylight.utcOffset();
    }

    // "EST5EDT,0/0,J365/25" style rules: the end of a year meets the start of the next one
    private boolean checkPermanentDst() {
        for (long year : new long[] {2001, 2004}) {
            if (dstEnd(year) != dstStart(year + 1)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Parse a POSIX TZ string, as found in a TZif version 2+ footer.
     * @throws IllegalArgumentException if the string is not a valid rule
     */
    public static PosixTzRule parse(String rule) {
        Objects.requireNonNull(rule);
        Scanner scanner = new Scanner(rule);
        String stdName = scanner.abbreviation();
        int stdOffset = -scanner.hms(MAX_OFFSET_HOURS, true);
        LocalTimeType std = new LocalTimeType(stdOffset, false, stdName);
        if (scanner.atEnd()) {
            return new PosixTzRule(rule, std, null, null, null);
        }
        String dstName = scanner.abbreviation();
        int dstOffset = stdOffset + 3600;
        if (! scanner.atEnd() && scanner.peek() != ',') {
            dstOffset = -scanner.hms(MAX_OFFSET_HOURS, true);
        }
        LocalTimeType dst = new LocalTimeType(dstOffset, true, dstName);
        if (scanner.atEnd()) {
            scanner = new Scanner(DEFAULT_RULES);
        }
        scanner.expect(',');
        DateRule startRule = scanner.dateRule();
        scanner.expect(',');
        DateRule endRule = scanner.dateRule();
        if (! scanner.atEnd()) {
            throw new IllegalArgumentException("Trailing characters in TZ rule \"" + rule + "\"");
        }
        return new PosixTzRule(rule, std, dst, startRule, endRule);
    }

    private static class Scanner {
        private final String text;
        private int offset = 0;

        Scanner(String text) {
            this.text = text;
        }

        boolean atEnd() {
            return offset >= text.length();
        }

        char peek() {
            return text.charAt(offset);
        }

        void expect(char c) {
            if (atEnd() || peek() != c) {
                throw error("expected '" + c + "'");
            }
            offset++;
        }

        String abbreviation() {
            int begin;
            int stop;
            if (! atEnd() && peek() == '<') {
                begin = ++offset;
                while (! atEnd() && peek() != '>') {
                    char c = peek();
                    if (! Character.isLetterOrDigit(c) && c != '+' && c != '-') {
                        throw error("invalid character in quoted name");
                    }
                    offset++;
                }
                stop = offset;
                expect('>');
            } else {
                begin = offset;
                while (! atEnd() && Character.isLetter(peek())) {
                    offset++;
                }
                stop = offset;
            }
            if (stop - begin < 3) {
                throw error("zone name too short");
            }
            return text.substring(begin, stop);
        }

        int hms(int maxHours, boolean signed) {
            int sign = 1;
            if (signed && ! atEnd() && (peek() == '+' || peek() == '-')) {
                sign = peek() == '-' ? -1 : 1;
                offset++;
            }
            int hours = number(0, maxHours);
            int minutes = 0;
            int seconds = 0;
            if (! atEnd() && peek() == ':') {
                offset++;
                minutes = number(0, 59);
                if (! atEnd() && peek() == ':') {
                    offset++;
                    seconds = number(0, 59);
                }
            }
            return sign * (hours * 3600 + minutes * 60 + seconds);
        }

        DateRule dateRule() {
            DateForm form;
            int month = 0;
            int week = 0;
            int day;
            if (! atEnd() && peek() == 'M') {
                offset++;
                form = DateForm.MONTH_WEEK_DAY;
                month = number(1, 12);
                expect('.');
                week = number(1, 5);
                expect('.');
                day = number(0, 6);
            } else if (! atEnd() && peek() == 'J') {
                offset++;
                form = DateForm.JULIAN;
                day = number(1, 365);
            } else {
                form = DateForm.ZERO_BASED;
                day = number(0, 365);
            }
            int time = DEFAULT_TIME;
            if (! atEnd() && peek() == '/') {
                offset++;
                time = hms(MAX_TIME_HOURS, true);
            }
            return new DateRule(form, month, week, day, time);
        }

        int number(int min, int max) {
            int begin = offset;
            long value = 0;
            while (! atEnd() && Character.isDigit(peek()) && offset - begin < 4) {
                value = value * 10 + (peek() - '0');
                offset++;
            }
            if (offset == begin) {
                throw error("number expected");
            }
            if (value < min || value > max) {
                throw error("value " + value + " out of range [" + min + ", " + max + "]");
            }
            return (int) value;
        }

        IllegalArgumentException error(String reason) {
            return new IllegalArgumentException(String.format("Invalid TZ rule \"%s\" at offset %d: %s", text, offset, reason));
        }
    }

    private static String formatHms(int seconds) {
        String sign = seconds < 0 ? "-" : "";
        int abs = Math.abs(seconds);
        return String.format("%s%02d:%02d:%02d", sign, abs / 3600, (abs / 60) % 60, abs % 60);
    }

    @Override
    public boolean equals(Object o) {
        if (o == this) {
            return true;
        }
        if (! (o instanceof PosixTzRule other)) {
            return false;
        }
        return Objects.equals(standard, other.standard) && Objects.equals(daylight, other.daylight)
                       && Objects.equals(start, other.start) && Objects.equals(end, other.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(standard, daylight, start, end);
    }

    @Override
    public String toString() {
        return source;
    }

}
