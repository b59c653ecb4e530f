package civiltime.zone;

/**
 * Proleptic Gregorian arithmetic on day numbers, usable on the whole {@code long} year range where
 * {@link java.time.LocalDate} stops at ±999,999,999.
 */
public class CivilMath {

    public static final int SECONDS_PER_DAY = 86_400;

    private CivilMath() {}

    public static boolean isLeapYear(long year) {
        return (year & 3) == 0 && (year % 100 != 0 || year % 400 == 0);
    }

    public static int daysInMonth(long year, int month) {
        switch (month) {
        case 2:
            return isLeapYear(year) ? 29 : 28;
        case 4:
        case 6:
        case 9:
        case 11:
            return 30;
        default:
            return 31;
        }
    }

    /**
     * Days since 1970-01-01 for the given date.
     */
    public static long daysFromCivil(long year, int month, int day) {
        long y = month <= 2 ? year - 1 : year;
        long era = Math.floorDiv(y, 400);
        long yearOfEra = y - era * 400;
        long dayOfYear = (153L * (month > 2 ? month - 3 : month + 9) + 2) / 5 + day - 1;
        long dayOfEra = yearOfEra * 365 + yearOfEra / 4 - yearOfEra / 100 + dayOfYear;
        return era * 146_097 + dayOfEra - 719_468;
    }

    /**
     * The year holding the given day number.
     */
    public static long yearFromDays(long epochDay) {
        long z = epochDay + 719_468;
        long era = Math.floorDiv(z, 146_097);
        long dayOfEra = z - era * 146_097;
        long yearOfEra = (dayOfEra - dayOfEra / 1460 + dayOfEra / 36_524 - dayOfEra / 146_096) / 365;
        long dayOfYear = dayOfEra - (365 * yearOfEra + yearOfEra / 4 - yearOfEra / 100);
        long mp = (5 * dayOfYear + 2) / 153;
        return yearOfEra + era * 400 + (mp >= 10 ? 1 : 0);
    }

    public static long yearFromSeconds(long epochSecond) {
        return yearFromDays(Math.floorDiv(epochSecond, SECONDS_PER_DAY));
    }

    /**
     * Day of week with Sunday as 0, 1970-01-01 was a Thursday.
     */
    public static int dayOfWeek(long epochDay) {
        return (int) Math.floorMod(epochDay + 4, 7);
    }

}
