package civiltime.datetime;

import java.util.function.IntSupplier;

public class FormatUtil {

    static final String[] MONTH_NAMES = {
            "January", "February", "March", "April", "May", "June",
            "July", "August", "September", "October", "November", "December"
    };
    static final String[] WEEKDAY_NAMES = {
            "Sunday", "Monday", "Tuesday", "Wednesday", "Thursday", "Friday", "Saturday"
    };

    private FormatUtil() {}

    /**
     * Print the significant fractional digits, trailing zeros removed.
     */
    static void printSubSeconds(int fractionsOfSecond, IntSupplier nanoSource, StringBuilder sb) {
        if (fractionsOfSecond > 0 && nanoSource.getAsInt() > 0) {
            sb.append('.');
            printFraction(fractionsOfSecond, nanoSource.getAsInt(), sb);
            // Remove useless 0
            for (int last = sb.length() - 1; sb.charAt(last) == '0'; last--) {
                sb.deleteCharAt(last);
            }
            if (sb.charAt(sb.length() - 1) == '.') {
                sb.deleteCharAt(sb.length() - 1);
            }
        }
    }

    /**
     * Print exactly {@code digits} fractional digits, truncated, without the decimal mark.
     */
    static void printFraction(int digits, int nano, StringBuilder sb) {
        int significant = Math.min(digits, 9);
        appendNumberWithFixedPositions(sb, nano / powerOfTen(9 - significant), significant);
        sb.append("0".repeat(digits - significant));
    }

    static int parseNanos(int value, int digits) {
        return value * powerOfTen(9 - digits);
    }

    /**
     * Return number of digits in base-10 string representation.
     * @param number Non-negative number
     * @return number of digits
     */
    @SuppressWarnings("squid:S3776") // cognitive complexity
    private static int sizeInDigits(long number) {
        int result;
        if (number < 100_000) {
            if (number < 100) {
                result = number < 10 ? 1 : 2;
            } else {
                if (number < 1000) {
                    result = 3;
                } else {
                    result = number < 10_000 ? 4 : 5;
                }
            }
        } else {
            result = 6;
            for (long limit = 1_000_000; number >= limit && result < 19; limit *= 10) {
                result++;
            }
        }
        return result;
    }

    static int powerOfTen(int pow) {
        switch (pow) {
            case 0: return 1;
            case 1: return 10;
            case 2: return 100;
            case 3: return 1_000;
            case 4: return 10_000;
            case 5: return 100_000;
            case 6: return 1_000_000;
            case 7: return 10_000_000;
            case 8: return 100_000_000;
            case 9: return 1_000_000_000;
            default: throw new IllegalArgumentException("Power of ten out of range: " + pow);
        }
    }

    /**
     * Sign-extended number, {@code -1} on 4 positions is {@code -001}.
     */
    static StringBuilder adjustPossiblyNegative(StringBuilder sb, long num, int positions) {
        if (num >= 0) {
            return appendNumberWithFixedPositions(sb, num, positions);
        }
        return appendNumberWithFixedPositions(sb.append('-'), -num, positions - 1);
    }

    public static StringBuilder appendNumberWithFixedPositions(StringBuilder sb, long num, int positions) {
        sb.append("0".repeat(Math.max(0, positions - sizeInDigits(num))));
        return sb.append(num);
    }

    /**
     * Append a numeric UTC offset.
     * @param rank 2 for hours and minutes, 3 to add the seconds
     * @param separator ':' or a space for none
     */
    static StringBuilder appendFormattedSecondOffset(int offsetSeconds, int rank, char separator, StringBuilder sb) {
        sb.append(offsetSeconds < 0 ? '-' : '+');
        int absSeconds = Math.abs(offsetSeconds);
        appendNumberWithFixedPositions(sb, absSeconds / 3600, 2);
        if (rank >= 2) {
            if (separator == ':') {
                sb.append(':');
            }
            appendNumberWithFixedPositions(sb, (absSeconds / 60) % 60, 2);
        }
        if (rank >= 3) {
            if (separator == ':') {
                sb.append(':');
            }
            appendNumberWithFixedPositions(sb, absSeconds % 60, 2);
        }
        return sb;
    }

}
