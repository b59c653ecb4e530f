package civiltime.datetime;

/**
 * Prints a UTC offset. {@code %z} and {@code %Ez} drop the seconds of offsets like the -04:56:02 of
 * New York's LMT, so parsing their output is off by those seconds. {@code %E*z} keeps them.
 */
@FunctionalInterface
interface AppendOffset {

    StringBuilder append(StringBuilder sb, int utcOffset);

    static AppendOffset resolve(String directive) {
        switch (directive) {
        case "%z":
            return (sb, o) -> FormatUtil.appendFormattedSecondOffset(o, 2, ' ', sb);
        case "%Ez":
            return (sb, o) -> FormatUtil.appendFormattedSecondOffset(o, 2, ':', sb);
        case "%E*z":
            return (sb, o) -> FormatUtil.appendFormattedSecondOffset(o, 3, ':', sb);
        default:
            throw new IllegalArgumentException("Not an offset directive: " + directive);
        }
    }

}
