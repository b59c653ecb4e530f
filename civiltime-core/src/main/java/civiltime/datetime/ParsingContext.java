package civiltime.datetime;

import java.time.format.DateTimeParseException;

/**
 * The cursor over the parsed text and the fields collected so far.
 */
class ParsingContext {
    int offset;
    final int length;
    final String datetime;

    // Collected fields, null when the template doesn't provide them
    Long year;
    Integer century;
    Integer yearOfCentury;
    Integer month;
    Integer day;
    Integer dayOfYear;
    Integer hour;
    Integer hour12;
    Boolean pm;
    Integer minute;
    Integer second;
    int nano;
    Integer utcOffset;
    String abbreviation;
    Long epochSeconds;

    ParsingContext(String datetime) {
        this.offset = 0;
        this.length = datetime.length();
        this.datetime = datetime;
    }

    boolean atEnd() {
        return offset >= length;
    }

    void skipSpaces() {
        while (offset < length && Character.isWhitespace(datetime.charAt(offset))) {
            offset++;
        }
    }

    String findWord() {
        int startWord = offset;
        while (offset < length && isWordCharacter(datetime.charAt(offset))) {
            offset++;
        }
        return datetime.substring(startWord, offset);
    }

    private static boolean isWordCharacter(char c) {
        return Character.isLetterOrDigit(c) || c == '+' || c == '-';
    }

    /**
     * Parse a decimal number of at most {@code maxDigits} digits, with an optional sign if {@code signed}.
     */
    long parseLong(int maxDigits, boolean signed) {
        int startNumber = offset;
        long sign = 1;
        if (signed && offset < length && (datetime.charAt(offset) == '-' || datetime.charAt(offset) == '+')) {
            sign = datetime.charAt(offset) == '-' ? -1 : 1;
            offset++;
        }
        int startDigits = offset;
        long result = 0;
        while (offset < length && isDigit(datetime.charAt(offset)) && (offset - startDigits) < maxDigits) {
            int digit = datetime.charAt(offset) - '0';
            if (result > (Long.MAX_VALUE - digit) / 10) {
                offset = startNumber;
                throw parseException("Number out of range");
            }
            result = result * 10 + digit;
            offset++;
        }
        if (startDigits == offset) {
            offset = startNumber;
            throw parseException("Failed to parse number");
        }
        return sign * result;
    }

    /**
     * Parse an unsigned number of at most {@code maxDigits} digits and check its range.
     */
    int parseInt(String field, int maxDigits, int min, int max) {
        int startNumber = offset;
        long value = parseLong(maxDigits, false);
        if (value < min || value > max) {
            offset = startNumber;
            throw parseException(String.format("Field %s out of range: %d", field, value));
        }
        return (int) value;
    }

    /**
     * Parse fractional digits, without the decimal mark. Digits past the nanoseconds are dropped.
     */
    int parseNano() {
        int startPos = offset;
        int frac = 0;
        while (offset < length && isDigit(datetime.charAt(offset))) {
            if (offset - startPos < 9) {
                frac = frac * 10 + (datetime.charAt(offset) - '0');
            }
            offset++;
        }
        if (startPos == offset) {
            throw parseException("Failed to parse fraction of second");
        }
        return FormatUtil.parseNanos(frac, Math.min(9, offset - startPos));
    }

    /**
     * An optional decimal mark followed by fractional digits.
     */
    int parseOptionalNano() {
        if (offset + 1 < length && (datetime.charAt(offset) == '.' || datetime.charAt(offset) == ',') && isDigit(datetime.charAt(offset + 1))) {
            offset++;
            return parseNano();
        } else {
            return 0;
        }
    }

    /**
     * Parse a numeric offset: {@code Z}, {@code ±hh}, {@code ±hhmm}, {@code ±hh:mm} or {@code ±hh:mm:ss}.
     * @return the offset in seconds east of UTC
     */
    int extractOffset() {
        if (offset == length) {
            throw parseException("Zone offset required");
        }
        char first = datetime.charAt(offset);
        if (first == 'Z' || first == 'z') {
            offset++;
            return 0;
        }
        if (first != '+' && first != '-') {
            throw parseException("Missing or invalid zone offset");
        }
        int sign = first == '-' ? -1 : 1;
        offset++;
        int hour = parseFixed("offset hours", 24);
        int minute = 0;
        int second = 0;
        boolean colon = skipIf(':');
        if (offset < length && isDigit(datetime.charAt(offset))) {
            minute = parseFixed("offset minutes", 59);
            if (colon ? skipIf(':') : offset < length && isDigit(datetime.charAt(offset))) {
                second = parseFixed("offset seconds", 59);
            }
        } else if (colon) {
            throw parseException("Missing offset minutes");
        }
        return sign * (hour * 3600 + minute * 60 + second);
    }

    // Exactly two digits
    private int parseFixed(String field, int max) {
        if (offset + 2 > length || ! isDigit(datetime.charAt(offset)) || ! isDigit(datetime.charAt(offset + 1))) {
            throw parseException("Two digits expected for " + field);
        }
        return parseInt(field, 2, 0, max);
    }

    /**
     * Match one name from the list, the full name or its three first letters, ignoring case.
     * @return the index of the name
     */
    int parseName(String[] names) {
        for (int i = 0; i < names.length; i++) {
            if (datetime.regionMatches(true, offset, names[i], 0, names[i].length())) {
                offset += names[i].length();
                return i;
            }
        }
        for (int i = 0; i < names.length; i++) {
            if (datetime.regionMatches(true, offset, names[i], 0, 3)) {
                offset += 3;
                return i;
            }
        }
        throw parseException("Unknown name");
    }

    boolean skipIf(char expected) {
        if (offset < length && datetime.charAt(offset) == expected) {
            offset++;
            return true;
        } else {
            return false;
        }
    }

    void checkLiteral(String expected) {
        if (! datetime.startsWith(expected, offset)) {
            throw parseException("Expected \"" + expected + "\"");
        }
        offset += expected.length();
    }

    DateTimeParseException parseException(String message) {
        return new DateTimeParseException(String.format("Failed to parse date \"%s\": %s", datetime, message), datetime, Math.min(offset, length));
    }

    DateTimeParseException parseException(String message, Throwable ex) {
        return new DateTimeParseException(String.format("Failed to parse date \"%s\": %s", datetime, message), datetime, Math.min(offset, length), ex);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

}
