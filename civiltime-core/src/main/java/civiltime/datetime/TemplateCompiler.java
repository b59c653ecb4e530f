package civiltime.datetime;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static civiltime.datetime.FormatUtil.MONTH_NAMES;
import static civiltime.datetime.FormatUtil.WEEKDAY_NAMES;
import static civiltime.datetime.FormatUtil.adjustPossiblyNegative;
import static civiltime.datetime.FormatUtil.appendNumberWithFixedPositions;

/**
 * Turns a strftime-like template in a list of {@link Directive}. A template is first split in tokens, composite
 * conversions like {@code %F} being expanded, then each token is resolved, knowing what follows it.
 */
class TemplateCompiler {

    private enum Kind {
        LITERAL,
        SPACE,
        CONVERSION,
    }

    private record Token(Kind kind, String text) { }

    private static final Set<String> NUMERIC_CONVERSIONS = Set.of(
            "%Y", "%E4Y", "%y", "%C", "%m", "%d", "%e", "%j", "%H", "%I", "%M", "%S", "%u", "%w", "%s"
    );

    // Years can use up to 10 digits, the full range of a LocalDateTime
    private static final int MAX_YEAR_DIGITS = 10;

    private TemplateCompiler() {
    }

    static List<Directive> compile(String template, UnknownDirectivePolicy policy) {
        List<Token> tokens = new ArrayList<>();
        tokenize(template, tokens);
        List<Directive> directives = new ArrayList<>(tokens.size());
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            switch (token.kind) {
            case LITERAL:
                directives.add(Directive.literal(token.text));
                break;
            case SPACE:
                directives.add(Directive.whitespace(token.text));
                break;
            default:
                boolean nextNumeric = i + 1 < tokens.size() && isNumeric(tokens.get(i + 1));
                Directive d = resolveConversion(token.text, nextNumeric);
                if (d != null) {
                    directives.add(d);
                } else if (policy == UnknownDirectivePolicy.FAIL) {
                    throw new FormatDirectiveException(template, token.text);
                } else {
                    directives.add(Directive.literal(token.text));
                }
            }
        }
        return directives;
    }

    private static void tokenize(String template, List<Token> tokens) {
        StringBuilder literal = new StringBuilder();
        int i = 0;
        while (i < template.length()) {
            char c = template.charAt(i);
            if (Character.isWhitespace(c)) {
                int end = i;
                while (end < template.length() && Character.isWhitespace(template.charAt(end))) {
                    end++;
                }
                flushLiteral(literal, tokens);
                tokens.add(new Token(Kind.SPACE, template.substring(i, end)));
                i = end;
            } else if (c == '%' && i + 1 < template.length()) {
                int end = conversionEnd(template, i);
                String conversion = template.substring(i, end);
                switch (conversion) {
                case "%%":
                    literal.append('%');
                    break;
                case "%n":
                    flushLiteral(literal, tokens);
                    tokens.add(new Token(Kind.SPACE, "\n"));
                    break;
                case "%t":
                    flushLiteral(literal, tokens);
                    tokens.add(new Token(Kind.SPACE, "\t"));
                    break;
                case "%F":
                    flushLiteral(literal, tokens);
                    tokenize("%Y-%m-%d", tokens);
                    break;
                case "%T":
                    flushLiteral(literal, tokens);
                    tokenize("%H:%M:%S", tokens);
                    break;
                case "%R":
                    flushLiteral(literal, tokens);
                    tokenize("%H:%M", tokens);
                    break;
                case "%D":
                    flushLiteral(literal, tokens);
                    tokenize("%m/%d/%y", tokens);
                    break;
                default:
                    flushLiteral(literal, tokens);
                    tokens.add(new Token(Kind.CONVERSION, conversion));
                }
                i = end;
            } else {
                literal.append(c);
                i++;
            }
        }
        flushLiteral(literal, tokens);
    }

    private static void flushLiteral(StringBuilder literal, List<Token> tokens) {
        if (literal.length() > 0) {
            tokens.add(new Token(Kind.LITERAL, literal.toString()));
            literal.setLength(0);
        }
    }

    /**
     * Find the end of the conversion starting at {@code start}, the {@code E} modifier can be followed by
     * {@code *} or by a decimal count.
     */
    private static int conversionEnd(String template, int start) {
        int i = start + 1;
        if (template.charAt(i) != 'E') {
            return i + 1;
        }
        i++;
        if (i < template.length() && template.charAt(i) == '*') {
            i++;
        } else {
            while (i < template.length() && Character.isDigit(template.charAt(i))) {
                i++;
            }
        }
        return Math.min(i + 1, template.length());
    }

    private static boolean isNumeric(Token token) {
        if (token.kind != Kind.CONVERSION) {
            return false;
        } else if (NUMERIC_CONVERSIONS.contains(token.text)) {
            return true;
        } else {
            return fractionDigits(token.text, 'S') != Integer.MIN_VALUE || fractionDigits(token.text, 'f') != Integer.MIN_VALUE;
        }
    }

    /**
     * The fractional precision of {@code %E#S}, {@code %E*S}, {@code %E#f} or {@code %E*f}, -1 for {@code *}.
     * @return Integer.MIN_VALUE if it's not such a conversion
     */
    private static int fractionDigits(String conversion, char suffix) {
        if (conversion.length() < 4 || ! conversion.startsWith("%E") || conversion.charAt(conversion.length() - 1) != suffix) {
            return Integer.MIN_VALUE;
        }
        String count = conversion.substring(2, conversion.length() - 1);
        if ("*".equals(count)) {
            return -1;
        }
        try {
            int digits = Integer.parseInt(count);
            return count.chars().allMatch(Character::isDigit) ? digits : Integer.MIN_VALUE;
        } catch (NumberFormatException ex) {
            return Integer.MIN_VALUE;
        }
    }

    @SuppressWarnings("squid:S1479") // Many cases in the switch
    private static Directive resolveConversion(String conversion, boolean nextNumeric) {
        switch (conversion) {
        case "%Y":
        case "%E4Y": {
            int maxDigits = nextNumeric ? 4 : MAX_YEAR_DIGITS;
            return new Directive(conversion,
                                 (sb, i, c) -> adjustPossiblyNegative(sb, c.civil().getYear(), 4),
                                 c -> c.year = c.parseLong(maxDigits, true));
        }
        case "%y":
            return new Directive(conversion,
                                 (sb, i, c) -> appendNumberWithFixedPositions(sb, Math.floorMod(c.civil().getYear(), 100), 2),
                                 c -> c.yearOfCentury = c.parseInt("year of century", 2, 0, 99));
        case "%C": {
            int maxDigits = nextNumeric ? 2 : MAX_YEAR_DIGITS - 2;
            return new Directive(conversion,
                                 (sb, i, c) -> adjustPossiblyNegative(sb, Math.floorDiv(c.civil().getYear(), 100), 2),
                                 c -> c.century = (int) c.parseLong(maxDigits, true));
        }
        case "%m":
            return new Directive(conversion,
                                 (sb, i, c) -> appendNumberWithFixedPositions(sb, c.civil().getMonthValue(), 2),
                                 c -> c.month = c.parseInt("month", 2, 1, 12));
        case "%d":
            return new Directive(conversion,
                                 (sb, i, c) -> appendNumberWithFixedPositions(sb, c.civil().getDayOfMonth(), 2),
                                 c -> c.day = c.parseInt("day of month", 2, 1, 31));
        case "%e":
            return new Directive(conversion,
                                 (sb, i, c) -> {
                                     int day = c.civil().getDayOfMonth();
                                     sb.append(day < 10 ? " " : "").append(day);
                                 },
                                 c -> {
                                     c.skipSpaces();
                                     c.day = c.parseInt("day of month", 2, 1, 31);
                                 });
        case "%j":
            return new Directive(conversion,
                                 (sb, i, c) -> appendNumberWithFixedPositions(sb, c.civil().getDayOfYear(), 3),
                                 c -> c.dayOfYear = c.parseInt("day of year", 3, 1, 366));
        case "%H":
            return new Directive(conversion,
                                 (sb, i, c) -> appendNumberWithFixedPositions(sb, c.civil().getHour(), 2),
                                 c -> c.hour = c.parseInt("hour", 2, 0, 23));
        case "%I":
            return new Directive(conversion,
                                 (sb, i, c) -> {
                                     int hour = c.civil().getHour() % 12;
                                     appendNumberWithFixedPositions(sb, hour == 0 ? 12 : hour, 2);
                                 },
                                 c -> c.hour12 = c.parseInt("hour", 2, 1, 12));
        case "%M":
            return new Directive(conversion,
                                 (sb, i, c) -> appendNumberWithFixedPositions(sb, c.civil().getMinute(), 2),
                                 c -> c.minute = c.parseInt("minute", 2, 0, 59));
        case "%S":
            return new Directive(conversion,
                                 (sb, i, c) -> appendNumberWithFixedPositions(sb, c.civil().getSecond(), 2),
                                 c -> c.second = c.parseInt("second", 2, 0, 59));
        case "%p":
            return new Directive(conversion,
                                 (sb, i, c) -> sb.append(c.civil().getHour() < 12 ? "AM" : "PM"),
                                 c -> {
                                     if (c.datetime.regionMatches(true, c.offset, "AM", 0, 2)) {
                                         c.pm = false;
                                     } else if (c.datetime.regionMatches(true, c.offset, "PM", 0, 2)) {
                                         c.pm = true;
                                     } else {
                                         throw c.parseException("Expected AM or PM");
                                     }
                                     c.offset += 2;
                                 });
        case "%a":
            return new Directive(conversion,
                                 (sb, i, c) -> sb.append(WEEKDAY_NAMES[c.civil().getDayOfWeek().getValue() % 7], 0, 3),
                                 c -> c.parseName(WEEKDAY_NAMES));
        case "%A":
            return new Directive(conversion,
                                 (sb, i, c) -> sb.append(WEEKDAY_NAMES[c.civil().getDayOfWeek().getValue() % 7]),
                                 c -> c.parseName(WEEKDAY_NAMES));
        case "%b":
        case "%h":
            return new Directive(conversion,
                                 (sb, i, c) -> sb.append(MONTH_NAMES[c.civil().getMonthValue() - 1], 0, 3),
                                 c -> c.month = c.parseName(MONTH_NAMES) + 1);
        case "%B":
            return new Directive(conversion,
                                 (sb, i, c) -> sb.append(MONTH_NAMES[c.civil().getMonthValue() - 1]),
                                 c -> c.month = c.parseName(MONTH_NAMES) + 1);
        case "%u":
            return new Directive(conversion,
                                 (sb, i, c) -> sb.append(c.civil().getDayOfWeek().getValue()),
                                 c -> c.parseInt("day of week", 1, 1, 7));
        case "%w":
            return new Directive(conversion,
                                 (sb, i, c) -> sb.append(c.civil().getDayOfWeek().getValue() % 7),
                                 c -> c.parseInt("day of week", 1, 0, 6));
        case "%s":
            return new Directive(conversion,
                                 (sb, i, c) -> sb.append(i.getEpochSecond()),
                                 c -> c.epochSeconds = c.parseLong(19, true));
        case "%z":
        case "%Ez":
        case "%E*z": {
            AppendOffset appender = AppendOffset.resolve(conversion);
            return new Directive(conversion,
                                 (sb, i, c) -> appender.append(sb, c.utcOffset()),
                                 c -> c.utcOffset = c.extractOffset());
        }
        case "%Z":
            return new Directive(conversion,
                                 (sb, i, c) -> sb.append(c.abbreviation()),
                                 c -> {
                                     String word = c.findWord();
                                     if (word.isEmpty()) {
                                         throw c.parseException("Zone abbreviation expected");
                                     }
                                     c.abbreviation = word;
                                 });
        default:
            return resolveFraction(conversion);
        }
    }

    private static Directive resolveFraction(String conversion) {
        int secondsDigits = fractionDigits(conversion, 'S');
        int fractionDigits = fractionDigits(conversion, 'f');
        if (secondsDigits != Integer.MIN_VALUE) {
            Directive.Printer printer;
            if (secondsDigits < 0) {
                printer = (sb, i, c) -> {
                    appendNumberWithFixedPositions(sb, c.civil().getSecond(), 2);
                    FormatUtil.printSubSeconds(9, i::getNano, sb);
                };
            } else if (secondsDigits == 0) {
                printer = (sb, i, c) -> appendNumberWithFixedPositions(sb, c.civil().getSecond(), 2);
            } else {
                printer = (sb, i, c) -> {
                    appendNumberWithFixedPositions(sb, c.civil().getSecond(), 2).append('.');
                    FormatUtil.printFraction(secondsDigits, i.getNano(), sb);
                };
            }
            return new Directive(conversion, printer, c -> {
                c.second = c.parseInt("second", 2, 0, 59);
                c.nano = c.parseOptionalNano();
            });
        } else if (fractionDigits < 0 && fractionDigits != Integer.MIN_VALUE) {
            return new Directive(conversion,
                                 (sb, i, c) -> {
                                     int start = sb.length();
                                     FormatUtil.printFraction(9, i.getNano(), sb);
                                     int end = sb.length();
                                     while (end > start + 1 && sb.charAt(end - 1) == '0') {
                                         end--;
                                     }
                                     sb.setLength(end);
                                 },
                                 c -> c.nano = c.parseNano());
        } else if (fractionDigits == 0) {
            return new Directive(conversion, (sb, i, c) -> { }, c -> { });
        } else if (fractionDigits > 0) {
            return new Directive(conversion,
                                 (sb, i, c) -> FormatUtil.printFraction(fractionDigits, i.getNano(), sb),
                                 c -> c.nano = c.parseNano());
        } else {
            return null;
        }
    }

}
