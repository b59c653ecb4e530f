package civiltime.datetime;

import java.time.Instant;

import civiltime.zone.TimeConversion;

/**
 * One compiled element of a template: a literal, a run of white spaces, or a conversion specification.
 */
final class Directive {

    @FunctionalInterface
    interface Printer {
        void print(StringBuilder sb, Instant instant, TimeConversion conversion);
    }

    @FunctionalInterface
    interface Scanner {
        void scan(ParsingContext context);
    }

    private final String source;
    private final Printer printer;
    private final Scanner scanner;

    Directive(String source, Printer printer, Scanner scanner) {
        this.source = source;
        this.printer = printer;
        this.scanner = scanner;
    }

    static Directive literal(String text) {
        return new Directive(text, (sb, i, c) -> sb.append(text), c -> c.checkLiteral(text));
    }

    /**
     * Printed as is, matches any amount of white spaces, none included.
     */
    static Directive whitespace(String text) {
        return new Directive(text, (sb, i, c) -> sb.append(text), ParsingContext::skipSpaces);
    }

    void print(StringBuilder sb, Instant instant, TimeConversion conversion) {
        printer.print(sb, instant, conversion);
    }

    void scan(ParsingContext context) {
        scanner.scan(context);
    }

    String getSource() {
        return source;
    }

    @Override
    public String toString() {
        return source;
    }

}
