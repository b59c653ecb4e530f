package civiltime.datetime;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * Either the parsed instant or why the text didn't match the template.
 */
public final class ParseResult {

    private final Instant instant;
    private final DateTimeParseException error;

    private ParseResult(Instant instant, DateTimeParseException error) {
        this.instant = instant;
        this.error = error;
    }

    public static ParseResult of(Instant instant) {
        return new ParseResult(Objects.requireNonNull(instant), null);
    }

    public static ParseResult failed(DateTimeParseException error) {
        return new ParseResult(null, Objects.requireNonNull(error));
    }

    public boolean isSuccess() {
        return instant != null;
    }

    /**
     * @throws NoSuchElementException if the parsing failed
     */
    public Instant getInstant() {
        if (instant == null) {
            throw new NoSuchElementException(error.getMessage());
        }
        return instant;
    }

    /**
     * @return the failure, or null for a success
     */
    public DateTimeParseException getError() {
        return error;
    }

    public Optional<Instant> toOptional() {
        return Optional.ofNullable(instant);
    }

    public Instant orElseThrow() {
        if (instant == null) {
            throw error;
        }
        return instant;
    }

    @Override
    public String toString() {
        return instant != null ? instant.toString() : error.getMessage();
    }

}
