package civiltime.datetime;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.Year;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import civiltime.TimeZones;
import civiltime.zone.LocalTimeType;
import civiltime.zone.TimeConversion;
import civiltime.zone.TimeZone;

class TemplateFormatter implements TimeFormatter {

    private static final Set<String> UTC_ABBREVIATIONS = Set.of("UTC", "GMT", "Z", "UT");

    private final String template;
    private final List<Directive> directives;
    private final TimeZone zone;

    TemplateFormatter(String template, List<Directive> directives, TimeZone zone) {
        this.template = template;
        this.directives = List.copyOf(directives);
        this.zone = zone;
    }

    @Override
    public String print(Instant instant) {
        TimeConversion conversion = zone.convert(instant);
        StringBuilder sb = new StringBuilder(template.length() + 16);
        for (Directive d : directives) {
            d.print(sb, instant, conversion);
        }
        return sb.toString();
    }

    @Override
    public ParseResult parse(String text) {
        ParsingContext context = new ParsingContext(text);
        try {
            for (Directive d : directives) {
                d.scan(context);
            }
            context.skipSpaces();
            if (! context.atEnd()) {
                throw context.parseException("Illegal trailing data");
            }
            return ParseResult.of(resolve(context));
        } catch (DateTimeParseException ex) {
            return ParseResult.failed(ex);
        }
    }

    private Instant resolve(ParsingContext context) {
        if (context.epochSeconds != null) {
            try {
                return Instant.ofEpochSecond(context.epochSeconds, context.nano);
            } catch (DateTimeException ex) {
                throw context.parseException(ex.getMessage(), ex);
            }
        }
        LocalDateTime civil = resolveCivil(context);
        Integer offset = context.utcOffset;
        if (offset == null && context.abbreviation != null) {
            offset = resolveAbbreviation(context.abbreviation);
        }
        if (offset != null) {
            return Instant.ofEpochSecond(civil.toEpochSecond(ZoneOffset.UTC) - offset, civil.getNano());
        } else {
            return TimeZones.toInstant(civil, zone);
        }
    }

    private LocalDateTime resolveCivil(ParsingContext context) {
        long year;
        if (context.yearOfCentury != null && context.century != null) {
            year = context.century * 100L + context.yearOfCentury;
        } else if (context.yearOfCentury != null) {
            // POSIX pivot: 69-99 are in the 20th century, 00-68 in the 21st
            year = context.yearOfCentury + (context.yearOfCentury >= 69 ? 1900 : 2000);
        } else if (context.year != null) {
            year = context.year;
        } else if (context.century != null) {
            year = context.century * 100L;
        } else {
            year = 1970;
        }
        if (year < Year.MIN_VALUE || year > Year.MAX_VALUE) {
            throw context.parseException("Field year out of range: " + year);
        }
        int hour;
        if (context.hour12 != null) {
            hour = context.hour12 % 12 + (Boolean.TRUE.equals(context.pm) ? 12 : 0);
        } else {
            hour = context.hour != null ? context.hour : 0;
        }
        try {
            LocalDate date;
            if (context.month == null && context.day == null && context.dayOfYear != null) {
                date = LocalDate.ofYearDay((int) year, context.dayOfYear);
            } else {
                date = LocalDate.of((int) year,
                                    context.month != null ? context.month : 1,
                                    context.day != null ? context.day : 1);
            }
            LocalTime time = LocalTime.of(hour,
                                          context.minute != null ? context.minute : 0,
                                          context.second != null ? context.second : 0,
                                          context.nano);
            return LocalDateTime.of(date, time);
        } catch (DateTimeException ex) {
            throw context.parseException(ex.getMessage(), ex);
        }
    }

    /**
     * An abbreviation is only usable if it names a single offset in the zone.
     */
    private Integer resolveAbbreviation(String abbreviation) {
        if (UTC_ABBREVIATIONS.contains(abbreviation)) {
            return 0;
        }
        Set<Integer> offsets = zone.getTypes()
                                   .stream()
                                   .filter(t -> t.abbreviation().equals(abbreviation))
                                   .map(LocalTimeType::utcOffset)
                                   .collect(Collectors.toSet());
        return offsets.size() == 1 ? offsets.iterator().next() : null;
    }

    @Override
    public String getTemplate() {
        return template;
    }

    @Override
    public TimeZone getZone() {
        return zone;
    }

    @Override
    public TimeFormatter withZone(TimeZone zone) {
        return this.zone.equals(zone) ? this : new TemplateFormatter(template, directives, zone);
    }

    @Override
    public String toString() {
        return template;
    }

}
