package civiltime.datetime;

import java.time.Instant;

import civiltime.zone.TimeZone;
import lombok.Setter;

/**
 * Format and parse instants using a strftime-like template. Each TimeFormatter is immutable, so consider
 * caching them.
 */
public interface TimeFormatter {

    String print(Instant instant);

    ParseResult parse(String text);

    String getTemplate();

    TimeZone getZone();

    TimeFormatter withZone(TimeZone zone);

    /**
     * A formatter using UTC, unknown directives are kept as literal.
     */
    static TimeFormatter of(String template) {
        return getBuilder().setTemplate(template).build();
    }

    @Setter
    class Builder {
        private String template;
        private TimeZone zone = TimeZone.utc();
        private UnknownDirectivePolicy unknownDirectivePolicy = UnknownDirectivePolicy.LITERAL;
        private Builder() {
        }
        public TimeFormatter build() {
            if (template == null) {
                throw new IllegalArgumentException("Missing template");
            }
            return new TemplateFormatter(template, TemplateCompiler.compile(template, unknownDirectivePolicy), zone);
        }
    }

    static Builder getBuilder() {
        return new Builder();
    }

}
