package civiltime.datetime;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.module.SimpleSerializers;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;

import civiltime.zone.CivilConversion;
import civiltime.zone.TimeConversion;
import civiltime.zone.TimeZone;

/**
 * Serializers for the zone types, instants are written as RFC 3339 strings, or as numbers when
 * {@link SerializationFeature#WRITE_DATES_AS_TIMESTAMPS} is enabled.
 */
public class JacksonModule extends SimpleModule {

    private static final TimeFormatter AS_RFC3339 = TimeFormatter.of("%E4Y-%m-%dT%H:%M:%E*S%Ez");
    private static final TimeFormatter AS_CIVIL = TimeFormatter.of("%E4Y-%m-%dT%H:%M:%E*S");
    private static final BigDecimal GIGA = BigDecimal.valueOf(1_000_000_000L);
    private static final int WRITE_DATE_TIMESTAMPS_AS_NANOSECONDS = 1;
    private static final int WRITE_DATES_AS_TIMESTAMPS = 2;

    private static final Map<SerializationFeature, Integer> FEATURES_VALUE = Map.of(
        SerializationFeature.WRITE_DATE_TIMESTAMPS_AS_NANOSECONDS, WRITE_DATE_TIMESTAMPS_AS_NANOSECONDS,
        SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, WRITE_DATES_AS_TIMESTAMPS
    );

    public static class InstantSerializer extends StdSerializer<Instant> {
        private final Map<SerializationConfig, Integer> configurationCache;

        public InstantSerializer(Map<SerializationConfig, Integer> configurationCache) {
            super(Instant.class);
            this.configurationCache = configurationCache;
        }

        @Override
        public void serialize(Instant value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            int activeFeatures = configurationCache.computeIfAbsent(provider.getConfig(), this::getFeatures);
            if ((activeFeatures & WRITE_DATES_AS_TIMESTAMPS) > 0) {
                if ((activeFeatures & WRITE_DATE_TIMESTAMPS_AS_NANOSECONDS) > 0) {
                    gen.writeNumber(asSeconds(value));
                } else {
                    gen.writeNumber(value.toEpochMilli());
                }
            } else {
                gen.writeString(AS_RFC3339.print(value));
            }
        }

        private BigDecimal asSeconds(Instant value) {
            return new BigDecimal(value.getNano()).divide(GIGA, MathContext.UNLIMITED).add(BigDecimal.valueOf(value.getEpochSecond()));
        }

        private Integer getFeatures(SerializationConfig config) {
            return FEATURES_VALUE.keySet()
                                 .stream()
                                 .filter(config::isEnabled)
                                 .mapToInt(FEATURES_VALUE::get)
                                 .reduce(0, Integer::sum);
        }
    }

    /**
     * A civil time has no epoch, so it's always written as a string, without offset.
     */
    public static class LocalDateTimeSerializer extends StdSerializer<LocalDateTime> {
        public LocalDateTimeSerializer() {
            super(LocalDateTime.class);
        }

        @Override
        public void serialize(LocalDateTime value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeString(AS_CIVIL.print(value.toInstant(ZoneOffset.UTC)));
        }
    }

    public static class TimeZoneSerializer extends StdSerializer<TimeZone> {
        public TimeZoneSerializer() {
            super(TimeZone.class);
        }

        @Override
        public void serialize(TimeZone value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeString(value.getName());
        }
    }

    public static class TimeConversionSerializer extends StdSerializer<TimeConversion> {
        public TimeConversionSerializer() {
            super(TimeConversion.class);
        }

        @Override
        public void serialize(TimeConversion value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartObject();
            provider.defaultSerializeField("civil", value.civil(), gen);
            gen.writeNumberField("utcOffset", value.utcOffset());
            gen.writeBooleanField("dst", value.dst());
            gen.writeStringField("abbreviation", value.abbreviation());
            gen.writeEndObject();
        }
    }

    public static class CivilConversionSerializer extends StdSerializer<CivilConversion> {
        public CivilConversionSerializer() {
            super(CivilConversion.class);
        }

        @Override
        public void serialize(CivilConversion value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeStartObject();
            gen.writeStringField("kind", value.kind().name());
            provider.defaultSerializeField("pre", value.pre(), gen);
            provider.defaultSerializeField("trans", value.trans(), gen);
            provider.defaultSerializeField("post", value.post(), gen);
            gen.writeEndObject();
        }
    }

    @Override
    public void setupModule(SetupContext context) {
        Map<SerializationConfig, Integer> configurationCache = new ConcurrentHashMap<>();
        super.setupModule(context);
        SimpleSerializers sers = new SimpleSerializers();
        sers.addSerializer(Instant.class, new InstantSerializer(configurationCache));
        sers.addSerializer(LocalDateTime.class, new LocalDateTimeSerializer());
        sers.addSerializer(TimeZone.class, new TimeZoneSerializer());
        sers.addSerializer(TimeConversion.class, new TimeConversionSerializer());
        sers.addSerializer(CivilConversion.class, new CivilConversionSerializer());
        context.addSerializers(sers);
    }

}
