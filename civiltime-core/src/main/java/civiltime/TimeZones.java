package civiltime;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import civiltime.datetime.ParseResult;
import civiltime.datetime.TimeFormatter;
import civiltime.registry.LoadResult;
import civiltime.registry.ZoneRegistry;
import civiltime.zone.CivilConversion;
import civiltime.zone.TimeConversion;
import civiltime.zone.TimeZone;

/**
 * Entry point for the common operations, backed by a process-wide {@link ZoneRegistry} reading the system's
 * zoneinfo directory.
 */
public final class TimeZones {

    private static final Logger logger = LogManager.getLogger();

    public static final String LOCALZONE_PROPERTY = "civiltime.localzone";

    private static final ZoneRegistry REGISTRY = ZoneRegistry.getBuilder().build();
    private static final Map<String, TimeFormatter> formattersCache = new ConcurrentHashMap<>();

    private TimeZones() {
    }

    public static ZoneRegistry getRegistry() {
        return REGISTRY;
    }

    public static LoadResult load(String name) {
        return REGISTRY.load(name);
    }

    public static TimeZone utc() {
        return TimeZone.utc();
    }

    /**
     * The zone of the environment: the {@code civiltime.localzone} property, the {@code TZ} environment
     * variable or the JVM's default zone, in that order. UTC if it can't be loaded.
     */
    public static TimeZone local() {
        return local(REGISTRY);
    }

    static TimeZone local(ZoneRegistry registry) {
        String name = resolveLocalName();
        LoadResult result = registry.load(name);
        if (result.isSuccess()) {
            return result.getZone();
        } else {
            logger.warn("Unable to use local zone {}, using UTC: {}", name, Helpers.resolveThrowableException(result.getError()));
            return TimeZone.utc();
        }
    }

    static String resolveLocalName() {
        String name = System.getProperty(LOCALZONE_PROPERTY);
        if (name == null || name.isBlank()) {
            name = System.getenv("TZ");
        }
        if (name != null && name.startsWith(":")) {
            name = name.substring(1);
        }
        if (name == null || name.isBlank()) {
            name = ZoneId.systemDefault().getId();
        }
        return name.trim();
    }

    public static TimeConversion convert(Instant instant, TimeZone zone) {
        return zone.convert(instant);
    }

    public static CivilConversion convert(LocalDateTime civil, TimeZone zone) {
        return zone.convert(civil);
    }

    /**
     * The civil time of an instant, always defined.
     */
    public static LocalDateTime toCivil(Instant instant, TimeZone zone) {
        return zone.convert(instant).civil();
    }

    /**
     * A single instant for a civil time: the transition for a skipped time, the earliest reading otherwise.
     * Increasing civil times give non-decreasing instants.
     */
    public static Instant toInstant(LocalDateTime civil, TimeZone zone) {
        CivilConversion conversion = zone.convert(civil);
        return conversion.kind() == CivilConversion.Kind.SKIPPED ? conversion.trans() : conversion.pre();
    }

    public static String format(String template, Instant instant, TimeZone zone) {
        return formatter(template, zone).print(instant);
    }

    public static ParseResult parse(String template, String text, TimeZone zone) {
        return formatter(template, zone).parse(text);
    }

    private static TimeFormatter formatter(String template, TimeZone zone) {
        return formattersCache.computeIfAbsent(template, TimeFormatter::of).withZone(zone);
    }

}
