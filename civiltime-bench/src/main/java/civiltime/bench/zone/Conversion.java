package civiltime.bench.zone;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;

import civiltime.TimeZones;
import civiltime.zone.CivilConversion;
import civiltime.zone.TimeConversion;
import civiltime.zone.TimeZone;

/**
 * Conversions both ways, inside the transition table and past it, where the footer rule is used.
 */
@BenchmarkMode(Mode.SampleTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@State(Scope.Benchmark)
public class Conversion {

    @Param({"America/New_York", "Australia/Lord_Howe", "Europe/Dublin"})
    public String zoneName;

    @Param({"2010", "2100"})
    public int year;

    private TimeZone zone;
    private ZoneId zoneId;
    private Instant instant;
    private LocalDateTime civil;

    @Setup
    public void setup() throws Exception {
        zone = TimeZones.load(zoneName).orElseThrow();
        zoneId = ZoneId.of(zoneName);
        long start = LocalDateTime.of(year, 1, 1, 0, 0).toEpochSecond(ZoneOffset.UTC);
        instant = Instant.ofEpochSecond(start + ThreadLocalRandom.current().nextLong(365L * 86400));
        civil = zone.convert(instant).civil();
    }

    @Benchmark
    public TimeConversion toCivil() {
        return zone.convert(instant);
    }

    @Benchmark
    public CivilConversion toAbsolute() {
        return zone.convert(civil);
    }

    @Benchmark
    public Instant shorthand() {
        return TimeZones.toInstant(civil, zone);
    }

    @Benchmark
    public LocalDateTime javaToCivil() {
        return LocalDateTime.ofInstant(instant, zoneId);
    }

    @Benchmark
    public Instant javaToAbsolute() {
        return civil.atZone(zoneId).toInstant();
    }

}
