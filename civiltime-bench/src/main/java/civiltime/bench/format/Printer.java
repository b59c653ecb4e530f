package civiltime.bench.format;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
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

import civiltime.datetime.TimeFormatter;

@BenchmarkMode(Mode.SampleTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@State(Scope.Benchmark)
public class Printer {

    @Param({"UTC", "America/New_York"})
    public String zoneName;

    private Instant instant;
    private TimeFormatter formatter;
    private DateTimeFormatter dtf;

    @Setup
    public void setup() throws Exception {
        instant = Instant.ofEpochMilli(ThreadLocalRandom.current().nextLong(System.currentTimeMillis()));
        formatter = TimeFormatter.of(CivilTimeRFC3339.TEMPLATE).withZone(Scanner.loadZone(zoneName));
        dtf = DateTimeFormatter.ISO_OFFSET_DATE_TIME.withZone(ZoneId.of(zoneName));
        String civil = formatter.print(instant);
        String java = dtf.format(instant);
        if (! Instant.from(DateTimeFormatter.ISO_OFFSET_DATE_TIME.parse(civil)).equals(Instant.from(DateTimeFormatter.ISO_OFFSET_DATE_TIME.parse(java)))) {
            throw new IllegalStateException("Different printing: " + civil + " and " + java);
        }
    }

    @Benchmark
    public String civilTime() {
        return formatter.print(instant);
    }

    @Benchmark
    public String javaDtf() {
        return dtf.format(instant);
    }

}
