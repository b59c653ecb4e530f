package civiltime.bench.format;

import java.time.Instant;

import civiltime.datetime.TimeFormatter;

public class CivilTimeRFC3339 extends Scanner {

    public static final String TEMPLATE = "%E4Y-%m-%dT%H:%M:%E3S%Ez";

    @Override
    protected ScannerRunner getScanner() {
        TimeFormatter formatter = TimeFormatter.of(TEMPLATE).withZone(zone);
        return s -> formatter.parse(s).orElseThrow().toEpochMilli();
    }

    @Override
    public String getToParse(long timestamp) {
        return TimeFormatter.of(TEMPLATE).withZone(zone).print(Instant.ofEpochMilli(timestamp));
    }

}
