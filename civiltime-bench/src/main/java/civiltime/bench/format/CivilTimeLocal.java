package civiltime.bench.format;

import java.time.Instant;

import civiltime.datetime.TimeFormatter;

/**
 * A civil time without offset, resolved with the zone rules.
 */
public class CivilTimeLocal extends Scanner {

    public static final String TEMPLATE = "%F %T";

    @Override
    protected long getSourceTimestamp() {
        // Whole hours at noon UTC never fall in a gap or a fold
        long days = super.getSourceTimestamp() / 86_400_000L;
        return days * 86_400_000L + 12 * 3_600_000L;
    }

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
