package civiltime.bench.format;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;

import civiltime.datetime.TimeFormatter;

public class JavaDtfRFC3339 extends Scanner {

    @Override
    protected ScannerRunner getScanner() {
        DateTimeFormatter dtf = DateTimeFormatter.ISO_OFFSET_DATE_TIME;
        return s -> dtf.parse(s, OffsetDateTime::from).toInstant().toEpochMilli();
    }

    @Override
    public String getToParse(long timestamp) {
        return TimeFormatter.of(CivilTimeRFC3339.TEMPLATE).withZone(zone).print(Instant.ofEpochMilli(timestamp));
    }

}
