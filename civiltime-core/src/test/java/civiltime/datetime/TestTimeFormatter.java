package civiltime.datetime;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import org.junit.Assert;
import org.junit.BeforeClass;
import org.junit.Test;

import civiltime.TimeZones;
import civiltime.Tools;
import civiltime.zone.TimeZone;

public class TestTimeFormatter {

    private static TimeZone newYork;

    @BeforeClass
    public static void configure() {
        Tools.configure();
        newYork = Tools.zone("America/New_York");
    }

    private static final Instant JULY_4TH = Instant.parse("2024-07-04T16:00:00Z");

    private void runTest(String template, TimeZone zone, List<Map.Entry<String, String>> toparse, List<Map.Entry<Instant, String>> toPrint, List<Map.Entry<String, String>> fails) {
        TimeFormatter formatter = TimeFormatter.of(template).withZone(zone);
        toparse.forEach(e -> Assert.assertEquals(String.format("When parsing \"%s\"", e.getKey()), Instant.parse(e.getValue()), formatter.parse(e.getKey()).orElseThrow()));
        toPrint.forEach(e -> Assert.assertEquals(String.format("When printing \"%s\" with \"%s\"", e.getKey(), template), e.getValue(), formatter.print(e.getKey())));
        fails.forEach(e -> {
            ParseResult result = formatter.parse(e.getKey());
            Assert.assertFalse(result.isSuccess());
            Assert.assertEquals(e.getValue(), result.getError().getMessage());
            Assert.assertEquals(e.getKey(), result.getError().getParsedString());
        });
    }

    private static Instant utcCivil(int year, int month, int day) {
        return LocalDateTime.of(year, month, day, 0, 0).toInstant(ZoneOffset.UTC);
    }

    @Test
    public void rfc3339() {
        runTest("%E4Y-%m-%dT%H:%M:%S%Ez", newYork,
                List.of(
                        Map.entry("2024-07-04T12:00:00-04:00", "2024-07-04T16:00:00Z"),
                        Map.entry("2024-07-04T12:00:00Z", "2024-07-04T12:00:00Z"),
                        Map.entry("2024-07-04T12:00:00+0530", "2024-07-04T06:30:00Z"),
                        // The offset wins, even for a civil time that doesn't exist in the zone
                        Map.entry("2024-03-10T02:30:00-05:00", "2024-03-10T07:30:00Z"),
                        Map.entry("2024-07-04T12:00:00-04:00 ", "2024-07-04T16:00:00Z")
                ),
                List.of(
                        Map.entry(JULY_4TH, "2024-07-04T12:00:00-04:00"),
                        Map.entry(Instant.parse("2024-01-04T16:00:00Z"), "2024-01-04T11:00:00-05:00"),
                        Map.entry(Instant.parse("1850-01-01T00:00:00Z"), "1849-12-31T19:03:58-04:56")
                ),
                List.of(
                        Map.entry("2024-13-01T12:00:00Z", "Failed to parse date \"2024-13-01T12:00:00Z\": Field month out of range: 13"),
                        Map.entry("2024-07-04T24:00:00Z", "Failed to parse date \"2024-07-04T24:00:00Z\": Field hour out of range: 24"),
                        Map.entry("2024-07-04T12:00:00+25:00", "Failed to parse date \"2024-07-04T12:00:00+25:00\": Field offset hours out of range: 25"),
                        Map.entry("2024-07-04T12:00:00", "Failed to parse date \"2024-07-04T12:00:00\": Zone offset required"),
                        Map.entry("2024/07/04T12:00:00Z", "Failed to parse date \"2024/07/04T12:00:00Z\": Expected \"-\""),
                        Map.entry("2024-07-04T12:00:00Zx", "Failed to parse date \"2024-07-04T12:00:00Zx\": Illegal trailing data")
                )
        );
    }

    @Test
    public void composites() {
        runTest("%F %T", TimeZone.utc(),
                List.of(Map.entry("2024-07-04 12:00:00", "2024-07-04T12:00:00Z")),
                List.of(Map.entry(JULY_4TH, "2024-07-04 16:00:00")),
                List.of());
        runTest("%D %R", newYork,
                List.of(Map.entry("07/04/24 12:00", "2024-07-04T16:00:00Z")),
                List.of(Map.entry(JULY_4TH, "07/04/24 12:00")),
                List.of());
    }

    @Test
    public void names() {
        runTest("%a %A %b %B %h", newYork,
                List.of(),
                List.of(Map.entry(JULY_4TH, "Thu Thursday Jul July Jul")),
                List.of());
        runTest("%d %B %Y", TimeZone.utc(),
                List.of(Map.entry("4 july 2024", "2024-07-04T00:00:00Z"),
                        Map.entry("04 JULY 2024", "2024-07-04T00:00:00Z"),
                        Map.entry("04 Jul 2024", "2024-07-04T00:00:00Z")),
                List.of(Map.entry(JULY_4TH, "04 July 2024")),
                List.of(Map.entry("04 Foo 2024", "Failed to parse date \"04 Foo 2024\": Unknown name")));
        runTest("%A, %d %b %Y", TimeZone.utc(),
                List.of(Map.entry("thursday, 04 jul 2024", "2024-07-04T00:00:00Z"),
                        Map.entry("Thu, 04 Jul 2024", "2024-07-04T00:00:00Z")),
                List.of(Map.entry(JULY_4TH, "Thursday, 04 Jul 2024")),
                List.of());
        runTest("%b %e %Y", TimeZone.utc(),
                List.of(Map.entry("Jul  4 2024", "2024-07-04T00:00:00Z")),
                List.of(Map.entry(JULY_4TH, "Jul  4 2024")),
                List.of());
    }

    @Test
    public void numbers() {
        runTest("%u %w %j", newYork, List.of(), List.of(Map.entry(JULY_4TH, "4 4 186")), List.of());
        runTest("%e|%I|%p|%C|%y", newYork, List.of(), List.of(Map.entry(JULY_4TH, " 4|12|PM|20|24")), List.of());
        runTest("%Y-%j", TimeZone.utc(),
                List.of(Map.entry("2024-186", "2024-07-04T00:00:00Z")),
                List.of(Map.entry(JULY_4TH, "2024-186")),
                List.of(Map.entry("2023-366", "Failed to parse date \"2023-366\": Invalid date 'DayOfYear 366' as '2023' is not a leap year")));
        runTest("%Y%m%d%H%M%S", TimeZone.utc(),
                List.of(Map.entry("20240704120000", "2024-07-04T12:00:00Z")),
                List.of(Map.entry(JULY_4TH, "20240704160000")),
                List.of());
        runTest("%C%y", TimeZone.utc(),
                List.of(Map.entry("2024", "2024-01-01T00:00:00Z")),
                List.of(Map.entry(JULY_4TH, "2024")),
                List.of());
        runTest("%y-%m-%d", TimeZone.utc(),
                List.of(Map.entry("69-01-01", "1969-01-01T00:00:00Z"),
                        Map.entry("99-12-31", "1999-12-31T00:00:00Z"),
                        Map.entry("00-01-01", "2000-01-01T00:00:00Z"),
                        Map.entry("68-01-01", "2068-01-01T00:00:00Z")),
                List.of(),
                List.of());
        runTest("%D %I:%M %p", TimeZone.utc(),
                List.of(Map.entry("07/04/24 12:00 AM", "2024-07-04T00:00:00Z"),
                        Map.entry("07/04/24 12:30 pm", "2024-07-04T12:30:00Z"),
                        Map.entry("07/04/24 01:15 PM", "2024-07-04T13:15:00Z")),
                List.of(Map.entry(Instant.parse("2024-07-04T00:05:00Z"), "07/04/24 12:05 AM")),
                List.of(Map.entry("07/04/24 13:15 PM", "Failed to parse date \"07/04/24 13:15 PM\": Field hour out of range: 13"),
                        Map.entry("07/04/24 01:15 XM", "Failed to parse date \"07/04/24 01:15 XM\": Expected AM or PM")));
        runTest("%H:%M", TimeZone.utc(),
                List.of(Map.entry("12:34", "1970-01-01T12:34:00Z")),
                List.of(),
                List.of(Map.entry("", "Failed to parse date \"\": Failed to parse number"),
                        Map.entry("12:60", "Failed to parse date \"12:60\": Field minute out of range: 60")));
    }

    @Test
    public void epochSeconds() {
        runTest("%s", newYork,
                List.of(Map.entry("1720108800", "2024-07-04T16:00:00Z"),
                        Map.entry("-1", "1969-12-31T23:59:59Z")),
                List.of(Map.entry(JULY_4TH, "1720108800")),
                List.of(Map.entry("99999999999999999", "Failed to parse date \"99999999999999999\": Instant exceeds minimum or maximum instant"),
                        Map.entry("-99999999999999999", "Failed to parse date \"-99999999999999999\": Instant exceeds minimum or maximum instant"),
                        Map.entry("9999999999999999999", "Failed to parse date \"9999999999999999999\": Number out of range"),
                        Map.entry("-9999999999999999999", "Failed to parse date \"-9999999999999999999\": Number out of range")));
        TimeFormatter epoch = TimeFormatter.of("%s");
        long last = Instant.MAX.getEpochSecond();
        Assert.assertEquals(Instant.ofEpochSecond(last), epoch.parse(Long.toString(last)).orElseThrow());
        Assert.assertFalse(epoch.parse(Long.toString(last + 1)).isSuccess());
        Assert.assertFalse(TimeZones.parse("%s", "99999999999999999", TimeZones.utc()).isSuccess());
        runTest("%s.%E3f", newYork,
                List.of(Map.entry("1720108800.250", "2024-07-04T16:00:00.250Z")),
                List.of(Map.entry(JULY_4TH.plusMillis(250), "1720108800.250")),
                List.of());
    }

    @Test
    public void offsets() {
        TimeZone kolkata = Tools.zone("Asia/Kolkata");
        runTest("%z %Ez %E*z %Z", kolkata,
                List.of(), List.of(Map.entry(JULY_4TH, "+0530 +05:30 +05:30:00 IST")), List.of());
        runTest("%z %Ez %E*z %Z", newYork,
                List.of(), List.of(Map.entry(JULY_4TH, "-0400 -04:00 -04:00:00 EDT"),
                                   Map.entry(Instant.parse("1850-01-01T00:00:00Z"), "-0456 -04:56 -04:56:02 LMT")),
                List.of());
        runTest("%F %T%E*z", TimeZone.utc(),
                List.of(Map.entry("1850-01-01 00:00:00-04:56:02", "1850-01-01T04:56:02Z"),
                        Map.entry("1850-01-01 00:00:00-045602", "1850-01-01T04:56:02Z"),
                        Map.entry("1850-01-01 00:00:00-05", "1850-01-01T05:00:00Z")),
                List.of(Map.entry(JULY_4TH, "2024-07-04 16:00:00+00:00:00")),
                List.of(Map.entry("1850-01-01 00:00:00-05:", "Failed to parse date \"1850-01-01 00:00:00-05:\": Missing offset minutes")));
    }

    @Test
    public void offsetSeconds() {
        Instant lmt = Instant.parse("1850-01-01T00:00:00Z");
        TimeFormatter minutes = TimeFormatter.of("%E4Y-%m-%dT%H:%M:%S%Ez").withZone(newYork);
        TimeFormatter seconds = TimeFormatter.of("%E4Y-%m-%dT%H:%M:%S%E*z").withZone(newYork);
        Assert.assertEquals(lmt.minusSeconds(2), minutes.parse(minutes.print(lmt)).orElseThrow());
        Assert.assertEquals(lmt, seconds.parse(seconds.print(lmt)).orElseThrow());
    }

    @Test
    public void fractions() {
        Instant withNanos = Instant.parse("2024-07-04T16:00:05.123456789Z");
        Instant half = Instant.parse("2024-07-04T16:00:05.5Z");
        Instant whole = Instant.parse("2024-07-04T16:00:05Z");
        runTest("%E3S", TimeZone.utc(), List.of(),
                List.of(Map.entry(withNanos, "05.123"), Map.entry(half, "05.500"), Map.entry(whole, "05.000")), List.of());
        runTest("%E*S", TimeZone.utc(), List.of(),
                List.of(Map.entry(withNanos, "05.123456789"), Map.entry(half, "05.5"), Map.entry(whole, "05")), List.of());
        runTest("%E0S|%E12S", TimeZone.utc(), List.of(),
                List.of(Map.entry(withNanos, "05|05.123456789000")), List.of());
        runTest("%E3f|%E*f", TimeZone.utc(), List.of(),
                List.of(Map.entry(withNanos, "123|123456789"), Map.entry(half, "500|5"), Map.entry(whole, "000|0")), List.of());
        runTest("%T.%E*f", TimeZone.utc(),
                List.of(Map.entry("16:00:05.123456789", "1970-01-01T16:00:05.123456789Z"),
                        Map.entry("16:00:05.1234567891234", "1970-01-01T16:00:05.123456789Z"),
                        Map.entry("16:00:05.5", "1970-01-01T16:00:05.5Z")),
                List.of(),
                List.of(Map.entry("16:00:05.", "Failed to parse date \"16:00:05.\": Failed to parse fraction of second")));
        runTest("%H:%M:%E*S", TimeZone.utc(),
                List.of(Map.entry("16:00:05", "1970-01-01T16:00:05Z"),
                        Map.entry("16:00:05.25", "1970-01-01T16:00:05.25Z"),
                        Map.entry("16:00:05,25", "1970-01-01T16:00:05.25Z")),
                List.of(),
                List.of());
    }

    @Test
    public void years() {
        TimeFormatter formatter = TimeFormatter.of("%E4Y-%m-%d");
        Assert.assertEquals("-001-01-01", formatter.print(utcCivil(-1, 1, 1)));
        Assert.assertEquals("0000-01-01", formatter.print(utcCivil(0, 1, 1)));
        Assert.assertEquals("0900-01-01", formatter.print(utcCivil(900, 1, 1)));
        Assert.assertEquals("9999-12-31", formatter.print(utcCivil(9999, 12, 31)));
        Assert.assertEquals("12345-06-01", formatter.print(utcCivil(12345, 6, 1)));
        Assert.assertEquals(utcCivil(-1, 1, 1), formatter.parse("-001-01-01").orElseThrow());
        Assert.assertEquals(utcCivil(0, 1, 1), formatter.parse("0000-01-01").orElseThrow());
        Assert.assertEquals(utcCivil(9999, 12, 31), formatter.parse("9999-12-31").orElseThrow());

        TimeFormatter yearOnly = TimeFormatter.of("%Y");
        Assert.assertEquals(utcCivil(12345, 1, 1), yearOnly.parse("12345").orElseThrow());
        Assert.assertEquals("Failed to parse date \"1000000000\": Field year out of range: 1000000000",
                            yearOnly.parse("1000000000").getError().getMessage());
    }

    @Test
    public void zoneRules() {
        // Without an offset, the zone decides: the transition for a skipped time, the earliest for a repeated one
        runTest("%Y-%m-%d %H:%M:%S", newYork,
                List.of(Map.entry("2024-07-04 12:00:00", "2024-07-04T16:00:00Z"),
                        Map.entry("2024-03-10 02:30:00", "2024-03-10T07:00:00Z"),
                        Map.entry("2024-11-03 01:30:00", "2024-11-03T05:30:00Z"),
                        Map.entry("2024-07-04 \t 12:00:00", "2024-07-04T16:00:00Z")),
                List.of(),
                List.of(Map.entry("2024-02-30 12:00:00", "Failed to parse date \"2024-02-30 12:00:00\": Invalid date 'FEBRUARY 30'")));
    }

    @Test
    public void abbreviations() {
        runTest("%Y-%m-%d %H:%M:%S %Z", newYork,
                List.of(Map.entry("2024-11-03 01:30:00 EST", "2024-11-03T06:30:00Z"),
                        Map.entry("2024-11-03 01:30:00 EDT", "2024-11-03T05:30:00Z"),
                        Map.entry("2024-11-03 01:30:00 UTC", "2024-11-03T01:30:00Z"),
                        Map.entry("2024-11-03 01:30:00 GMT", "2024-11-03T01:30:00Z"),
                        Map.entry("2024-11-03 01:30:00 XYZ", "2024-11-03T05:30:00Z")),
                List.of(Map.entry(Instant.parse("2024-11-03T05:30:00Z"), "2024-11-03 01:30:00 EDT"),
                        Map.entry(Instant.parse("2024-11-03T06:30:00Z"), "2024-11-03 01:30:00 EST")),
                List.of(Map.entry("2024-11-03 01:30:00 ", "Failed to parse date \"2024-11-03 01:30:00 \": Zone abbreviation expected")));
        // Two LMT with different offsets in Apia, the abbreviation is not usable
        runTest("%F %T %Z", Tools.zone("Pacific/Apia"),
                List.of(Map.entry("1880-01-01 00:00:00 LMT", "1879-12-31T11:26:56Z")),
                List.of(),
                List.of());
    }

    @Test
    public void literals() {
        runTest("100%% %Q%n%t", TimeZone.utc(),
                List.of(Map.entry("100% %Q", "1970-01-01T00:00:00Z")),
                List.of(Map.entry(JULY_4TH, "100% %Q\n\t")),
                List.of(Map.entry("100% Q", "Failed to parse date \"100% Q\": Expected \"%Q\"")));
        runTest("%Y %E", TimeZone.utc(),
                List.of(Map.entry("2024 %E", "2024-01-01T00:00:00Z")),
                List.of(Map.entry(JULY_4TH, "2024 %E")),
                List.of());
        runTest("at 50%", TimeZone.utc(),
                List.of(),
                List.of(Map.entry(JULY_4TH, "at 50%")),
                List.of());
        runTest("%Y %m", TimeZone.utc(),
                List.of(Map.entry("2024\t\t07", "2024-07-01T00:00:00Z"),
                        Map.entry("2024 07  ", "2024-07-01T00:00:00Z")),
                List.of(),
                List.of());
    }

    @Test
    public void unknownDirectivePolicy() {
        FormatDirectiveException ex = Assert.assertThrows(FormatDirectiveException.class,
                () -> TimeFormatter.getBuilder().setTemplate("%Y-%Q").setUnknownDirectivePolicy(UnknownDirectivePolicy.FAIL).build());
        Assert.assertEquals("%Q", ex.getDirective());
        Assert.assertEquals("%Y-%Q", ex.getTemplate());
        Assert.assertEquals("Unknown directive \"%Q\" in template \"%Y-%Q\"", ex.getMessage());
        Assert.assertThrows(FormatDirectiveException.class,
                () -> TimeFormatter.getBuilder().setTemplate("%E9Y").setUnknownDirectivePolicy(UnknownDirectivePolicy.FAIL).build());
        TimeFormatter formatter = TimeFormatter.getBuilder()
                                               .setTemplate("%F %% %E3S")
                                               .setZone(newYork)
                                               .setUnknownDirectivePolicy(UnknownDirectivePolicy.FAIL)
                                               .build();
        Assert.assertEquals("2024-07-04 % 00.000", formatter.print(JULY_4TH));
        Assert.assertThrows(IllegalArgumentException.class, () -> TimeFormatter.getBuilder().build());
    }

    @Test
    public void parseResult() {
        TimeFormatter formatter = TimeFormatter.of("%F");
        ParseResult failed = formatter.parse("not a date");
        Assert.assertFalse(failed.isSuccess());
        Assert.assertTrue(failed.toOptional().isEmpty());
        Assert.assertThrows(NoSuchElementException.class, failed::getInstant);
        Assert.assertThrows(DateTimeParseException.class, failed::orElseThrow);
        Assert.assertEquals(0, failed.getError().getErrorIndex());
        ParseResult success = formatter.parse("2024-07-04");
        Assert.assertTrue(success.isSuccess());
        Assert.assertNull(success.getError());
        Assert.assertEquals(Instant.parse("2024-07-04T00:00:00Z"), success.getInstant());
        Assert.assertEquals("2024-07-04T00:00:00Z", success.toString());
    }

    @Test
    public void withZone() {
        TimeFormatter formatter = TimeFormatter.of("%F %T %Z");
        Assert.assertSame(TimeZone.utc(), formatter.getZone());
        Assert.assertSame(formatter, formatter.withZone(TimeZone.utc()));
        TimeFormatter london = formatter.withZone(Tools.zone("Europe/London"));
        Assert.assertEquals("%F %T %Z", london.getTemplate());
        Assert.assertEquals("2024-07-04 17:00:00 BST", london.print(JULY_4TH));
        Assert.assertEquals("2024-07-04 16:00:00 UTC", formatter.print(JULY_4TH));
    }

    @Test
    public void inverse() {
        List<String> zones = List.of("America/New_York", "Europe/London", "Australia/Lord_Howe", "Asia/Kolkata", "Europe/Dublin", "Pacific/Apia");
        Instant start = Instant.parse("2011-01-01T00:00:00Z");
        Instant end = start.plus(Duration.ofDays(366));
        for (String name : zones) {
            TimeZone zone = Tools.zone(name);
            TimeFormatter seconds = TimeFormatter.of("%E4Y-%m-%dT%H:%M:%S%Ez").withZone(zone);
            TimeFormatter nanos = TimeFormatter.of("%E4Y-%m-%dT%H:%M:%E*S%E*z").withZone(zone);
            TimeFormatter epoch = TimeFormatter.of("%s.%E9f").withZone(zone);
            for (Instant t = start; t.isBefore(end); t = t.plus(Duration.ofMinutes(47)).plusNanos(1_001)) {
                Instant truncated = t.minusNanos(t.getNano());
                Assert.assertEquals(name, truncated, seconds.parse(seconds.print(t)).orElseThrow());
                Assert.assertEquals(name, t, nanos.parse(nanos.print(t)).orElseThrow());
                Assert.assertEquals(name, t, epoch.parse(epoch.print(t)).orElseThrow());
            }
        }
    }

}
