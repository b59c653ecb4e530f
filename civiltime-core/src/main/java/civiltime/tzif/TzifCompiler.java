package civiltime.tzif;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import civiltime.zone.LocalTimeType;
import civiltime.zone.PosixTzRule;
import civiltime.zone.TimeZone;
import civiltime.zone.Transition;

/**
 * Compiles TZif bytes (RFC 8536, versions 1 to 4) into a {@link TimeZone}.
 * <p>
 * Version 1 streams are read from their 32-bit block, later versions skip it and read the 64-bit block
 * and the footer rule. Leap second records and the UT/standard indicators are read and ignored.
 */
public class TzifCompiler {

    private static final Logger logger = LogManager.getLogger();

    private static final int MAGIC = 0x545A6966; // "TZif"
    private static final int HEADER_SIZE = 44;

    private record Header(int version, int isUtCount, int isStdCount, int leapCount, int timeCount, int typeCount, int charCount) {
        long blockSize(int timeSize) {
            return (long) timeCount * (timeSize + 1) + typeCount * 6L + charCount + leapCount * (timeSize + 4L) + isStdCount + isUtCount;
        }
    }

    private TzifCompiler() {}

    /**
     * @throws TzifFormatException if the bytes are not a usable TZif stream, no partial zone is ever returned
     */
    public static TimeZone compile(String name, byte[] data) throws TzifFormatException {
        if (data == null || data.length == 0) {
            throw new TzifFormatException("Empty rule data for " + name);
        }
        try {
            ByteBuffer buffer = ByteBuffer.wrap(data);
            Header header = readHeader(buffer);
            int version = header.version;
            int timeSize = 4;
            checkBlock(name, header, timeSize, buffer);
            if (header.version >= 2) {
                buffer.position(buffer.position() + (int) header.blockSize(4));
                Header header64 = readHeader(buffer);
                if (header64.version != header.version) {
                    throw new TzifFormatException("Inconsistent version in second header");
                }
                header = header64;
                timeSize = 8;
                checkBlock(name, header, timeSize, buffer);
            }
            TimeZone zone = readBlock(name, header, timeSize, buffer);
            logger.debug("Compiled zone {}: version {}, {} transitions, {} types, rule {}",
                         () -> name, () -> version, () -> zone.getTransitions().size(),
                         () -> zone.getTypes().size(), () -> zone.getExtrapolationRule().map(PosixTzRule::getSource).orElse("none"));
            return zone;
        } catch (BufferUnderflowException | IndexOutOfBoundsException ex) {
            throw new TzifFormatException("Truncated rule data for " + name, ex);
        } catch (IllegalArgumentException ex) {
            throw new TzifFormatException("Invalid rule data for " + name + ": " + ex.getMessage(), ex);
        }
    }

    // The counts are checked against the available bytes before anything is allocated from them
    private static void checkBlock(String name, Header header, int timeSize, ByteBuffer buffer) throws TzifFormatException {
        if (header.blockSize(timeSize) > buffer.remaining()) {
            throw new TzifFormatException("Truncated rule data for " + name);
        }
    }

    private static Header readHeader(ByteBuffer buffer) throws TzifFormatException {
        if (buffer.remaining() < HEADER_SIZE) {
            throw new TzifFormatException("Header too short");
        }
        if (buffer.getInt() != MAGIC) {
            throw new TzifFormatException("Not a TZif stream");
        }
        byte versionByte = buffer.get();
        int version;
        if (versionByte == 0) {
            version = 1;
        } else if (versionByte >= '2' && versionByte <= '4') {
            version = versionByte - '0';
        } else {
            throw new TzifFormatException("Unsupported TZif version " + (versionByte & 0xff));
        }
        buffer.position(buffer.position() + 15);
        Header header = new Header(version, buffer.getInt(), buffer.getInt(), buffer.getInt(), buffer.getInt(), buffer.getInt(), buffer.getInt());
        if (header.isUtCount < 0 || header.isStdCount < 0 || header.leapCount < 0 || header.timeCount < 0 || header.charCount < 0) {
            throw new TzifFormatException("Negative count in header");
        }
        if (header.typeCount <= 0) {
            throw new TzifFormatException("No local time type");
        }
        if ((header.isUtCount != 0 && header.isUtCount != header.typeCount)
                    || (header.isStdCount != 0 && header.isStdCount != header.typeCount)) {
            throw new TzifFormatException("Indicator counts don't match the type count");
        }
        return header;
    }

    private static TimeZone readBlock(String name, Header header, int timeSize, ByteBuffer buffer) throws TzifFormatException {
        long[] times = new long[header.timeCount];
        for (int i = 0; i < header.timeCount; i++) {
            times[i] = timeSize == 4 ? buffer.getInt() : buffer.getLong();
            if (i > 0 && times[i] <= times[i - 1]) {
                throw new TzifFormatException("Transition times not in increasing order at index " + i);
            }
        }
        int[] rawIndexes = new int[header.timeCount];
        for (int i = 0; i < header.timeCount; i++) {
            rawIndexes[i] = buffer.get() & 0xff;
            if (rawIndexes[i] >= header.typeCount) {
                throw new TzifFormatException("Transition " + i + " references unknown type " + rawIndexes[i]);
            }
        }
        int[] offsets = new int[header.typeCount];
        boolean[] dsts = new boolean[header.typeCount];
        int[] abbreviationIndexes = new int[header.typeCount];
        for (int i = 0; i < header.typeCount; i++) {
            offsets[i] = buffer.getInt();
            byte dst = buffer.get();
            if (dst != 0 && dst != 1) {
                throw new TzifFormatException("Invalid DST flag for type " + i);
            }
            dsts[i] = dst == 1;
            abbreviationIndexes[i] = buffer.get() & 0xff;
        }
        byte[] abbreviationPool = new byte[header.charCount];
        buffer.get(abbreviationPool);
        int leapRecordSize = timeSize + 4;
        if (header.leapCount > 0) {
            logger.trace("Ignoring {} leap second records in {}", header.leapCount, name);
        }
        buffer.position(buffer.position() + header.leapCount * leapRecordSize + header.isStdCount + header.isUtCount);

        // Intern the types, raw type 0 stays at index 0 as it's the one used before the first transition
        Map<LocalTimeType, Integer> interned = new LinkedHashMap<>();
        int[] typeMapping = new int[header.typeCount];
        for (int i = 0; i < header.typeCount; i++) {
            String abbreviation = abbreviation(abbreviationPool, abbreviationIndexes[i]);
            LocalTimeType type = new LocalTimeType(offsets[i], dsts[i], abbreviation);
            typeMapping[i] = interned.computeIfAbsent(type, k -> interned.size());
        }

        PosixTzRule rule = null;
        if (header.version >= 2) {
            rule = readFooter(buffer);
            if (rule != null) {
                for (LocalTimeType type : new LocalTimeType[] {rule.getStandard(), rule.getDaylight()}) {
                    if (type != null) {
                        interned.computeIfAbsent(type, k -> interned.size());
                    }
                }
            }
        }

        List<Transition> transitions = new ArrayList<>(header.timeCount + 1);
        int firstType = typeMapping[0];
        long maxTime = Instant.MAX.getEpochSecond();
        for (int i = 0; i < header.timeCount; i++) {
            if (times[i] <= Transition.BIG_BANG) {
                firstType = typeMapping[rawIndexes[i]];
            } else if (times[i] <= maxTime) {
                transitions.add(new Transition(times[i], typeMapping[rawIndexes[i]]));
            }
        }
        transitions.add(0, new Transition(Transition.BIG_BANG, firstType));
        return new TimeZone(name, transitions, new ArrayList<>(interned.keySet()), rule);
    }

    private static String abbreviation(byte[] pool, int index) throws TzifFormatException {
        if (index >= pool.length) {
            throw new TzifFormatException("Abbreviation index " + index + " out of the pool");
        }
        int end = index;
        while (end < pool.length && pool[end] != 0) {
            end++;
        }
        if (end == pool.length) {
            throw new TzifFormatException("Unterminated abbreviation at " + index);
        }
        return new String(pool, index, end - index, StandardCharsets.US_ASCII);
    }

    private static PosixTzRule readFooter(ByteBuffer buffer) throws TzifFormatException {
        if (! buffer.hasRemaining()) {
            // Some writers drop the footer of a version 2 stream, behave as if it was empty
            return null;
        }
        if (buffer.get() != '\n') {
            throw new TzifFormatException("Footer doesn't start with a new line");
        }
        StringBuilder footer = new StringBuilder();
        while (true) {
            if (! buffer.hasRemaining()) {
                throw new TzifFormatException("Unterminated footer");
            }
            byte b = buffer.get();
            if (b == '\n') {
                break;
            }
            footer.append((char) (b & 0xff));
        }
        if (footer.length() == 0) {
            return null;
        } else {
            return PosixTzRule.parse(footer.toString());
        }
    }

}
