package civiltime.zone;

import java.time.LocalDateTime;

/**
 * Result of an absolute to civil conversion, always fully determined.
 */
public record TimeConversion(LocalDateTime civil, int utcOffset, boolean dst, String abbreviation) {

}
