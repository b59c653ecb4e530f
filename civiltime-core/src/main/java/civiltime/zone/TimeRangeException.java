package civiltime.zone;

import java.time.DateTimeException;

/**
 * A requested instant or civil time can't be represented on the other side of the conversion.
 */
public class TimeRangeException extends DateTimeException {

    public TimeRangeException(String message) {
        super(message);
    }

}
