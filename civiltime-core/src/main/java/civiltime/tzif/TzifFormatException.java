package civiltime.tzif;

import java.io.IOException;

/**
 * The rule bytes are not a valid TZif stream.
 */
public class TzifFormatException extends IOException {

    public TzifFormatException(String message) {
        super(message);
    }

    public TzifFormatException(String message, Throwable cause) {
        super(message, cause);
    }

}
