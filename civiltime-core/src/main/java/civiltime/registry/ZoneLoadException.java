package civiltime.registry;

import lombok.Getter;

@Getter
public class ZoneLoadException extends Exception {

    private final String zoneName;

    public ZoneLoadException(String zoneName, String message, Throwable cause) {
        super(message, cause);
        this.zoneName = zoneName;
    }

    public ZoneLoadException(String zoneName, String message) {
        super(message);
        this.zoneName = zoneName;
    }

}
