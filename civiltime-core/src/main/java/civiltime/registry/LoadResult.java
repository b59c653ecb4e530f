package civiltime.registry;

import java.util.Objects;

import civiltime.zone.TimeZone;

/**
 * Either a loaded zone or the reason it could not be loaded.
 */
public final class LoadResult {

    private final TimeZone zone;
    private final ZoneLoadException error;

    private LoadResult(TimeZone zone, ZoneLoadException error) {
        this.zone = zone;
        this.error = error;
    }

    public static LoadResult of(TimeZone zone) {
        return new LoadResult(Objects.requireNonNull(zone), null);
    }

    public static LoadResult failed(ZoneLoadException error) {
        return new LoadResult(null, Objects.requireNonNull(error));
    }

    public boolean isSuccess() {
        return zone != null;
    }

    /**
     * @throws IllegalStateException if the load failed
     */
    public TimeZone getZone() {
        if (zone == null) {
            throw new IllegalStateException("Zone " + error.getZoneName() + " not loaded: " + error.getMessage());
        }
        return zone;
    }

    /**
     * @return the failure, or null for a success
     */
    public ZoneLoadException getError() {
        return error;
    }

    public TimeZone orElse(TimeZone fallback) {
        return zone != null ? zone : fallback;
    }

    public TimeZone orElseThrow() throws ZoneLoadException {
        if (zone == null) {
            throw error;
        }
        return zone;
    }

    @Override
    public String toString() {
        return zone != null ? "Loaded " + zone.getName() : "Failed: " + error.getMessage();
    }

}
