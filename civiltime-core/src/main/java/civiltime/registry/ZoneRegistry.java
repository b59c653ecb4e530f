package civiltime.registry;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import civiltime.Helpers;
import civiltime.tzif.TzifCompiler;
import civiltime.zone.TimeZone;
import lombok.Setter;

/**
 * Maps zone names to compiled zones. A name is compiled on first request and the result is kept forever,
 * concurrent first requests for the same name share a single compilation. Failures are not remembered,
 * so a later request tries again.
 */
public class ZoneRegistry {

    private static final Logger logger = LogManager.getLogger();

    private static final Pattern ZONE_NAME = Pattern.compile("[A-Za-z0-9_+\\-]+(?:/[A-Za-z0-9_+\\-]+)*");

    @Setter
    public static class Builder {
        private RuleSource ruleSource = new FileRuleSource();
        public ZoneRegistry build() {
            return new ZoneRegistry(this);
        }
    }
    public static ZoneRegistry.Builder getBuilder() {
        return new ZoneRegistry.Builder();
    }

    private final RuleSource ruleSource;
    private final Map<String, TimeZone> zones = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<TimeZone>> compiling = new ConcurrentHashMap<>();

    private ZoneRegistry(Builder builder) {
        this.ruleSource = builder.ruleSource;
    }

    /**
     * Returns the named zone, compiling it if needed. "UTC" and the empty name are the UTC zone.
     * It never throws, failures are described by the result.
     */
    public LoadResult load(String name) {
        if (name == null || name.isEmpty() || "UTC".equals(name)) {
            return LoadResult.of(TimeZone.utc());
        }
        TimeZone cached = zones.get(name);
        if (cached != null) {
            return LoadResult.of(cached);
        }
        CompletableFuture<TimeZone> mine = new CompletableFuture<>();
        CompletableFuture<TimeZone> running = compiling.putIfAbsent(name, mine);
        if (running == null) {
            try {
                // Another thread might have finished between the cache miss and the reservation
                TimeZone done = zones.get(name);
                if (done == null) {
                    done = compile(name);
                    zones.put(name, done);
                }
                mine.complete(done);
            } catch (ZoneLoadException ex) {
                logger.atWarn()
                      .withThrowable(logger.isDebugEnabled() ? ex : null)
                      .log("Unable to load zone {}: {}", name, Helpers.resolveThrowableException(ex));
                mine.completeExceptionally(ex);
            } catch (RuntimeException ex) {
                logger.atError()
                      .withThrowable(ex)
                      .log("Unexpected failure while loading zone {}: {}", name, Helpers.resolveThrowableException(ex));
                mine.completeExceptionally(new ZoneLoadException(name, "Unexpected failure for zone " + name, ex));
            } finally {
                compiling.remove(name, mine);
            }
            running = mine;
        } else {
            logger.debug("Waiting for the compilation of {}", name);
        }
        try {
            return LoadResult.of(running.join());
        } catch (CompletionException ex) {
            if (ex.getCause() instanceof ZoneLoadException) {
                return LoadResult.failed((ZoneLoadException) ex.getCause());
            } else {
                return LoadResult.failed(new ZoneLoadException(name, Helpers.resolveThrowableException(ex.getCause()), ex.getCause()));
            }
        }
    }

    private TimeZone compile(String name) throws ZoneLoadException {
        if (! ZONE_NAME.matcher(name).matches()) {
            throw new ZoneLoadException(name, "Invalid zone name \"" + name + "\"");
        }
        logger.debug("Compiling zone {} from {}", name, ruleSource);
        byte[] data;
        try {
            data = ruleSource.fetch(name);
        } catch (NoSuchFileException ex) {
            throw new ZoneLoadException(name, "Unknown time zone " + name, ex);
        } catch (IOException ex) {
            throw new ZoneLoadException(name, "Unable to read rules for " + name, ex);
        }
        try {
            return TzifCompiler.compile(name, data);
        } catch (IOException ex) {
            throw new ZoneLoadException(name, "Invalid rules for " + name, ex);
        }
    }

    /**
     * True if the zone is already compiled.
     */
    public boolean isLoaded(String name) {
        return zones.containsKey(name);
    }

    /**
     * Forget every compiled zone, only for test isolation.
     */
    public void clear() {
        zones.clear();
    }

}
