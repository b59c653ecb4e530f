package civiltime.registry;

import java.io.IOException;

/**
 * Supplies the raw TZif bytes of a zone.
 */
@FunctionalInterface
public interface RuleSource {

    /**
     * @throws java.nio.file.NoSuchFileException if the zone is unknown to this source
     * @throws IOException for any other failure, that might be transient
     */
    byte[] fetch(String zoneName) throws IOException;

}
