package civiltime.registry;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;

import lombok.Getter;

/**
 * Reads zones from a compiled zoneinfo directory.
 * <p>
 * Without an explicit root, the directory is taken from the system property {@value #TZDIR_PROPERTY}, then
 * from the environment variable {@code TZDIR}, then {@value #DEFAULT_TZDIR}.
 */
public class FileRuleSource implements RuleSource {

    public static final String TZDIR_PROPERTY = "civiltime.tzdir";
    public static final String DEFAULT_TZDIR = "/usr/share/zoneinfo";

    @Getter
    private final Path root;

    public FileRuleSource() {
        this(resolveRoot());
    }

    public FileRuleSource(Path root) {
        this.root = root;
    }

    static Path resolveRoot() {
        String dir = System.getProperty(TZDIR_PROPERTY);
        if (dir == null || dir.isBlank()) {
            dir = System.getenv("TZDIR");
        }
        if (dir == null || dir.isBlank()) {
            dir = DEFAULT_TZDIR;
        }
        return Paths.get(dir);
    }

    @Override
    public byte[] fetch(String zoneName) throws IOException {
        Path zoneFile = root.resolve(zoneName).normalize();
        if (! zoneFile.startsWith(root.normalize()) || ! Files.isRegularFile(zoneFile)) {
            throw new NoSuchFileException(zoneFile.toString());
        }
        return Files.readAllBytes(zoneFile);
    }

    @Override
    public String toString() {
        return "file:" + root;
    }

}
