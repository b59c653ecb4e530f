package civiltime.registry;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.NoSuchFileException;

/**
 * Reads zones bundled as resources, under a common prefix.
 */
public class ClasspathRuleSource implements RuleSource {

    private final ClassLoader loader;
    private final String prefix;

    public ClasspathRuleSource(String prefix) {
        this(ClasspathRuleSource.class.getClassLoader(), prefix);
    }

    public ClasspathRuleSource(ClassLoader loader, String prefix) {
        this.loader = loader;
        this.prefix = prefix.endsWith("/") ? prefix : prefix + "/";
    }

    @Override
    public byte[] fetch(String zoneName) throws IOException {
        String resource = prefix + zoneName;
        try (InputStream is = loader.getResourceAsStream(resource)) {
            if (is == null) {
                throw new NoSuchFileException(resource);
            }
            return is.readAllBytes();
        }
    }

    @Override
    public String toString() {
        return "classpath:" + prefix;
    }

}
