package de.bsommerfeld.kurral.feed.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes {@link GlobalConfig} as TOML. A missing file is created
 * from the defaults so operators always have a complete file to edit.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final TomlMapper MAPPER = TomlMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private ConfigLoader() {
    }

    /**
     * Loads the configuration at {@code path}, writing defaults first if the
     * file does not exist yet.
     *
     * @throws ConfigLoadException if the file cannot be read, parsed or created
     */
    public static GlobalConfig load(Path path) {
        try {
            if (!Files.exists(path)) {
                LOG.info("No configuration at {}, writing defaults", path.toAbsolutePath());
                GlobalConfig defaults = new GlobalConfig();
                write(path, defaults);
                return defaults;
            }
            LOG.info("Loading configuration from: {}", path.toAbsolutePath());
            return MAPPER.readValue(path.toFile(), GlobalConfig.class);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to load configuration from " + path, e);
        }
    }

    /**
     * Loads a configuration bundled on the classpath.
     *
     * @throws ConfigLoadException if the resource is missing or malformed
     */
    public static GlobalConfig loadResource(String resource) {
        try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IOException("Resource not found: " + resource);
            return MAPPER.readValue(in, GlobalConfig.class);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to load configuration resource " + resource, e);
        }
    }

    public static void write(Path path, GlobalConfig config) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent))
            Files.createDirectories(parent);
        MAPPER.writeValue(path.toFile(), config);
    }
}
