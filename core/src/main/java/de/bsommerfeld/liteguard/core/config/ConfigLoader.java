package de.bsommerfeld.liteguard.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a {@link DatabaseConfig} from a JSON file.
 *
 * <p>
 * A missing file is not an error: the defaults are returned and the fact is
 * logged. A file that exists but cannot be parsed, or that carries values the
 * database cannot start with, fails fast with an {@link IllegalStateException}
 * naming the offending path.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ConfigLoader() {
    }

    /**
     * @param path location of the JSON configuration
     * @return the parsed and validated configuration, or defaults if the file
     *         does not exist
     * @throws IllegalStateException if the file is unreadable, malformed or
     *                               invalid
     */
    public static DatabaseConfig load(Path path) {
        if (!Files.exists(path)) {
            LOG.info("No configuration at {}, using defaults.", path.toAbsolutePath());
            return validate(new DatabaseConfig(), path);
        }

        LOG.info("Loading configuration from: {}", path.toAbsolutePath());
        try {
            DatabaseConfig config = MAPPER.readValue(Files.readAllBytes(path), DatabaseConfig.class);
            if (config == null) {
                throw new IllegalStateException("Configuration is empty: " + path);
            }
            return validate(config, path);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Malformed configuration: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read configuration: " + path, e);
        }
    }

    private static DatabaseConfig validate(DatabaseConfig config, Path path) {
        if (config.getName() == null || config.getName().isBlank()) {
            throw new IllegalStateException("Invalid configuration " + path + ": 'name' must not be blank");
        }
        if (config.getDirectory() == null || config.getDirectory().isBlank()) {
            throw new IllegalStateException("Invalid configuration " + path + ": 'directory' must not be blank");
        }
        if (config.getStatementCacheLimit() <= 0) {
            throw new IllegalStateException("Invalid configuration " + path
                    + ": 'statement-cache-limit' must be positive, was " + config.getStatementCacheLimit());
        }
        LOG.debug("Configuration resolved: {}", config);
        return config;
    }
}
