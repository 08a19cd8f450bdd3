package de.bsommerfeld.liteguard.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_shouldReturnDefaultsWhenFileIsMissing() {
        DatabaseConfig config = ConfigLoader.load(tempDir.resolve("absent.json"));

        assertEquals("database", config.getName());
        assertEquals("./", config.getDirectory());
        assertEquals(512, config.getStatementCacheLimit());
    }

    @Test
    void load_shouldReadAllKeys() throws IOException {
        Path file = write("{\"name\": \"students\", \"directory\": \"/var/data\", \"statement-cache-limit\": 64}");

        DatabaseConfig config = ConfigLoader.load(file);

        assertEquals("students", config.getName());
        assertEquals("/var/data", config.getDirectory());
        assertEquals(64, config.getStatementCacheLimit());
    }

    @Test
    void load_shouldKeepDefaultsForOmittedKeys() throws IOException {
        Path file = write("{\"name\": \"events\"}");

        DatabaseConfig config = ConfigLoader.load(file);

        assertEquals("events", config.getName());
        assertEquals("./", config.getDirectory());
        assertEquals(DatabaseConfig.DEFAULT_STATEMENT_CACHE_LIMIT, config.getStatementCacheLimit());
    }

    @Test
    void load_shouldIgnoreUnknownKeys() throws IOException {
        Path file = write("{\"name\": \"events\", \"server-port\": 3000}");

        assertEquals("events", ConfigLoader.load(file).getName());
    }

    @Test
    void load_shouldRejectMalformedJson() throws IOException {
        Path file = write("{\"name\": ");

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> ConfigLoader.load(file));
        assertTrue(e.getMessage().contains(file.toString()));
    }

    @Test
    void load_shouldRejectNonPositiveCacheLimit() throws IOException {
        Path file = write("{\"statement-cache-limit\": 0}");

        assertThrows(IllegalStateException.class, () -> ConfigLoader.load(file));
    }

    @Test
    void load_shouldRejectBlankName() throws IOException {
        Path file = write("{\"name\": \"  \"}");

        assertThrows(IllegalStateException.class, () -> ConfigLoader.load(file));
    }

    private Path write(String json) throws IOException {
        Path file = tempDir.resolve("config.json");
        Files.writeString(file, json);
        return file;
    }
}
