package de.bsommerfeld.liteguard.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Settings for one logical database. Bound from JSON by {@link ConfigLoader};
 * every field carries a default so an absent or partial file still yields a
 * usable configuration.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DatabaseConfig {

    public static final int DEFAULT_STATEMENT_CACHE_LIMIT = 512;

    /** File stem of the database, without the {@code .db} extension. */
    @JsonProperty("name")
    private String name = "database";

    @JsonProperty("directory")
    private String directory = "./";

    /** Prepared statements held before the cache is flushed. */
    @JsonProperty("statement-cache-limit")
    private int statementCacheLimit = DEFAULT_STATEMENT_CACHE_LIMIT;

    public DatabaseConfig() {
    }

    public DatabaseConfig(String name, String directory, int statementCacheLimit) {
        this.name = name;
        this.directory = directory;
        this.statementCacheLimit = statementCacheLimit;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDirectory() {
        return directory;
    }

    public void setDirectory(String directory) {
        this.directory = directory;
    }

    public int getStatementCacheLimit() {
        return statementCacheLimit;
    }

    public void setStatementCacheLimit(int statementCacheLimit) {
        this.statementCacheLimit = statementCacheLimit;
    }

    @Override
    public String toString() {
        return "DatabaseConfig{name='" + name + "', directory='" + directory
                + "', statementCacheLimit=" + statementCacheLimit + "}";
    }
}
