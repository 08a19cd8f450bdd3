package de.bsommerfeld.liteguard.db;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.liteguard.core.config.ConfigLoader;
import de.bsommerfeld.liteguard.core.config.DatabaseConfig;
import de.bsommerfeld.liteguard.core.lifecycle.ShutdownCoordinator;
import de.bsommerfeld.liteguard.core.lifecycle.ShutdownRegistrar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Guice wiring for a single {@link SqliteDatabase}.
 *
 * <p>
 * The configuration is either handed in or loaded from the JSON file named by
 * the {@value #CONFIG_PROPERTY} system property (default
 * {@code config.json}). The {@link ShutdownCoordinator} is bound as the
 * {@link ShutdownRegistrar} and installs its JVM hook on creation, so the
 * provided database is closed on graceful termination without further setup.
 */
public class DatabaseModule extends AbstractModule {

    public static final String CONFIG_PROPERTY = "liteguard.config";

    private static final Logger LOG = LoggerFactory.getLogger(DatabaseModule.class);

    private final DatabaseConfig config;

    public DatabaseModule() {
        this(null);
    }

    /** @param config fixed configuration, {@code null} to load from disk */
    public DatabaseModule(DatabaseConfig config) {
        this.config = config;
    }

    @Override
    protected void configure() {
        bind(ShutdownRegistrar.class).to(ShutdownCoordinator.class);
    }

    @Provides
    @Singleton
    ShutdownCoordinator provideShutdownCoordinator() {
        ShutdownCoordinator coordinator = new ShutdownCoordinator();
        coordinator.installHook();
        return coordinator;
    }

    @Provides
    @Singleton
    DatabaseConfig provideDatabaseConfig() {
        if (config != null)
            return config;
        Path path = Path.of(System.getProperty(CONFIG_PROPERTY, "config.json"));
        return ConfigLoader.load(path);
    }

    @Provides
    @Singleton
    SqliteDatabase provideDatabase(DatabaseConfig databaseConfig, ShutdownRegistrar registrar) {
        LOG.info("Opening database '{}' in {}", databaseConfig.getName(), databaseConfig.getDirectory());
        return new SqliteDatabase(databaseConfig, registrar);
    }
}
