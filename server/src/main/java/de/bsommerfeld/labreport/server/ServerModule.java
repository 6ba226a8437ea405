package de.bsommerfeld.labreport.server;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.labreport.core.config.ApplicationMode;
import de.bsommerfeld.labreport.core.config.AuthConfig;
import de.bsommerfeld.labreport.core.config.DatabaseConfig;
import de.bsommerfeld.labreport.core.config.GlobalConfig;
import de.bsommerfeld.labreport.core.config.ServerConfig;
import de.bsommerfeld.labreport.core.event.ChangeNotifier;
import de.bsommerfeld.labreport.core.event.TopicChangeNotifier;
import de.bsommerfeld.labreport.db.DatabaseService;
import de.bsommerfeld.labreport.db.InMemoryDatabaseService;
import de.bsommerfeld.labreport.db.SqlDatabaseService;
import de.bsommerfeld.labreport.server.http.ApiRouter;
import de.bsommerfeld.labreport.server.http.LabReportApi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;

/**
 * Guice wiring for the server process.
 */
public class ServerModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(ServerModule.class);

    private final GlobalConfig config;
    private final ApplicationMode mode;

    public ServerModule(GlobalConfig config, ApplicationMode mode) {
        this.config = config;
        this.mode = mode;
    }

    @Override
    protected void configure() {
        bind(GlobalConfig.class).toInstance(config);

        // Bind Sub-Configs for convenience
        bind(ServerConfig.class).toInstance(config.getServer());
        bind(DatabaseConfig.class).toInstance(config.getDatabase());
        bind(AuthConfig.class).toInstance(config.getAuth());

        bind(Clock.class).toInstance(Clock.systemUTC());
        bind(PasswordEncoder.class).toInstance(new BCryptPasswordEncoder());
        bind(ChangeNotifier.class).to(TopicChangeNotifier.class);

        // --- MODE SWITCHING (PROD vs TEST) ---
        LOG.info("Application Mode initialized: {}", mode);
        if (mode.isTest()) {
            bind(DatabaseService.class).to(InMemoryDatabaseService.class);
        } else {
            bind(DatabaseService.class).to(SqlDatabaseService.class);
        }

        bind(ChangeLogListener.class).asEagerSingleton();
    }

    @Provides
    @Singleton
    ApiRouter provideRouter(LabReportApi api) {
        return api.register(new ApiRouter());
    }
}
