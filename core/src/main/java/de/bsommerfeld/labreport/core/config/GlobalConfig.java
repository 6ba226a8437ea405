package de.bsommerfeld.labreport.core.config;

/**
 * Root of the configuration tree, bound from {@code config.yml}. Every
 * section is initialized with defaults so a missing file, a partial file or
 * an empty section ({@code database:} with nothing below) yields a runnable
 * configuration.
 *
 * <pre>
 * server:
 *   host: 0.0.0.0
 *   port: 8080
 *   cors-origin: "*"
 * database:
 *   path: /var/lib/labreport/labreport.db
 * auth:
 *   jwt-secret: change-me
 *   token-ttl-minutes: 1440
 * </pre>
 */
public class GlobalConfig {

    private ServerConfig server = new ServerConfig();
    private DatabaseConfig database = new DatabaseConfig();
    private AuthConfig auth = new AuthConfig();

    public ServerConfig getServer() {
        return server;
    }

    public void setServer(ServerConfig server) {
        this.server = server != null ? server : new ServerConfig();
    }

    public DatabaseConfig getDatabase() {
        return database;
    }

    public void setDatabase(DatabaseConfig database) {
        this.database = database != null ? database : new DatabaseConfig();
    }

    public AuthConfig getAuth() {
        return auth;
    }

    public void setAuth(AuthConfig auth) {
        this.auth = auth != null ? auth : new AuthConfig();
    }
}
