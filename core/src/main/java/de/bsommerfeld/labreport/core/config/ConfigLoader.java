package de.bsommerfeld.labreport.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import de.bsommerfeld.labreport.core.util.StoragePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Builds the {@link GlobalConfig} in three layers, later layers winning:
 * <ol>
 * <li>defaults declared on the config classes</li>
 * <li>a YAML file with kebab-case keys ({@code cors-origin},
 * {@code token-ttl-minutes})</li>
 * <li>environment overrides: {@code PORT}, {@code DATABASE_URL},
 * {@code CORS_ORIGIN}, {@code JWT_SECRET}</li>
 * </ol>
 * Unknown YAML keys are ignored so older binaries tolerate newer files.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String APP_NAME = "labreport";

    private static final ObjectMapper YAML = YAMLMapper.builder()
            .propertyNamingStrategy(PropertyNamingStrategies.KEBAB_CASE)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private ConfigLoader() {
    }

    /**
     * Loads the configuration from {@code -Dconfig=<path>} or
     * {@code <appdata>/config.yml} and applies the process environment.
     */
    public static GlobalConfig load() {
        String explicit = System.getProperty("config");
        Path path = (explicit != null && !explicit.isBlank())
                ? Paths.get(explicit)
                : StoragePaths.getConfigFile(APP_NAME);
        return load(path, System.getenv());
    }

    /**
     * Loads {@code path} if it exists, otherwise starts from defaults, then
     * applies {@code env}. Database path falls back to the application data
     * directory.
     *
     * @throws IllegalStateException if the file exists but cannot be parsed
     */
    public static GlobalConfig load(Path path, Map<String, String> env) {
        GlobalConfig config;
        if (Files.isRegularFile(path)) {
            LOG.info("Loading Configuration from: {}", path.toAbsolutePath());
            try {
                String yaml = Files.readString(path);
                config = yaml.isBlank() ? null : YAML.readValue(yaml, GlobalConfig.class);
            } catch (IOException e) {
                throw new IllegalStateException("Failed to read configuration: " + path, e);
            }
            // a bare "~" document binds to null
            if (config == null) {
                config = new GlobalConfig();
            }
        } else {
            LOG.info("No configuration at {}, using defaults", path.toAbsolutePath());
            config = new GlobalConfig();
        }
        applyEnvironment(config, env);
        if (config.getDatabase().getPath() == null || config.getDatabase().getPath().isBlank()) {
            config.getDatabase().setPath(StoragePaths.getDatabaseFile(APP_NAME).toString());
        }
        return config;
    }

    static void applyEnvironment(GlobalConfig config, Map<String, String> env) {
        String port = env.get("PORT");
        if (port != null && !port.isBlank()) {
            try {
                config.getServer().setPort(Integer.parseInt(port.trim()));
            } catch (NumberFormatException e) {
                LOG.warn("Ignoring non-numeric PORT '{}'", port);
            }
        }
        String databaseUrl = env.get("DATABASE_URL");
        if (databaseUrl != null && !databaseUrl.isBlank()) {
            config.getDatabase().setPath(databaseUrl.trim());
        }
        String corsOrigin = env.get("CORS_ORIGIN");
        if (corsOrigin != null && !corsOrigin.isBlank()) {
            config.getServer().setCorsOrigin(corsOrigin.trim());
        }
        String secret = env.get("JWT_SECRET");
        if (secret != null && !secret.isBlank()) {
            config.getAuth().setJwtSecret(secret);
        }
    }
}
