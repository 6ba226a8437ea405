package de.bsommerfeld.labreport.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;

/**
 * Locates the files the server keeps on disk: the SQLite database, the
 * optional {@code config.yml} and the log directory. All of them live below
 * one data directory. Nothing is created here.
 *
 * <p>
 * The data directory is {@code -Dlabreport.home} when set. Otherwise it
 * follows the platform convention:
 * <pre>
 * macOS    ~/Library/Application Support/{appName}
 * Windows  %APPDATA%\{appName}          (no APPDATA: ~/AppData/Roaming/{appName})
 * other    $XDG_DATA_HOME/{appName}     (no XDG_DATA_HOME: ~/.local/share/{appName})
 * </pre>
 */
public final class StoragePaths {

    public static final String HOME_PROPERTY = "labreport.home";

    private StoragePaths() {
    }

    public static Path getAppDataDir(String appName) {
        return resolveDataDir(appName, System.getProperty(HOME_PROPERTY), System.getProperty("os.name", ""),
                System.getProperty("user.home"), System.getenv());
    }

    public static Path getLogsDir(String appName) {
        return getAppDataDir(appName).resolve("logs");
    }

    public static Path getConfigFile(String appName) {
        return getAppDataDir(appName).resolve("config.yml");
    }

    public static Path getDatabaseFile(String appName) {
        return getAppDataDir(appName).resolve(appName + ".db");
    }

    static Path resolveDataDir(String appName, String homeOverride, String osName, String userHome,
            Map<String, String> env) {
        if (isSet(homeOverride)) {
            return Paths.get(homeOverride).toAbsolutePath();
        }
        String os = osName.toLowerCase(Locale.ROOT);
        if (os.contains("mac") || os.contains("darwin")) {
            return Paths.get(userHome, "Library", "Application Support", appName);
        }
        if (os.contains("win")) {
            String appData = env.get("APPDATA");
            return isSet(appData)
                    ? Paths.get(appData, appName)
                    : Paths.get(userHome, "AppData", "Roaming", appName);
        }
        String xdgData = env.get("XDG_DATA_HOME");
        return isSet(xdgData)
                ? Paths.get(xdgData, appName)
                : Paths.get(userHome, ".local", "share", appName);
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }
}
