package de.bsommerfeld.labreport.core.config;

/**
 * Location of the SQLite database file. When {@code path} is unset the file
 * lives in the platform application data directory.
 */
public class DatabaseConfig {

    private String path;
    private int busyTimeoutMillis = 5000;

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public int getBusyTimeoutMillis() {
        return busyTimeoutMillis;
    }

    public void setBusyTimeoutMillis(int busyTimeoutMillis) {
        this.busyTimeoutMillis = busyTimeoutMillis;
    }
}
