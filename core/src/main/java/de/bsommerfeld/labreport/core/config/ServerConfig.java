package de.bsommerfeld.labreport.core.config;

/**
 * Network settings for the HTTP/WebSocket listener.
 */
public class ServerConfig {

    private String host = "0.0.0.0";
    private int port = 8080;
    private String corsOrigin = "*";
    private int bossThreads = 1;
    private int workerThreads = 4;
    private int handlerThreads = 8;
    private int maxContentLength = 1024 * 1024;

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    /** Allowed CORS origin, {@code *} for any. */
    public String getCorsOrigin() {
        return corsOrigin;
    }

    public void setCorsOrigin(String corsOrigin) {
        this.corsOrigin = corsOrigin;
    }

    public int getBossThreads() {
        return bossThreads;
    }

    public void setBossThreads(int bossThreads) {
        this.bossThreads = bossThreads;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    /** Threads for blocking request handling, kept off the I/O loop. */
    public int getHandlerThreads() {
        return handlerThreads;
    }

    public void setHandlerThreads(int handlerThreads) {
        this.handlerThreads = handlerThreads;
    }

    /** Upper bound for an aggregated request body in bytes. */
    public int getMaxContentLength() {
        return maxContentLength;
    }

    public void setMaxContentLength(int maxContentLength) {
        this.maxContentLength = maxContentLength;
    }
}
