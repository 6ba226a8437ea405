package de.bsommerfeld.labreport.core.config;

/**
 * Token and password policy. A {@code null} secret makes the token service
 * generate a random one per process, which invalidates issued tokens on
 * restart.
 */
public class AuthConfig {

    private String jwtSecret;
    private long tokenTtlMinutes = 24 * 60;
    private int minPasswordLength = 6;

    public String getJwtSecret() {
        return jwtSecret;
    }

    public void setJwtSecret(String jwtSecret) {
        this.jwtSecret = jwtSecret;
    }

    public long getTokenTtlMinutes() {
        return tokenTtlMinutes;
    }

    public void setTokenTtlMinutes(long tokenTtlMinutes) {
        this.tokenTtlMinutes = tokenTtlMinutes;
    }

    public int getMinPasswordLength() {
        return minPasswordLength;
    }

    public void setMinPasswordLength(int minPasswordLength) {
        this.minPasswordLength = minPasswordLength;
    }
}
