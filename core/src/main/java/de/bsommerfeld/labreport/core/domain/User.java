package de.bsommerfeld.labreport.core.domain;

import java.time.Instant;

/**
 * Registered account. Only referenced by the document hierarchy through
 * {@link LabReport#createdBy()}.
 *
 * @param username     unique login name, primary key
 * @param passwordHash BCrypt hash of the password, never the raw value
 * @param createdAt    registration instant
 */
public record User(String username, String passwordHash, Instant createdAt) {

    @Override
    public String toString() {
        return "User[username=" + username + ", createdAt=" + createdAt + "]";
    }
}
