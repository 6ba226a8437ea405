package de.bsommerfeld.labreport.service.auth;

/**
 * Result of a successful login.
 *
 * @param token    signed bearer token
 * @param username the authenticated user
 */
public record AuthToken(String token, String username) {
}
