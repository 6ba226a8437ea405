package de.bsommerfeld.labreport.service.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.exceptions.TokenExpiredException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.auth0.jwt.interfaces.JWTVerifier;
import com.google.common.base.Strings;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.labreport.core.config.AuthConfig;
import de.bsommerfeld.labreport.core.error.AuthenticationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;

/**
 * Issues and verifies HMAC-256 signed JWTs. The subject is the username,
 * the issuer is fixed.
 *
 * <p>
 * Without a configured secret a random one is generated per process. Tokens
 * then stop verifying after a restart.
 */
@Singleton
public class TokenService {

    private static final Logger LOG = LoggerFactory.getLogger(TokenService.class);

    static final String ISSUER = "labreport";

    private final Algorithm algorithm;
    private final JWTVerifier verifier;
    private final Duration ttl;
    private final Clock clock;

    @Inject
    public TokenService(AuthConfig config, Clock clock) {
        this.algorithm = Algorithm.HMAC256(resolveSecret(config.getJwtSecret()));
        this.ttl = Duration.ofMinutes(config.getTokenTtlMinutes());
        this.clock = clock;
        // expiry and issued-at are checked against the same clock that issues
        this.verifier = ((com.auth0.jwt.JWTVerifier.BaseVerification) JWT.require(algorithm).withIssuer(ISSUER))
                .build(clock);
    }

    private static String resolveSecret(String configured) {
        if (!Strings.isNullOrEmpty(configured))
            return configured;
        LOG.warn("No JWT secret configured (auth.jwt-secret / JWT_SECRET). "
                + "Using a random secret; issued tokens will not survive a restart.");
        byte[] bytes = new byte[32];
        new SecureRandom().nextBytes(bytes);
        return Base64.getEncoder().encodeToString(bytes);
    }

    public String issue(String username) {
        Instant now = clock.instant();
        return JWT.create()
                .withIssuer(ISSUER)
                .withSubject(username)
                .withIssuedAt(now)
                .withExpiresAt(now.plus(ttl))
                .sign(algorithm);
    }

    /**
     * @return the username the token was issued to
     * @throws AuthenticationException if the signature, issuer or expiry does
     *                                 not check out
     */
    public String verify(String token) {
        try {
            DecodedJWT jwt = verifier.verify(token);
            if (Strings.isNullOrEmpty(jwt.getSubject()))
                throw new AuthenticationException("Token has no subject");
            return jwt.getSubject();
        } catch (TokenExpiredException e) {
            throw new AuthenticationException("Token expired", e);
        } catch (JWTVerificationException e) {
            LOG.debug("Rejected token: {}", e.getMessage());
            throw new AuthenticationException("Invalid token", e);
        }
    }
}
