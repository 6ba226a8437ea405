package de.bsommerfeld.labreport.service.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import de.bsommerfeld.labreport.core.config.AuthConfig;
import de.bsommerfeld.labreport.core.error.AuthenticationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class TokenServiceTest {

    private AuthConfig config;

    @BeforeEach
    void setUp() {
        config = new AuthConfig();
        config.setJwtSecret("test-secret");
        config.setTokenTtlMinutes(60);
    }

    @Test
    void issue_shouldProduceTokenThatVerifiesToSubject() {
        TokenService tokens = new TokenService(config, Clock.systemUTC());

        assertEquals("alice", tokens.verify(tokens.issue("alice")));
    }

    @Test
    void verify_shouldRejectExpiredToken() {
        Clock past = Clock.fixed(Instant.now().minus(Duration.ofHours(2)), ZoneOffset.UTC);
        String stale = new TokenService(config, past).issue("alice");

        TokenService tokens = new TokenService(config, Clock.systemUTC());
        AuthenticationException e = assertThrows(AuthenticationException.class, () -> tokens.verify(stale));
        assertEquals("Token expired", e.getMessage());
    }

    @Test
    void verify_shouldJudgeExpiryByInjectedClock() {
        Instant issuedAt = Instant.parse("2020-01-01T00:00:00Z");
        String token = new TokenService(config, Clock.fixed(issuedAt, ZoneOffset.UTC)).issue("alice");

        TokenService withinTtl = new TokenService(config,
                Clock.fixed(issuedAt.plus(Duration.ofMinutes(59)), ZoneOffset.UTC));
        assertEquals("alice", withinTtl.verify(token));

        TokenService pastTtl = new TokenService(config,
                Clock.fixed(issuedAt.plus(Duration.ofMinutes(61)), ZoneOffset.UTC));
        AuthenticationException e = assertThrows(AuthenticationException.class, () -> pastTtl.verify(token));
        assertEquals("Token expired", e.getMessage());
    }

    @Test
    void verify_shouldRejectTokenSignedWithOtherSecret() {
        AuthConfig other = new AuthConfig();
        other.setJwtSecret("other-secret");
        String foreign = new TokenService(other, Clock.systemUTC()).issue("alice");

        TokenService tokens = new TokenService(config, Clock.systemUTC());
        assertThrows(AuthenticationException.class, () -> tokens.verify(foreign));
    }

    @Test
    void verify_shouldRejectForeignIssuer() {
        String foreign = JWT.create()
                .withIssuer("someone-else")
                .withSubject("alice")
                .sign(Algorithm.HMAC256("test-secret"));

        TokenService tokens = new TokenService(config, Clock.systemUTC());
        assertThrows(AuthenticationException.class, () -> tokens.verify(foreign));
    }

    @Test
    void verify_shouldRejectGarbage() {
        TokenService tokens = new TokenService(config, Clock.systemUTC());
        assertThrows(AuthenticationException.class, () -> tokens.verify("not-a-jwt"));
    }

    @Test
    void randomSecret_shouldDifferPerInstance() {
        config.setJwtSecret(null);
        String token = new TokenService(config, Clock.systemUTC()).issue("alice");

        TokenService restarted = new TokenService(config, Clock.systemUTC());
        assertThrows(AuthenticationException.class, () -> restarted.verify(token));
    }
}
