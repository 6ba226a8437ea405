package de.bsommerfeld.labreport.service.auth;

import de.bsommerfeld.labreport.core.config.AuthConfig;
import de.bsommerfeld.labreport.core.domain.User;
import de.bsommerfeld.labreport.core.error.AuthenticationException;
import de.bsommerfeld.labreport.core.error.ConstraintViolationException;
import de.bsommerfeld.labreport.core.error.ValidationException;
import de.bsommerfeld.labreport.db.DatabaseService;
import de.bsommerfeld.labreport.db.InMemoryDatabaseService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests registration, login and bearer resolution with a real BCrypt encoder
 * (low cost factor) over the in-memory store.
 */
@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC);

    @Mock
    private DatabaseService mockStore;

    private DatabaseService store;
    private AuthConfig config;
    private TokenService tokens;
    private AuthService auth;

    @BeforeEach
    void setUp() {
        store = new InMemoryDatabaseService();
        config = new AuthConfig();
        config.setJwtSecret("test-secret");
        tokens = new TokenService(config, Clock.systemUTC());
        auth = new AuthService(store, new BCryptPasswordEncoder(4), tokens, config, CLOCK);
    }

    @Test
    void register_shouldStoreHashNotPassword() {
        User user = auth.register("alice", "secret1");

        User stored = store.findUser("alice").orElseThrow();
        assertEquals(user, stored);
        assertNotEquals("secret1", stored.passwordHash());
        assertTrue(stored.passwordHash().startsWith("$2"));
        assertEquals(CLOCK.instant(), stored.createdAt());
    }

    @Test
    void register_shouldRejectDuplicateUsername() {
        auth.register("alice", "secret1");
        assertThrows(ConstraintViolationException.class, () -> auth.register("alice", "secret2"));
    }

    @Test
    void register_shouldRejectShortPassword() {
        ValidationException e = assertThrows(ValidationException.class, () -> auth.register("alice", "123"));
        assertTrue(e.getMessage().contains("6"));
        assertTrue(store.findUser("alice").isEmpty());
    }

    @Test
    void register_shouldRejectBlankUsername() {
        assertThrows(ValidationException.class, () -> auth.register("  ", "secret1"));
    }

    @Test
    void login_shouldIssueTokenForValidCredentials() {
        auth.register("alice", "secret1");

        AuthToken token = auth.login("alice", "secret1");

        assertEquals("alice", token.username());
        assertEquals("alice", tokens.verify(token.token()));
    }

    @Test
    void login_shouldRejectWrongPassword() {
        auth.register("alice", "secret1");
        assertThrows(AuthenticationException.class, () -> auth.login("alice", "wrong-password"));
    }

    @Test
    void login_shouldRejectUnknownUserWithoutCheckingHash() {
        PasswordEncoder encoder = mock(PasswordEncoder.class);
        when(mockStore.findUser("ghost")).thenReturn(Optional.empty());
        AuthService isolated = new AuthService(mockStore, encoder, tokens, config, CLOCK);

        AuthenticationException e = assertThrows(AuthenticationException.class,
                () -> isolated.login("ghost", "whatever"));

        assertEquals("Invalid username or password", e.getMessage());
        verifyNoInteractions(encoder);
    }

    @Test
    void authenticate_shouldResolveBearerHeader() {
        auth.register("alice", "secret1");
        String token = auth.login("alice", "secret1").token();

        assertEquals("alice", auth.authenticate("Bearer " + token));
    }

    @Test
    void authenticate_shouldRejectMissingOrMalformedHeader() {
        assertThrows(AuthenticationException.class, () -> auth.authenticate(null));
        assertThrows(AuthenticationException.class, () -> auth.authenticate("Basic abc"));
        assertThrows(AuthenticationException.class, () -> auth.authenticate("Bearer "));
        assertThrows(AuthenticationException.class, () -> auth.authenticate("Bearer garbage"));
    }
}
