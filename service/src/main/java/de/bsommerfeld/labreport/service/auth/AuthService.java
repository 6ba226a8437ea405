package de.bsommerfeld.labreport.service.auth;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.labreport.core.config.AuthConfig;
import de.bsommerfeld.labreport.core.domain.User;
import de.bsommerfeld.labreport.core.error.AuthenticationException;
import de.bsommerfeld.labreport.core.error.ConstraintViolationException;
import de.bsommerfeld.labreport.core.error.ValidationException;
import de.bsommerfeld.labreport.db.DatabaseService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;
import java.util.Optional;

/**
 * Registration, login and bearer token resolution. Produces the actor name
 * the document service records as a report's creator.
 */
@Singleton
public class AuthService {

    private static final Logger LOG = LoggerFactory.getLogger(AuthService.class);

    private static final String BEARER_PREFIX = "Bearer ";

    private final DatabaseService store;
    private final PasswordEncoder passwordEncoder;
    private final TokenService tokenService;
    private final AuthConfig config;
    private final Clock clock;

    @Inject
    public AuthService(DatabaseService store, PasswordEncoder passwordEncoder, TokenService tokenService,
            AuthConfig config, Clock clock) {
        this.store = store;
        this.passwordEncoder = passwordEncoder;
        this.tokenService = tokenService;
        this.config = config;
        this.clock = clock;
    }

    /**
     * @throws ValidationException          on a blank username or a password
     *                                      below the configured minimum length
     * @throws ConstraintViolationException if the username is taken
     */
    public User register(String username, String password) {
        if (username == null || username.isBlank())
            throw new ValidationException("Missing required field: username");
        if (password == null || password.isEmpty())
            throw new ValidationException("Missing required field: password");
        if (password.length() < config.getMinPasswordLength())
            throw new ValidationException(
                    "Password must be at least " + config.getMinPasswordLength() + " characters");
        if (store.findUser(username).isPresent())
            throw new ConstraintViolationException("Username already exists: " + username);

        User user = new User(username, passwordEncoder.encode(password), clock.instant());
        store.insertUser(user);
        LOG.info("Registered user {}", username);
        return user;
    }

    /**
     * @throws AuthenticationException on unknown user or wrong password, with
     *                                 the same message for both
     */
    public AuthToken login(String username, String password) {
        if (username == null || password == null)
            throw new AuthenticationException("Invalid username or password");

        Optional<User> user = store.findUser(username);
        if (user.isEmpty() || !passwordEncoder.matches(password, user.get().passwordHash())) {
            LOG.info("Failed login for {}", username);
            throw new AuthenticationException("Invalid username or password");
        }
        LOG.debug("User {} logged in", username);
        return new AuthToken(tokenService.issue(username), username);
    }

    /**
     * Resolves an {@code Authorization} header value to the actor's username.
     *
     * @throws AuthenticationException if the header is missing, not a bearer
     *                                 token, or the token does not verify
     */
    public String authenticate(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX))
            throw new AuthenticationException("Missing bearer token");
        String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        if (token.isEmpty())
            throw new AuthenticationException("Missing bearer token");
        return tokenService.verify(token);
    }
}
