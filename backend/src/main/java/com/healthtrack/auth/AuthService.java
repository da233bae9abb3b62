package com.healthtrack.auth;

import com.healthtrack.controller.dto.UserView;
import com.healthtrack.error.AuthException;
import com.healthtrack.error.ConflictException;
import com.healthtrack.error.NotFoundException;
import com.healthtrack.model.User;
import com.healthtrack.repo.UserRepository;
import com.healthtrack.security.JwtService;
import com.healthtrack.validation.UserSchemas;
import com.healthtrack.validation.ValidatedInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Registration, login and token refresh.
 */
@Service
@Transactional
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    static final String INVALID_CREDENTIALS = "Invalid credentials";
    static final String ACCOUNT_DEACTIVATED = "Account is deactivated";
    static final String USER_EXISTS = "User already exists with this email";

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtService jwtService;
    private final Clock clock;

    public AuthService(UserRepository userRepository,
                       PasswordEncoder passwordEncoder,
                       JwtService jwtService,
                       Clock clock) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtService = jwtService;
        this.clock = clock;
    }

    public Session register(ValidatedInput input) {
        String email = input.get(UserSchemas.EMAIL, String.class);
        if (userRepository.existsByEmail(email)) {
            throw new ConflictException(USER_EXISTS);
        }

        User user = new User();
        user.setName(input.get(UserSchemas.NAME, String.class));
        user.setEmail(email);
        user.setPasswordHash(passwordEncoder.encode(input.get(UserSchemas.PASSWORD, String.class)));
        User saved = userRepository.saveAndFlush(user);

        log.info("Registered user {}", saved.getId());
        return new Session(jwtService.generateToken(saved), UserView.from(saved));
    }

    public Session login(ValidatedInput input) {
        User user = userRepository.findByEmail(input.get(UserSchemas.EMAIL, String.class))
                .orElseThrow(() -> new AuthException(INVALID_CREDENTIALS));

        if (!passwordEncoder.matches(input.get(UserSchemas.PASSWORD, String.class), user.getPasswordHash())) {
            log.info("Failed login for user {}", user.getId());
            throw new AuthException(INVALID_CREDENTIALS);
        }
        if (!user.isActive()) {
            throw new AuthException(ACCOUNT_DEACTIVATED);
        }

        user.setLastLogin(now());
        User saved = userRepository.saveAndFlush(user);
        log.info("User {} logged in", saved.getId());
        return new Session(jwtService.generateToken(saved), UserView.from(saved));
    }

    @Transactional(readOnly = true)
    public UserView me(Long userId) {
        return UserView.from(requireUser(userId));
    }

    @Transactional(readOnly = true)
    public String refresh(Long userId) {
        return jwtService.generateToken(requireUser(userId));
    }

    private User requireUser(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new NotFoundException("User not found"));
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    /** A freshly issued token and the profile it belongs to. */
    public record Session(String token, UserView user) {
    }
}
