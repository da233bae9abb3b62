package com.healthtrack.security;

import com.healthtrack.model.User;
import com.healthtrack.repo.UserRepository;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves an {@code Authorization} header to an active user, or classifies
 * why it cannot. Reads only; nothing is written on the request path.
 */
@Component
public class AuthGate {

    private static final Logger log = LoggerFactory.getLogger(AuthGate.class);
    private static final String BEARER = "Bearer ";

    private final JwtService jwtService;
    private final UserRepository userRepository;

    public AuthGate(JwtService jwtService, UserRepository userRepository) {
        this.jwtService = jwtService;
        this.userRepository = userRepository;
    }

    public AuthResult authenticate(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return AuthResult.failure(AuthFailure.MISSING);
        }
        if (!authorizationHeader.startsWith(BEARER)) {
            log.debug("Rejected authorization header without Bearer scheme");
            return AuthResult.failure(AuthFailure.INVALID);
        }
        String token = authorizationHeader.substring(BEARER.length()).trim();
        if (token.isEmpty()) {
            return AuthResult.failure(AuthFailure.MISSING);
        }

        try {
            return resolveActive(jwtService.parseUserId(token));
        } catch (ExpiredJwtException e) {
            log.debug("Rejected expired token for subject {}", e.getClaims().getSubject());
            return AuthResult.failure(AuthFailure.EXPIRED);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected invalid token: {}", e.getMessage());
            return AuthResult.failure(AuthFailure.INVALID);
        }
    }

    private AuthResult resolveActive(Long userId) {
        return userRepository.findById(userId)
                .filter(User::isActive)
                .map(user -> AuthResult.success(AuthenticatedUser.from(user)))
                .orElseGet(() -> {
                    log.debug("Rejected token for missing or inactive user {}", userId);
                    return AuthResult.failure(AuthFailure.INACTIVE_USER);
                });
    }
}
