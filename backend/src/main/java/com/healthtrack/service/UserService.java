package com.healthtrack.service;

import com.healthtrack.controller.dto.UserView;
import com.healthtrack.error.ConflictException;
import com.healthtrack.error.NotFoundException;
import com.healthtrack.error.ValidationException;
import com.healthtrack.model.AlertStatus;
import com.healthtrack.model.User;
import com.healthtrack.model.UserPreferences;
import com.healthtrack.model.WireEnum;
import com.healthtrack.repo.AlertRepository;
import com.healthtrack.repo.DiagnosticTestRepository;
import com.healthtrack.repo.UserRepository;
import com.healthtrack.validation.UserSchemas;
import com.healthtrack.validation.ValidatedInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Self-service account operations for the authenticated user.
 */
@Service
@Transactional
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    public static final String NOT_FOUND = "User not found";
    static final String EMAIL_TAKEN = "Email is already taken by another user";
    static final String WRONG_PASSWORD = "Current password is incorrect";
    static final String CONFIRM_MISMATCH = "Password confirmation does not match";

    private final UserRepository userRepository;
    private final AlertRepository alertRepository;
    private final DiagnosticTestRepository testRepository;
    private final PasswordEncoder passwordEncoder;

    public UserService(UserRepository userRepository,
                       AlertRepository alertRepository,
                       DiagnosticTestRepository testRepository,
                       PasswordEncoder passwordEncoder) {
        this.userRepository = userRepository;
        this.alertRepository = alertRepository;
        this.testRepository = testRepository;
        this.passwordEncoder = passwordEncoder;
    }

    @Transactional(readOnly = true)
    public UserView profile(Long userId) {
        return UserView.from(requireUser(userId));
    }

    public UserView updateProfile(Long userId, ValidatedInput input) {
        User user = requireUser(userId);
        if (input.has(UserSchemas.EMAIL)) {
            String email = input.get(UserSchemas.EMAIL, String.class);
            if (userRepository.existsByEmailAndIdNot(email, userId)) {
                throw new ConflictException(EMAIL_TAKEN);
            }
            user.setEmail(email);
        }
        if (input.has(UserSchemas.NAME)) {
            user.setName(input.get(UserSchemas.NAME, String.class));
        }
        return UserView.from(userRepository.saveAndFlush(user));
    }

    /**
     * Merges the recognized keys into the stored preferences and returns the
     * effective set, defaults included.
     */
    public Map<String, Object> updatePreferences(Long userId, ValidatedInput input) {
        User user = requireUser(userId);
        Map<String, Object> merged = new LinkedHashMap<>();
        if (user.getPreferences() != null) {
            merged.putAll(user.getPreferences());
        }
        input.asMap().forEach((key, value) ->
                merged.put(key, value instanceof WireEnum wire ? wire.wireValue() : value));
        user.setPreferences(merged);
        userRepository.saveAndFlush(user);
        return UserPreferences.withDefaults(merged);
    }

    public void changePassword(Long userId, ValidatedInput input) {
        String newPassword = input.get(UserSchemas.NEW_PASSWORD, String.class);
        if (!newPassword.equals(input.get(UserSchemas.CONFIRM_PASSWORD, String.class))) {
            throw ValidationException.of(UserSchemas.CONFIRM_PASSWORD, CONFIRM_MISMATCH, null);
        }

        User user = requireUser(userId);
        if (!passwordEncoder.matches(input.get(UserSchemas.CURRENT_PASSWORD, String.class), user.getPasswordHash())) {
            throw ValidationException.of(UserSchemas.CURRENT_PASSWORD, WRONG_PASSWORD, null);
        }
        user.setPasswordHash(passwordEncoder.encode(newPassword));
        userRepository.save(user);
        log.info("User {} changed password", userId);
    }

    /**
     * Soft delete: the account stays but can no longer authenticate.
     */
    public void deactivate(Long userId) {
        User user = requireUser(userId);
        user.setActive(false);
        userRepository.save(user);
        log.info("User {} deactivated their account", userId);
    }

    @Transactional(readOnly = true)
    public UserStats stats(Long userId) {
        User user = requireUser(userId);
        return new UserStats(
                alertRepository.countOwned(userId),
                alertRepository.countOwnedWithStatus(userId, AlertStatus.ACTIVE),
                testRepository.countOwned(userId),
                user.getCreatedAt(),
                user.getLastLogin());
    }

    private User requireUser(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new NotFoundException(NOT_FOUND));
    }
}
