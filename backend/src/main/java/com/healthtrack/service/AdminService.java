package com.healthtrack.service;

import com.healthtrack.controller.dto.UserView;
import com.healthtrack.error.ForbiddenException;
import com.healthtrack.error.NotFoundException;
import com.healthtrack.model.User;
import com.healthtrack.repo.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * User management for administrators. An admin cannot lock out or remove
 * their own account from here.
 */
@Service
@Transactional
public class AdminService {

    private static final Logger log = LoggerFactory.getLogger(AdminService.class);

    static final String SELF_MODIFICATION = "Admins cannot deactivate or delete their own account";

    private final UserRepository userRepository;

    public AdminService(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    @Transactional(readOnly = true)
    public List<UserView> listUsers() {
        return userRepository.findAllByOrderByCreatedAtAsc().stream()
                .map(UserView::from)
                .toList();
    }

    public UserView setActive(Long adminId, Long userId, boolean active) {
        User user = requireUser(userId);
        if (!active && user.getId().equals(adminId)) {
            throw new ForbiddenException(SELF_MODIFICATION);
        }
        user.setActive(active);
        User saved = userRepository.saveAndFlush(user);
        log.info("Admin {} set user {} active={}", adminId, userId, active);
        return UserView.from(saved);
    }

    /**
     * Removes the user together with every alert and diagnostic test they own.
     */
    public void deleteUser(Long adminId, Long userId) {
        User user = requireUser(userId);
        if (user.getId().equals(adminId)) {
            throw new ForbiddenException(SELF_MODIFICATION);
        }
        userRepository.delete(user);
        log.info("Admin {} deleted user {}", adminId, userId);
    }

    private User requireUser(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new NotFoundException(UserService.NOT_FOUND));
    }
}
