package com.healthtrack.controller;

import com.healthtrack.controller.dto.UserView;
import com.healthtrack.security.AuthenticatedUser;
import com.healthtrack.service.UserService;
import com.healthtrack.service.UserStats;
import com.healthtrack.validation.UserSchemas;
import com.healthtrack.validation.ValidationMode;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
@CrossOrigin(origins = "${app.cors.origin}")
public class UserController {

    private final UserService userService;

    @GetMapping("/profile")
    public UserResponse profile(@AuthenticationPrincipal AuthenticatedUser caller) {
        return new UserResponse(userService.profile(caller.id()));
    }

    @PutMapping("/profile")
    public UserMessage updateProfile(@AuthenticationPrincipal AuthenticatedUser caller,
                                     @RequestBody Map<String, Object> body) {
        UserView updated = userService.updateProfile(caller.id(), UserSchemas.PROFILE.validate(body, ValidationMode.PATCH));
        return new UserMessage("Profile updated successfully", updated);
    }

    @PutMapping("/preferences")
    public PreferencesMessage updatePreferences(@AuthenticationPrincipal AuthenticatedUser caller,
                                                @RequestBody Map<String, Object> body) {
        Map<String, Object> preferences =
                userService.updatePreferences(caller.id(), UserSchemas.PREFERENCES.validate(body, ValidationMode.PATCH));
        return new PreferencesMessage("Preferences updated successfully", preferences);
    }

    @PutMapping("/password")
    public MessageResponse changePassword(@AuthenticationPrincipal AuthenticatedUser caller,
                                          @RequestBody Map<String, Object> body) {
        userService.changePassword(caller.id(), UserSchemas.PASSWORD_CHANGE.validate(body, ValidationMode.CREATE));
        return new MessageResponse("Password changed successfully");
    }

    @DeleteMapping("/account")
    public MessageResponse deactivate(@AuthenticationPrincipal AuthenticatedUser caller) {
        userService.deactivate(caller.id());
        return new MessageResponse("Account deactivated successfully");
    }

    @GetMapping("/stats")
    public StatsResponse stats(@AuthenticationPrincipal AuthenticatedUser caller) {
        return new StatsResponse(userService.stats(caller.id()));
    }

    public record UserResponse(UserView user) {}

    public record UserMessage(String message, UserView user) {}

    public record PreferencesMessage(String message, Map<String, Object> preferences) {}

    public record StatsResponse(UserStats stats) {}
}
