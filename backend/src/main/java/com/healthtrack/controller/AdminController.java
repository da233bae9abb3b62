package com.healthtrack.controller;

import com.healthtrack.controller.dto.UserView;
import com.healthtrack.security.AuthenticatedUser;
import com.healthtrack.service.AdminService;
import com.healthtrack.validation.UserSchemas;
import com.healthtrack.validation.ValidatedInput;
import com.healthtrack.validation.ValidationMode;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Reachable only with the admin flag; see the security configuration.
 */
@RestController
@RequestMapping("/api/admin/users")
@RequiredArgsConstructor
@CrossOrigin(origins = "${app.cors.origin}")
public class AdminController {

    private final AdminService adminService;

    @GetMapping
    public UserList list() {
        List<UserView> users = adminService.listUsers();
        return new UserList(users, users.size());
    }

    @PutMapping("/{id}/active")
    public UserMessage setActive(@AuthenticationPrincipal AuthenticatedUser caller,
                                 @PathVariable Long id,
                                 @RequestBody Map<String, Object> body) {
        ValidatedInput input = UserSchemas.ACTIVATION.validate(body, ValidationMode.CREATE);
        boolean active = input.get(UserSchemas.IS_ACTIVE, Boolean.class);
        UserView user = adminService.setActive(caller.id(), id, active);
        return new UserMessage(active ? "User activated successfully" : "User deactivated successfully", user);
    }

    @DeleteMapping("/{id}")
    public MessageResponse delete(@AuthenticationPrincipal AuthenticatedUser caller, @PathVariable Long id) {
        adminService.deleteUser(caller.id(), id);
        return new MessageResponse("User deleted successfully");
    }

    public record UserList(List<UserView> users, int count) {}

    public record UserMessage(String message, UserView user) {}
}
