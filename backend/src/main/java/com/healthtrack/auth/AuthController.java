package com.healthtrack.auth;

import com.healthtrack.controller.MessageResponse;
import com.healthtrack.controller.dto.UserView;
import com.healthtrack.security.AuthenticatedUser;
import com.healthtrack.validation.UserSchemas;
import com.healthtrack.validation.ValidationMode;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/auth")
@CrossOrigin(origins = "${app.cors.origin}") // frontend origin
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    // =========================================================
    // 1) REGISTER – returns a token straight away
    // =========================================================
    @PostMapping("/register")
    public ResponseEntity<SessionResponse> register(@RequestBody Map<String, Object> body) {
        AuthService.Session session = authService.register(UserSchemas.REGISTER.validate(body, ValidationMode.CREATE));
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new SessionResponse("User registered successfully", session.token(), session.user()));
    }

    // =========================================================
    // 2) LOGIN – email + password
    // =========================================================
    @PostMapping("/login")
    public SessionResponse login(@RequestBody Map<String, Object> body) {
        AuthService.Session session = authService.login(UserSchemas.LOGIN.validate(body, ValidationMode.CREATE));
        return new SessionResponse("Login successful", session.token(), session.user());
    }

    // =========================================================
    // 3) CURRENT USER / TOKEN
    // =========================================================
    @GetMapping("/me")
    public UserResponse me(@AuthenticationPrincipal AuthenticatedUser caller) {
        return new UserResponse(authService.me(caller.id()));
    }

    @PostMapping("/refresh")
    public TokenResponse refresh(@AuthenticationPrincipal AuthenticatedUser caller) {
        return new TokenResponse(authService.refresh(caller.id()));
    }

    // tokens are stateless; the client just forgets its copy
    @PostMapping("/logout")
    public MessageResponse logout() {
        return new MessageResponse("Logout successful");
    }

    // =========================================================
    // DTOs as inner records
    // =========================================================
    public record SessionResponse(String message, String token, UserView user) {}

    public record UserResponse(UserView user) {}

    public record TokenResponse(String token) {}
}
