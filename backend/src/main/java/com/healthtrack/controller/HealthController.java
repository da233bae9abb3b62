package com.healthtrack.controller;

import com.healthtrack.controller.dto.UserSummary;
import com.healthtrack.security.AuthenticatedUser;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;

/**
 * Liveness probe. A valid token is recognized but never required.
 */
@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
@CrossOrigin(origins = "${app.cors.origin}")
public class HealthController {

    private final Clock clock;

    @GetMapping
    public HealthResponse health(@AuthenticationPrincipal AuthenticatedUser caller) {
        UserSummary user = caller == null ? null : new UserSummary(caller.id(), caller.name(), caller.email());
        return new HealthResponse("ok", clock.instant(), user);
    }

    public record HealthResponse(String status, Instant time, UserSummary user) {}
}
