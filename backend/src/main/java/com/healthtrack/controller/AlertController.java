package com.healthtrack.controller;

import com.healthtrack.controller.dto.AlertView;
import com.healthtrack.query.AlertFilter;
import com.healthtrack.query.AlertSummary;
import com.healthtrack.query.PageMeta;
import com.healthtrack.query.PageQuery;
import com.healthtrack.query.PagedResult;
import com.healthtrack.security.AuthenticatedUser;
import com.healthtrack.service.AlertPatch;
import com.healthtrack.service.AlertService;
import com.healthtrack.validation.AlertSchemas;
import com.healthtrack.validation.ValidatedInput;
import com.healthtrack.validation.ValidationMode;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/alerts")
@RequiredArgsConstructor
@CrossOrigin(origins = "${app.cors.origin}")
public class AlertController {

    private final AlertService alertService;

    @GetMapping
    public AlertPage list(@AuthenticationPrincipal AuthenticatedUser caller,
                          @RequestParam Map<String, String> params) {
        ValidatedInput query = AlertSchemas.LIST.validate(params, ValidationMode.QUERY);
        PagedResult<AlertView> page = alertService.list(caller.id(), PageQuery.from(query), AlertFilter.from(query));
        return new AlertPage(page.items(), page.pagination());
    }

    @GetMapping("/active")
    public AlertList active(@AuthenticationPrincipal AuthenticatedUser caller) {
        List<AlertView> alerts = alertService.active(caller.id());
        return new AlertList(alerts, alerts.size());
    }

    @GetMapping("/stats/summary")
    public SummaryResponse summary(@AuthenticationPrincipal AuthenticatedUser caller) {
        return new SummaryResponse(alertService.summary(caller.id()));
    }

    @GetMapping("/{id}")
    public AlertResponse get(@AuthenticationPrincipal AuthenticatedUser caller, @PathVariable Long id) {
        return new AlertResponse(alertService.get(caller.id(), id));
    }

    @PostMapping
    public ResponseEntity<AlertMessage> create(@AuthenticationPrincipal AuthenticatedUser caller,
                                               @RequestBody Map<String, Object> body) {
        ValidatedInput input = AlertSchemas.CREATE.validate(body, ValidationMode.CREATE);
        AlertView created = alertService.create(caller.id(), AlertPatch.of(input));
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new AlertMessage("Alert created successfully", created));
    }

    @PutMapping("/{id}")
    public AlertMessage update(@AuthenticationPrincipal AuthenticatedUser caller,
                               @PathVariable Long id,
                               @RequestBody Map<String, Object> body) {
        ValidatedInput input = AlertSchemas.UPDATE.validate(body, ValidationMode.PATCH);
        return new AlertMessage("Alert updated successfully", alertService.update(caller.id(), id, AlertPatch.of(input)));
    }

    @PutMapping("/{id}/acknowledge")
    public AlertMessage acknowledge(@AuthenticationPrincipal AuthenticatedUser caller, @PathVariable Long id) {
        return new AlertMessage("Alert acknowledged successfully", alertService.acknowledge(caller.id(), id));
    }

    @PutMapping("/{id}/resolve")
    public AlertMessage resolve(@AuthenticationPrincipal AuthenticatedUser caller, @PathVariable Long id) {
        return new AlertMessage("Alert resolved successfully", alertService.resolve(caller.id(), id));
    }

    @DeleteMapping("/{id}")
    public MessageResponse delete(@AuthenticationPrincipal AuthenticatedUser caller, @PathVariable Long id) {
        alertService.delete(caller.id(), id);
        return new MessageResponse("Alert deleted successfully");
    }

    // =========================================================
    // Response bodies
    // =========================================================
    public record AlertPage(List<AlertView> alerts, PageMeta pagination) {}

    public record AlertList(List<AlertView> alerts, int count) {}

    public record AlertResponse(AlertView alert) {}

    public record AlertMessage(String message, AlertView alert) {}

    public record SummaryResponse(AlertSummary summary) {}
}
