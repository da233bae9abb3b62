package com.healthtrack.controller;

import com.healthtrack.controller.dto.DiagnosticTestView;
import com.healthtrack.query.DiagnosticTestFilter;
import com.healthtrack.query.DiagnosticTestSummary;
import com.healthtrack.query.PageMeta;
import com.healthtrack.query.PageQuery;
import com.healthtrack.query.PagedResult;
import com.healthtrack.security.AuthenticatedUser;
import com.healthtrack.service.DiagnosticTestPatch;
import com.healthtrack.service.DiagnosticTestService;
import com.healthtrack.validation.DiagnosticTestSchemas;
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
@RequestMapping("/api/diagnostic-tests")
@RequiredArgsConstructor
@CrossOrigin(origins = "${app.cors.origin}")
public class DiagnosticTestController {

    private final DiagnosticTestService testService;

    @GetMapping
    public TestPage list(@AuthenticationPrincipal AuthenticatedUser caller,
                         @RequestParam Map<String, String> params) {
        ValidatedInput query = DiagnosticTestSchemas.LIST.validate(params, ValidationMode.QUERY);
        PagedResult<DiagnosticTestView> page =
                testService.list(caller.id(), PageQuery.from(query), DiagnosticTestFilter.from(query));
        return new TestPage(page.items(), page.pagination());
    }

    @GetMapping("/recent")
    public RecentTests recent(@AuthenticationPrincipal AuthenticatedUser caller,
                              @RequestParam Map<String, String> params) {
        ValidatedInput query = DiagnosticTestSchemas.RECENT.validate(params, ValidationMode.QUERY);
        int days = query.getOrDefault(DiagnosticTestSchemas.DAYS, Integer.class, DiagnosticTestSchemas.DEFAULT_RECENT_DAYS);
        List<DiagnosticTestView> tests = testService.recent(caller.id(), days);
        return new RecentTests(tests, tests.size(), days + " days");
    }

    @GetMapping("/abnormal")
    public TestList abnormal(@AuthenticationPrincipal AuthenticatedUser caller) {
        List<DiagnosticTestView> tests = testService.abnormal(caller.id());
        return new TestList(tests, tests.size());
    }

    @GetMapping("/stats/summary")
    public SummaryResponse summary(@AuthenticationPrincipal AuthenticatedUser caller) {
        return new SummaryResponse(testService.summary(caller.id()));
    }

    @GetMapping("/{id}")
    public TestResponse get(@AuthenticationPrincipal AuthenticatedUser caller, @PathVariable Long id) {
        return new TestResponse(testService.get(caller.id(), id));
    }

    @PostMapping
    public ResponseEntity<TestMessage> create(@AuthenticationPrincipal AuthenticatedUser caller,
                                              @RequestBody Map<String, Object> body) {
        ValidatedInput input = DiagnosticTestSchemas.CREATE.validate(body, ValidationMode.CREATE);
        DiagnosticTestView created = testService.create(caller.id(), DiagnosticTestPatch.of(input));
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new TestMessage("Diagnostic test created successfully", created));
    }

    @PutMapping("/{id}")
    public TestMessage update(@AuthenticationPrincipal AuthenticatedUser caller,
                              @PathVariable Long id,
                              @RequestBody Map<String, Object> body) {
        ValidatedInput input = DiagnosticTestSchemas.UPDATE.validate(body, ValidationMode.PATCH);
        return new TestMessage("Diagnostic test updated successfully",
                testService.update(caller.id(), id, DiagnosticTestPatch.of(input)));
    }

    @PutMapping("/{id}/review")
    public TestMessage review(@AuthenticationPrincipal AuthenticatedUser caller, @PathVariable Long id) {
        return new TestMessage("Diagnostic test marked as reviewed", testService.markAsReviewed(caller.id(), id));
    }

    @PutMapping("/{id}/cancel")
    public TestMessage cancel(@AuthenticationPrincipal AuthenticatedUser caller, @PathVariable Long id) {
        return new TestMessage("Diagnostic test cancelled", testService.cancel(caller.id(), id));
    }

    @DeleteMapping("/{id}")
    public MessageResponse delete(@AuthenticationPrincipal AuthenticatedUser caller, @PathVariable Long id) {
        testService.delete(caller.id(), id);
        return new MessageResponse("Diagnostic test deleted successfully");
    }

    public record TestPage(List<DiagnosticTestView> tests, PageMeta pagination) {}

    public record TestList(List<DiagnosticTestView> tests, int count) {}

    public record RecentTests(List<DiagnosticTestView> tests, int count, String period) {}

    public record TestResponse(DiagnosticTestView test) {}

    public record TestMessage(String message, DiagnosticTestView test) {}

    public record SummaryResponse(DiagnosticTestSummary summary) {}
}
