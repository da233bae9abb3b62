package com.healthtrack.controller;

import com.healthtrack.ApiTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MvcResult;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.nullValue;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class DiagnosticTestControllerTest extends ApiTestSupport {

    private static final LocalDate TODAY = LocalDate.now(ZoneOffset.UTC);

    private String alice;
    private String bob;

    @BeforeEach
    void users() throws Exception {
        alice = register("Alice", "alice@example.com");
        bob = register("Bob", "bob@example.com");
    }

    private Map<String, Object> test(String name, LocalDate date) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", name);
        body.put("result", "within range");
        body.put("date", date.toString());
        return body;
    }

    private long createTest(String token, Map<String, Object> body) throws Exception {
        MvcResult result = mockMvc.perform(postAs(token, body, "/api/diagnostic-tests"))
                .andExpect(status().isCreated())
                .andReturn();
        return idOf(result, "$.test.id");
    }

    @Test
    void createAppliesDefaults() throws Exception {
        mockMvc.perform(postAs(alice, test("Lipid panel", TODAY), "/api/diagnostic-tests"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.message").value("Diagnostic test created successfully"))
                .andExpect(jsonPath("$.test.name").value("Lipid panel"))
                .andExpect(jsonPath("$.test.date").value(TODAY.toString()))
                .andExpect(jsonPath("$.test.testType").value("general"))
                .andExpect(jsonPath("$.test.status").value("completed"))
                .andExpect(jsonPath("$.test.isAbnormal").value(false))
                .andExpect(jsonPath("$.test.attachments", hasSize(0)))
                .andExpect(jsonPath("$.test.user.email").value("alice@example.com"));
    }

    @Test
    void createRequiresNameResultAndDate() throws Exception {
        mockMvc.perform(postAs(alice, Map.of("testType", "xray"), "/api/diagnostic-tests"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[*].field", contains("name", "result", "date", "testType")));
    }

    @Test
    void otherUsersTestsLookMissing() throws Exception {
        long id = createTest(alice, test("CBC", TODAY));

        mockMvc.perform(getAs(bob, "/api/diagnostic-tests/{id}", id))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Diagnostic test not found"));
        mockMvc.perform(putAs(bob, Map.of(), "/api/diagnostic-tests/{id}/review", id))
                .andExpect(status().isNotFound());
        mockMvc.perform(deleteAs(bob, "/api/diagnostic-tests/{id}", id))
                .andExpect(status().isNotFound());
    }

    @Test
    void listFiltersByTypeAbnormalAndInclusiveDateRange() throws Exception {
        Map<String, Object> early = test("early", LocalDate.of(2024, 1, 1));
        early.put("testType", "blood");
        Map<String, Object> middle = test("middle", LocalDate.of(2024, 2, 15));
        middle.put("testType", "blood");
        middle.put("isAbnormal", true);
        Map<String, Object> late = test("late", LocalDate.of(2024, 3, 31));
        late.put("testType", "imaging");
        createTest(alice, early);
        createTest(alice, middle);
        createTest(alice, late);
        createTest(bob, test("bob's", LocalDate.of(2024, 2, 1)));

        mockMvc.perform(getAs(alice, "/api/diagnostic-tests"))
                .andExpect(jsonPath("$.tests[*].name", contains("late", "middle", "early")))
                .andExpect(jsonPath("$.pagination.totalItems").value(3));

        mockMvc.perform(getAs(alice, "/api/diagnostic-tests?testType=blood"))
                .andExpect(jsonPath("$.tests[*].name", contains("middle", "early")));

        mockMvc.perform(getAs(alice, "/api/diagnostic-tests?isAbnormal=true"))
                .andExpect(jsonPath("$.tests[*].name", contains("middle")));

        mockMvc.perform(getAs(alice, "/api/diagnostic-tests?dateFrom=2024-01-01&dateTo=2024-02-15"))
                .andExpect(jsonPath("$.tests[*].name", contains("middle", "early")));

        mockMvc.perform(getAs(alice, "/api/diagnostic-tests?dateFrom=2024-02-16"))
                .andExpect(jsonPath("$.tests[*].name", contains("late")));

        mockMvc.perform(getAs(alice, "/api/diagnostic-tests?dateTo=not-a-date"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0].field").value("dateTo"));
    }

    @Test
    void pagesCoverEveryTestOnceInListOrder() throws Exception {
        LocalDate yesterday = TODAY.minusDays(1);
        LocalDate[] dates = {yesterday, TODAY, TODAY.minusDays(3), yesterday, TODAY};
        for (int i = 0; i < dates.length; i++) {
            createTest(alice, test("test " + i, dates[i]));
        }

        MvcResult unpaged = mockMvc.perform(getAs(alice, "/api/diagnostic-tests?limit=100"))
                .andExpect(jsonPath("$.tests[*].date", contains(
                        TODAY.toString(), TODAY.toString(),
                        yesterday.toString(), yesterday.toString(),
                        TODAY.minusDays(3).toString())))
                .andReturn();
        List<Long> expected = idsOf(unpaged, "$.tests[*].id");

        List<Long> paged = walkPages(alice, "/api/diagnostic-tests", "$.tests", 2, dates.length);

        assertThat(paged).containsExactlyElementsOf(expected).doesNotHaveDuplicates();
    }

    @Test
    void pageBeyondOffsetLimitIsEmpty() throws Exception {
        createTest(alice, test("CBC", TODAY));

        mockMvc.perform(getAs(alice, "/api/diagnostic-tests?page=30000000&limit=100"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tests", hasSize(0)))
                .andExpect(jsonPath("$.pagination.totalItems").value(1))
                .andExpect(jsonPath("$.pagination.hasNextPage").value(false));
    }

    @Test
    void recentUsesDayWindow() throws Exception {
        createTest(alice, test("today", TODAY));
        createTest(alice, test("last week", TODAY.minusDays(7)));
        createTest(alice, test("last year", TODAY.minusDays(365)));

        mockMvc.perform(getAs(alice, "/api/diagnostic-tests/recent"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tests[*].name", contains("today", "last week")))
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.period").value("30 days"));

        mockMvc.perform(getAs(alice, "/api/diagnostic-tests/recent?days=3"))
                .andExpect(jsonPath("$.tests[*].name", contains("today")))
                .andExpect(jsonPath("$.period").value("3 days"));

        mockMvc.perform(getAs(alice, "/api/diagnostic-tests/recent?days=0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0].field").value("days"));
    }

    @Test
    void abnormalListsFlaggedTests() throws Exception {
        Map<String, Object> flagged = test("flagged", TODAY);
        flagged.put("isAbnormal", true);
        createTest(alice, flagged);
        createTest(alice, test("normal", TODAY));

        mockMvc.perform(getAs(alice, "/api/diagnostic-tests/abnormal"))
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.tests[0].name").value("flagged"))
                .andExpect(jsonPath("$.tests[0].isAbnormal").value(true));
    }

    @Test
    void updateReplacesAttachmentsAndClearsOptionalFields() throws Exception {
        Map<String, Object> body = test("MRI", TODAY);
        body.put("notes", "left knee");
        body.put("attachments", List.of("scan-1.png", "scan-2.png"));
        long id = createTest(alice, body);

        Map<String, Object> patch = new HashMap<>();
        patch.put("notes", null);
        patch.put("attachments", List.of("scan-3.png"));
        patch.put("labName", "  City Lab ");

        mockMvc.perform(putAs(alice, patch, "/api/diagnostic-tests/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Diagnostic test updated successfully"))
                .andExpect(jsonPath("$.test.name").value("MRI"))
                .andExpect(jsonPath("$.test.notes").value(nullValue()))
                .andExpect(jsonPath("$.test.labName").value("City Lab"))
                .andExpect(jsonPath("$.test.attachments", contains("scan-3.png")));
    }

    @Test
    void reviewAndCancelMoveStatus() throws Exception {
        long id = createTest(alice, test("Urinalysis", TODAY));

        mockMvc.perform(putAs(alice, Map.of(), "/api/diagnostic-tests/{id}/review", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Diagnostic test marked as reviewed"))
                .andExpect(jsonPath("$.test.status").value("reviewed"));

        mockMvc.perform(putAs(alice, Map.of(), "/api/diagnostic-tests/{id}/cancel", id))
                .andExpect(jsonPath("$.test.status").value("cancelled"));
    }

    @Test
    void deleteRemovesTheTest() throws Exception {
        long id = createTest(alice, test("Temporary", TODAY));

        mockMvc.perform(deleteAs(alice, "/api/diagnostic-tests/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Diagnostic test deleted successfully"));
        mockMvc.perform(getAs(alice, "/api/diagnostic-tests/{id}", id))
                .andExpect(status().isNotFound());
    }

    @Test
    void summaryCountsAbnormalRecentAndGroups() throws Exception {
        Map<String, Object> blood = test("blood", TODAY);
        blood.put("testType", "blood");
        blood.put("isAbnormal", true);
        Map<String, Object> old = test("old", TODAY.minusDays(90));
        old.put("status", "pending");
        createTest(alice, blood);
        createTest(alice, old);
        createTest(alice, test("general", TODAY.minusDays(1)));

        mockMvc.perform(getAs(alice, "/api/diagnostic-tests/stats/summary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.summary.total").value(3))
                .andExpect(jsonPath("$.summary.abnormal").value(1))
                .andExpect(jsonPath("$.summary.recent").value(2))
                .andExpect(jsonPath("$.summary.byStatus.completed").value(2))
                .andExpect(jsonPath("$.summary.byStatus.pending").value(1))
                .andExpect(jsonPath("$.summary.byStatus.reviewed").doesNotExist())
                .andExpect(jsonPath("$.summary.byType.general").value(2))
                .andExpect(jsonPath("$.summary.byType.blood").value(1))
                .andExpect(jsonPath("$.summary.byType.imaging").doesNotExist());

        mockMvc.perform(getAs(bob, "/api/diagnostic-tests/stats/summary"))
                .andExpect(jsonPath("$.summary.total").value(0))
                .andExpect(jsonPath("$.summary.byStatus").isEmpty());
    }

    @Test
    void anyFilterCombinationStaysOwnerScoped() throws Exception {
        createTest(alice, test("alice-1", TODAY));
        createTest(bob, test("bob-1", TODAY));
        createTest(bob, test("bob-2", TODAY.minusDays(2)));

        mockMvc.perform(getAs(bob, "/api/diagnostic-tests?status=completed&dateTo=" + TODAY))
                .andExpect(jsonPath("$.tests[*].name", containsInAnyOrder("bob-1", "bob-2")));
    }
}
