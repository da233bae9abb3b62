package com.healthtrack.controller;

import com.healthtrack.ApiTestSupport;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MvcResult;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class AlertControllerTest extends ApiTestSupport {

    private String alice;
    private String bob;

    @BeforeEach
    void users() throws Exception {
        alice = register("Alice", "alice@example.com");
        bob = register("Bob", "bob@example.com");
    }

    private long createAlert(String token, Map<String, Object> body) throws Exception {
        MvcResult result = mockMvc.perform(postAs(token, body, "/api/alerts"))
                .andExpect(status().isCreated())
                .andReturn();
        return idOf(result, "$.alert.id");
    }

    @Test
    void createAppliesDefaultsAndTakesOwnerFromToken() throws Exception {
        mockMvc.perform(postAs(alice, Map.of("title", "  Blood pressure high ", "userId", 12345), "/api/alerts"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.message").value("Alert created successfully"))
                .andExpect(jsonPath("$.alert.title").value("Blood pressure high"))
                .andExpect(jsonPath("$.alert.status").value("active"))
                .andExpect(jsonPath("$.alert.priority").value("medium"))
                .andExpect(jsonPath("$.alert.type").value("general"))
                .andExpect(jsonPath("$.alert.metadata").isMap())
                .andExpect(jsonPath("$.alert.acknowledgedAt").value(nullValue()))
                .andExpect(jsonPath("$.alert.createdAt").value(notNullValue()))
                .andExpect(jsonPath("$.alert.user.name").value("Alice"))
                .andExpect(jsonPath("$.alert.user.email").value("alice@example.com"))
                .andExpect(jsonPath("$.alert.priorityRank").doesNotExist());
    }

    @Test
    void createRejectsInvalidFieldsBeforeWriting() throws Exception {
        mockMvc.perform(postAs(alice, Map.of("title", "", "priority", "urgent"), "/api/alerts"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Validation failed"))
                .andExpect(jsonPath("$.errors[*].field", contains("title", "priority")))
                .andExpect(jsonPath("$.errors[1].value").value("urgent"));

        assertThat(alertRepository.count()).isZero();
    }

    @Test
    void unreadableBodyIsAValidationError() throws Exception {
        mockMvc.perform(post("/api/alerts")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + alice)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0].field").value("body"));
    }

    @Test
    void requestsWithoutValidTokenAreRejected() throws Exception {
        mockMvc.perform(get("/api/alerts"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Access denied. No token provided."));

        mockMvc.perform(get("/api/alerts").header(HttpHeaders.AUTHORIZATION, "Bearer garbage"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Access denied. Invalid token."));
    }

    @Test
    void otherUsersAlertsLookMissing() throws Exception {
        long id = createAlert(alice, Map.of("title", "Private"));

        mockMvc.perform(getAs(bob, "/api/alerts/{id}", id))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Alert not found"));
        mockMvc.perform(getAs(bob, "/api/alerts/{id}", id + 1000))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Alert not found"));
        mockMvc.perform(putAs(bob, Map.of("title", "Hijacked"), "/api/alerts/{id}", id))
                .andExpect(status().isNotFound());
        mockMvc.perform(putAs(bob, Map.of(), "/api/alerts/{id}/acknowledge", id))
                .andExpect(status().isNotFound());
        mockMvc.perform(deleteAs(bob, "/api/alerts/{id}", id))
                .andExpect(status().isNotFound());

        mockMvc.perform(getAs(alice, "/api/alerts/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.alert.title").value("Private"));
        mockMvc.perform(getAs(bob, "/api/alerts"))
                .andExpect(jsonPath("$.alerts", hasSize(0)))
                .andExpect(jsonPath("$.pagination.totalItems").value(0));
    }

    @Test
    void nonNumericIdIsNotFound() throws Exception {
        mockMvc.perform(getAs(alice, "/api/alerts/abc"))
                .andExpect(status().isNotFound());
    }

    @Test
    void listFiltersPaginatesAndOrdersBySeverity() throws Exception {
        createAlert(alice, Map.of("title", "low", "priority", "low"));
        createAlert(alice, Map.of("title", "critical", "priority", "critical", "type", "health"));
        createAlert(alice, Map.of("title", "high", "priority", "high", "type", "health"));
        createAlert(bob, Map.of("title", "bob's", "priority", "critical"));

        mockMvc.perform(getAs(alice, "/api/alerts"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.alerts[*].title", contains("critical", "high", "low")))
                .andExpect(jsonPath("$.pagination.currentPage").value(1))
                .andExpect(jsonPath("$.pagination.totalPages").value(1))
                .andExpect(jsonPath("$.pagination.itemsPerPage").value(10));

        mockMvc.perform(getAs(alice, "/api/alerts?type=health&limit=1&page=2"))
                .andExpect(jsonPath("$.alerts[*].title", contains("high")))
                .andExpect(jsonPath("$.pagination.totalItems").value(2))
                .andExpect(jsonPath("$.pagination.totalPages").value(2))
                .andExpect(jsonPath("$.pagination.hasNextPage").value(false))
                .andExpect(jsonPath("$.pagination.hasPrevPage").value(true));

        mockMvc.perform(getAs(alice, "/api/alerts?priority=low&status=&ignored=1"))
                .andExpect(jsonPath("$.alerts[*].title", contains("low")));
    }

    @Test
    void pagesCoverEveryAlertOnceInListOrder() throws Exception {
        String[] priorities = {"high", "low", "high", "high", "low", "critical", "high"};
        for (int i = 0; i < priorities.length; i++) {
            createAlert(alice, Map.of("title", "alert " + i, "priority", priorities[i]));
        }

        MvcResult unpaged = mockMvc.perform(getAs(alice, "/api/alerts?limit=100"))
                .andExpect(jsonPath("$.alerts[*].priority",
                        contains("critical", "high", "high", "high", "high", "low", "low")))
                .andReturn();
        List<Long> expected = idsOf(unpaged, "$.alerts[*].id");

        List<Long> paged = walkPages(alice, "/api/alerts", "$.alerts", 3, priorities.length);

        assertThat(paged).containsExactlyElementsOf(expected).doesNotHaveDuplicates();
    }

    @Test
    void pageBeyondOffsetLimitIsEmpty() throws Exception {
        createAlert(alice, Map.of("title", "only one"));

        mockMvc.perform(getAs(alice, "/api/alerts?page=30000000&limit=100"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.alerts", hasSize(0)))
                .andExpect(jsonPath("$.pagination.currentPage").value(30000000))
                .andExpect(jsonPath("$.pagination.totalItems").value(1))
                .andExpect(jsonPath("$.pagination.totalPages").value(1))
                .andExpect(jsonPath("$.pagination.hasNextPage").value(false))
                .andExpect(jsonPath("$.pagination.hasPrevPage").value(true));
    }

    @Test
    void invalidListQueryIsRejected() throws Exception {
        mockMvc.perform(getAs(alice, "/api/alerts?limit=500"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0].field").value("limit"));
        mockMvc.perform(getAs(alice, "/api/alerts?status=open"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0].field").value("status"));
    }

    @Test
    void updateTouchesOnlyPresentFieldsAndMergesMetadata() throws Exception {
        long id = createAlert(alice, Map.of(
                "title", "Check glucose",
                "message", "Before breakfast",
                "metadata", Map.of("source", "lab", "level", 1)));

        Map<String, Object> patch = new HashMap<>();
        patch.put("metadata", Map.of("level", 2, "seen", true));
        patch.put("message", null);

        mockMvc.perform(putAs(alice, patch, "/api/alerts/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Alert updated successfully"))
                .andExpect(jsonPath("$.alert.title").value("Check glucose"))
                .andExpect(jsonPath("$.alert.message").value(nullValue()))
                .andExpect(jsonPath("$.alert.metadata.source").value("lab"))
                .andExpect(jsonPath("$.alert.metadata.level").value(2))
                .andExpect(jsonPath("$.alert.metadata.seen").value(true));
    }

    @Test
    void acknowledgeIsIdempotentAcrossBothPaths() throws Exception {
        long id = createAlert(alice, Map.of("title", "Ack me"));

        MvcResult first = mockMvc.perform(putAs(alice, Map.of(), "/api/alerts/{id}/acknowledge", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Alert acknowledged successfully"))
                .andExpect(jsonPath("$.alert.status").value("acknowledged"))
                .andExpect(jsonPath("$.alert.acknowledgedAt").value(notNullValue()))
                .andReturn();
        String acknowledgedAt = JsonPath.read(first.getResponse().getContentAsString(), "$.alert.acknowledgedAt");

        mockMvc.perform(putAs(alice, Map.of("status", "acknowledged"), "/api/alerts/{id}", id))
                .andExpect(jsonPath("$.alert.acknowledgedAt").value(acknowledgedAt));
        mockMvc.perform(putAs(alice, Map.of(), "/api/alerts/{id}/acknowledge", id))
                .andExpect(jsonPath("$.alert.acknowledgedAt").value(acknowledgedAt));

        mockMvc.perform(putAs(alice, Map.of(), "/api/alerts/{id}/resolve", id))
                .andExpect(jsonPath("$.alert.status").value("resolved"))
                .andExpect(jsonPath("$.alert.resolvedAt").value(notNullValue()))
                .andExpect(jsonPath("$.alert.acknowledgedAt").value(acknowledgedAt));
    }

    @Test
    void statusUpdateToResolvedStampsResolvedAt() throws Exception {
        long id = createAlert(alice, Map.of("title", "Resolve via update"));

        mockMvc.perform(putAs(alice, Map.of("status", "resolved"), "/api/alerts/{id}", id))
                .andExpect(jsonPath("$.alert.status").value("resolved"))
                .andExpect(jsonPath("$.alert.resolvedAt").value(notNullValue()))
                .andExpect(jsonPath("$.alert.acknowledgedAt").value(nullValue()));

        mockMvc.perform(putAs(alice, Map.of("status", "dismissed"), "/api/alerts/{id}", id))
                .andExpect(jsonPath("$.alert.status").value("dismissed"))
                .andExpect(jsonPath("$.alert.resolvedAt").value(notNullValue()));
    }

    @Test
    void activeListsOnlyActiveAlerts() throws Exception {
        long acknowledged = createAlert(alice, Map.of("title", "done"));
        createAlert(alice, Map.of("title", "open"));
        mockMvc.perform(putAs(alice, Map.of(), "/api/alerts/{id}/acknowledge", acknowledged));

        mockMvc.perform(getAs(alice, "/api/alerts/active"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.alerts[0].title").value("open"));
    }

    @Test
    void deleteRemovesTheAlert() throws Exception {
        long id = createAlert(alice, Map.of("title", "Temporary"));

        mockMvc.perform(deleteAs(alice, "/api/alerts/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Alert deleted successfully"));
        mockMvc.perform(getAs(alice, "/api/alerts/{id}", id))
                .andExpect(status().isNotFound());
    }

    @Test
    void summaryOmitsEmptyGroups() throws Exception {
        createAlert(alice, Map.of("title", "a", "priority", "high"));
        createAlert(alice, Map.of("title", "b", "priority", "high"));
        long resolved = createAlert(alice, Map.of("title", "c"));
        mockMvc.perform(putAs(alice, Map.of(), "/api/alerts/{id}/resolve", resolved));
        createAlert(bob, Map.of("title", "not counted", "priority", "critical"));

        mockMvc.perform(getAs(alice, "/api/alerts/stats/summary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.summary.total").value(3))
                .andExpect(jsonPath("$.summary.byStatus.active").value(2))
                .andExpect(jsonPath("$.summary.byStatus.resolved").value(1))
                .andExpect(jsonPath("$.summary.byStatus.dismissed").doesNotExist())
                .andExpect(jsonPath("$.summary.byPriority.high").value(2))
                .andExpect(jsonPath("$.summary.byPriority.medium").value(1))
                .andExpect(jsonPath("$.summary.byPriority.critical").doesNotExist());
    }
}
