package com.healthtrack.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.healthtrack.model.DiagnosticTest;
import com.healthtrack.model.TestStatus;
import com.healthtrack.model.TestType;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

public record DiagnosticTestView(
        Long id,
        String name,
        String result,
        LocalDate date,
        TestType testType,
        TestStatus status,
        String normalRange,
        String units,
        String notes,
        String doctorName,
        String labName,
        @JsonProperty("isAbnormal") boolean isAbnormal,
        List<Object> attachments,
        Long userId,
        Instant createdAt,
        Instant updatedAt,
        UserSummary user
) {

    public static DiagnosticTestView from(DiagnosticTest test) {
        return new DiagnosticTestView(
                test.getId(),
                test.getName(),
                test.getResult(),
                test.getDate(),
                test.getTestType(),
                test.getStatus(),
                test.getNormalRange(),
                test.getUnits(),
                test.getNotes(),
                test.getDoctorName(),
                test.getLabName(),
                test.isAbnormal(),
                test.getAttachments() == null ? new ArrayList<>() : test.getAttachments(),
                test.getUser().getId(),
                test.getCreatedAt(),
                test.getUpdatedAt(),
                UserSummary.from(test.getUser()));
    }
}
