package com.healthtrack.query;

import com.healthtrack.model.DiagnosticTest;
import com.healthtrack.model.TestStatus;
import com.healthtrack.model.TestType;
import com.healthtrack.validation.DiagnosticTestSchemas;
import com.healthtrack.validation.ValidatedInput;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Filters for the diagnostic test list. Null components are not filtered on;
 * {@code dateFrom} and {@code dateTo} are inclusive.
 */
public record DiagnosticTestFilter(
        TestType testType,
        TestStatus status,
        Boolean abnormal,
        LocalDate dateFrom,
        LocalDate dateTo
) {

    public static final Sort DEFAULT_ORDER = Sort.by(
            Sort.Order.desc("date"),
            Sort.Order.desc("createdAt"),
            Sort.Order.desc("id"));

    public static DiagnosticTestFilter from(ValidatedInput input) {
        return new DiagnosticTestFilter(
                input.get(DiagnosticTestSchemas.TEST_TYPE, TestType.class),
                input.get(DiagnosticTestSchemas.STATUS, TestStatus.class),
                input.get(DiagnosticTestSchemas.IS_ABNORMAL, Boolean.class),
                input.get(DiagnosticTestSchemas.DATE_FROM, LocalDate.class),
                input.get(DiagnosticTestSchemas.DATE_TO, LocalDate.class));
    }

    public Specification<DiagnosticTest> toSpecification(Long ownerId) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            predicates.add(cb.equal(root.get("user").get("id"), ownerId));
            if (testType != null) {
                predicates.add(cb.equal(root.get("testType"), testType));
            }
            if (status != null) {
                predicates.add(cb.equal(root.get("status"), status));
            }
            if (abnormal != null) {
                predicates.add(cb.equal(root.get("abnormal"), abnormal));
            }
            if (dateFrom != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.<LocalDate>get("date"), dateFrom));
            }
            if (dateTo != null) {
                predicates.add(cb.lessThanOrEqualTo(root.<LocalDate>get("date"), dateTo));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
