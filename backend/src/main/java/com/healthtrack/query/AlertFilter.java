package com.healthtrack.query;

import com.healthtrack.model.Alert;
import com.healthtrack.model.AlertPriority;
import com.healthtrack.model.AlertStatus;
import com.healthtrack.model.AlertType;
import com.healthtrack.validation.AlertSchemas;
import com.healthtrack.validation.ValidatedInput;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;

import java.util.ArrayList;
import java.util.List;

/**
 * Equality filters for the alert list. A null component is not filtered on.
 */
public record AlertFilter(AlertStatus status, AlertPriority priority, AlertType type) {

    /** Most severe first, then newest. */
    public static final Sort DEFAULT_ORDER = Sort.by(
            Sort.Order.desc("priorityRank"),
            Sort.Order.desc("createdAt"),
            Sort.Order.desc("id"));

    public static AlertFilter from(ValidatedInput input) {
        return new AlertFilter(
                input.get(AlertSchemas.STATUS, AlertStatus.class),
                input.get(AlertSchemas.PRIORITY, AlertPriority.class),
                input.get(AlertSchemas.TYPE, AlertType.class));
    }

    /**
     * Owner restriction AND every non-null filter.
     */
    public Specification<Alert> toSpecification(Long ownerId) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            predicates.add(cb.equal(root.get("user").get("id"), ownerId));
            if (status != null) {
                predicates.add(cb.equal(root.get("status"), status));
            }
            if (priority != null) {
                predicates.add(cb.equal(root.get("priority"), priority));
            }
            if (type != null) {
                predicates.add(cb.equal(root.get("type"), type));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
