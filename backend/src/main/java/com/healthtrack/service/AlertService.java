package com.healthtrack.service;

import com.healthtrack.controller.dto.AlertView;
import com.healthtrack.error.NotFoundException;
import com.healthtrack.model.Alert;
import com.healthtrack.model.AlertPriority;
import com.healthtrack.model.AlertStatus;
import com.healthtrack.query.AlertFilter;
import com.healthtrack.query.AlertSummary;
import com.healthtrack.query.PageMeta;
import com.healthtrack.query.PageQuery;
import com.healthtrack.query.PagedResult;
import com.healthtrack.query.SparseCounts;
import com.healthtrack.repo.AlertRepository;
import com.healthtrack.repo.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;

/**
 * Alert operations on behalf of one owner. Every lookup is by id AND owner,
 * so another user's alert behaves exactly like a missing one.
 */
@Service
@Transactional
public class AlertService {

    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    public static final String NOT_FOUND = "Alert not found";

    private final AlertRepository alertRepository;
    private final UserRepository userRepository;
    private final AlertTransitions transitions;

    public AlertService(AlertRepository alertRepository,
                        UserRepository userRepository,
                        AlertTransitions transitions) {
        this.alertRepository = alertRepository;
        this.userRepository = userRepository;
        this.transitions = transitions;
    }

    @Transactional(readOnly = true)
    public PagedResult<AlertView> list(Long ownerId, PageQuery page, AlertFilter filter) {
        Specification<Alert> spec = filter.toSpecification(ownerId);
        if (page.isBeyondOffsetLimit()) {
            return new PagedResult<>(List.of(), PageMeta.of(page, alertRepository.count(spec)));
        }
        Page<Alert> rows = alertRepository.findAll(spec, page.toPageable(AlertFilter.DEFAULT_ORDER));
        List<AlertView> items = rows.getContent().stream().map(AlertView::from).toList();
        return new PagedResult<>(items, PageMeta.of(page, rows.getTotalElements()));
    }

    @Transactional(readOnly = true)
    public List<AlertView> active(Long ownerId) {
        return alertRepository.findByOwnerAndStatus(ownerId, AlertStatus.ACTIVE, AlertFilter.DEFAULT_ORDER)
                .stream()
                .map(AlertView::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public AlertView get(Long ownerId, Long id) {
        return AlertView.from(requireOwned(ownerId, id));
    }

    /**
     * The owner always comes from the authenticated caller, never from the body.
     */
    public AlertView create(Long ownerId, AlertPatch fields) {
        Alert alert = new Alert();
        alert.setUser(userRepository.getReferenceById(ownerId));
        fields.applyTo(alert, transitions);
        Alert saved = alertRepository.saveAndFlush(alert);
        log.info("Created alert {} for user {}", saved.getId(), ownerId);
        return AlertView.from(saved);
    }

    public AlertView update(Long ownerId, Long id, AlertPatch patch) {
        Alert alert = requireOwned(ownerId, id);
        patch.applyTo(alert, transitions);
        return AlertView.from(alertRepository.saveAndFlush(alert));
    }

    public AlertView acknowledge(Long ownerId, Long id) {
        Alert alert = requireOwned(ownerId, id);
        transitions.acknowledge(alert);
        return AlertView.from(alertRepository.saveAndFlush(alert));
    }

    public AlertView resolve(Long ownerId, Long id) {
        Alert alert = requireOwned(ownerId, id);
        transitions.resolve(alert);
        return AlertView.from(alertRepository.saveAndFlush(alert));
    }

    public void delete(Long ownerId, Long id) {
        Alert alert = requireOwned(ownerId, id);
        alertRepository.delete(alert);
        log.info("Deleted alert {} for user {}", id, ownerId);
    }

    @Transactional(readOnly = true)
    public AlertSummary summary(Long ownerId) {
        Map<String, Long> byStatus = SparseCounts.of(AlertStatus.class, alertRepository.countByStatus(ownerId));
        Map<String, Long> byPriority = SparseCounts.of(AlertPriority.class, alertRepository.countByPriority(ownerId));
        // status is never null, so the status groups partition every alert
        return new AlertSummary(SparseCounts.total(byStatus), byStatus, byPriority);
    }

    private Alert requireOwned(Long ownerId, Long id) {
        return alertRepository.findOwned(id, ownerId)
                .orElseThrow(() -> new NotFoundException(NOT_FOUND));
    }
}
