package com.healthtrack.service;

import com.healthtrack.controller.dto.DiagnosticTestView;
import com.healthtrack.error.NotFoundException;
import com.healthtrack.model.DiagnosticTest;
import com.healthtrack.model.TestStatus;
import com.healthtrack.model.TestType;
import com.healthtrack.query.DiagnosticTestFilter;
import com.healthtrack.query.DiagnosticTestSummary;
import com.healthtrack.query.PageMeta;
import com.healthtrack.query.PageQuery;
import com.healthtrack.query.PagedResult;
import com.healthtrack.query.SparseCounts;
import com.healthtrack.repo.DiagnosticTestRepository;
import com.healthtrack.repo.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@Service
@Transactional
public class DiagnosticTestService {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticTestService.class);

    public static final String NOT_FOUND = "Diagnostic test not found";

    private final DiagnosticTestRepository testRepository;
    private final UserRepository userRepository;
    private final DiagnosticTestTransitions transitions;
    private final Clock clock;

    public DiagnosticTestService(DiagnosticTestRepository testRepository,
                                 UserRepository userRepository,
                                 DiagnosticTestTransitions transitions,
                                 Clock clock) {
        this.testRepository = testRepository;
        this.userRepository = userRepository;
        this.transitions = transitions;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public PagedResult<DiagnosticTestView> list(Long ownerId, PageQuery page, DiagnosticTestFilter filter) {
        Specification<DiagnosticTest> spec = filter.toSpecification(ownerId);
        if (page.isBeyondOffsetLimit()) {
            return new PagedResult<>(List.of(), PageMeta.of(page, testRepository.count(spec)));
        }
        Page<DiagnosticTest> rows = testRepository.findAll(spec, page.toPageable(DiagnosticTestFilter.DEFAULT_ORDER));
        List<DiagnosticTestView> items = rows.getContent().stream().map(DiagnosticTestView::from).toList();
        return new PagedResult<>(items, PageMeta.of(page, rows.getTotalElements()));
    }

    /**
     * Tests dated within the last {@code days} days, today included.
     */
    @Transactional(readOnly = true)
    public List<DiagnosticTestView> recent(Long ownerId, int days) {
        return testRepository.findOwnedSince(ownerId, today().minusDays(days), DiagnosticTestFilter.DEFAULT_ORDER)
                .stream()
                .map(DiagnosticTestView::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<DiagnosticTestView> abnormal(Long ownerId) {
        return testRepository.findOwnedAbnormal(ownerId, DiagnosticTestFilter.DEFAULT_ORDER)
                .stream()
                .map(DiagnosticTestView::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public DiagnosticTestView get(Long ownerId, Long id) {
        return DiagnosticTestView.from(requireOwned(ownerId, id));
    }

    public DiagnosticTestView create(Long ownerId, DiagnosticTestPatch fields) {
        DiagnosticTest test = new DiagnosticTest();
        test.setUser(userRepository.getReferenceById(ownerId));
        fields.applyTo(test, transitions);
        DiagnosticTest saved = testRepository.saveAndFlush(test);
        log.info("Created diagnostic test {} for user {}", saved.getId(), ownerId);
        return DiagnosticTestView.from(saved);
    }

    public DiagnosticTestView update(Long ownerId, Long id, DiagnosticTestPatch patch) {
        DiagnosticTest test = requireOwned(ownerId, id);
        patch.applyTo(test, transitions);
        return DiagnosticTestView.from(testRepository.saveAndFlush(test));
    }

    public DiagnosticTestView markAsReviewed(Long ownerId, Long id) {
        DiagnosticTest test = requireOwned(ownerId, id);
        transitions.markAsReviewed(test);
        return DiagnosticTestView.from(testRepository.saveAndFlush(test));
    }

    public DiagnosticTestView cancel(Long ownerId, Long id) {
        DiagnosticTest test = requireOwned(ownerId, id);
        transitions.cancel(test);
        return DiagnosticTestView.from(testRepository.saveAndFlush(test));
    }

    public void delete(Long ownerId, Long id) {
        DiagnosticTest test = requireOwned(ownerId, id);
        testRepository.delete(test);
        log.info("Deleted diagnostic test {} for user {}", id, ownerId);
    }

    @Transactional(readOnly = true)
    public DiagnosticTestSummary summary(Long ownerId) {
        Map<String, Long> byStatus = SparseCounts.of(TestStatus.class, testRepository.countByStatus(ownerId));
        Map<String, Long> byType = SparseCounts.of(TestType.class, testRepository.countByTestType(ownerId));
        LocalDate since = today().minusDays(DiagnosticTestSummary.RECENT_DAYS);
        return new DiagnosticTestSummary(
                SparseCounts.total(byStatus),
                testRepository.countOwnedAbnormal(ownerId),
                testRepository.countOwnedSince(ownerId, since),
                byStatus,
                byType);
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }

    private DiagnosticTest requireOwned(Long ownerId, Long id) {
        return testRepository.findOwned(id, ownerId)
                .orElseThrow(() -> new NotFoundException(NOT_FOUND));
    }
}
