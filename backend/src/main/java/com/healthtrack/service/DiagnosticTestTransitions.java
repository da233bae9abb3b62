package com.healthtrack.service;

import com.healthtrack.model.DiagnosticTest;
import com.healthtrack.model.TestStatus;
import org.springframework.stereotype.Component;

/**
 * Status changes on diagnostic tests. None of them carries a timestamp.
 */
@Component
public class DiagnosticTestTransitions {

    public void markAsReviewed(DiagnosticTest test) {
        moveTo(test, TestStatus.REVIEWED);
    }

    public void cancel(DiagnosticTest test) {
        moveTo(test, TestStatus.CANCELLED);
    }

    public void moveTo(DiagnosticTest test, TestStatus target) {
        test.setStatus(target);
    }
}
