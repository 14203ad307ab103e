package com.ryuqq.delegator.core.event;

import com.ryuqq.delegator.core.error.ErrorKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * FinishAction Record 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class FinishActionTest {

    @Test
    void completed_HasNoErrorKind() {
        // When
        FinishAction finish = FinishAction.completed("LGTM");

        // Then
        assertTrue(finish.completed());
        assertNull(finish.errorKind());
        assertFalse(finish.isFatal());
        assertTrue(finish.isFinish());
    }

    @Test
    void incomplete_BudgetExhausted_IsNotFatal() {
        // When
        FinishAction finish = FinishAction.incomplete(ErrorKind.BUDGET_EXHAUSTED, "still failing");

        // Then
        assertFalse(finish.completed());
        assertEquals(ErrorKind.BUDGET_EXHAUSTED, finish.errorKind());
        assertFalse(finish.isFatal());
    }

    @Test
    void incomplete_InvalidPairing_IsFatal() {
        assertTrue(FinishAction.incomplete(ErrorKind.INVALID_PAIRING, "bad log").isFatal());
    }

    @Test
    void constructor_CompletedWithErrorKind_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> new FinishAction("done", true, ErrorKind.BUDGET_EXHAUSTED));
    }

    @Test
    void constructor_IncompleteWithoutErrorKind_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> new FinishAction("not done", false, null));
    }

    @Test
    void constructor_BlankSummary_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> FinishAction.completed(""));
    }
}
