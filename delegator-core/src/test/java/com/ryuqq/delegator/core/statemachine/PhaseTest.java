package com.ryuqq.delegator.core.statemachine;

import com.ryuqq.delegator.core.model.Role;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Phase Enum 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class PhaseTest {

    @Test
    void isTerminal_AwaitingPhases_ReturnsFalse() {
        assertFalse(Phase.AWAITING_STUDY.isTerminal());
        assertFalse(Phase.AWAITING_CODE.isTerminal());
        assertFalse(Phase.AWAITING_VERIFY.isTerminal());
    }

    @Test
    void isTerminal_TerminalPhases_ReturnsTrue() {
        assertTrue(Phase.DONE.isTerminal());
        assertTrue(Phase.EXHAUSTED.isTerminal());
        assertTrue(Phase.FAILED.isTerminal());
    }

    @Test
    void expectedRole_AwaitingPhases_ReturnsMatchingRole() {
        assertEquals(Role.STUDY, Phase.AWAITING_STUDY.expectedRole());
        assertEquals(Role.CODE, Phase.AWAITING_CODE.expectedRole());
        assertEquals(Role.VERIFY, Phase.AWAITING_VERIFY.expectedRole());
    }

    @Test
    void expectedRole_TerminalPhase_ThrowsException() {
        // When & Then
        assertThrows(IllegalStateException.class, Phase.DONE::expectedRole);
    }

    @Test
    void awaiting_EveryRole_RoundTripsThroughExpectedRole() {
        for (Role role : Role.values()) {
            assertEquals(role, Phase.awaiting(role).expectedRole());
        }
    }

    @Test
    void awaiting_NullRole_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Phase.awaiting(null));
    }
}
