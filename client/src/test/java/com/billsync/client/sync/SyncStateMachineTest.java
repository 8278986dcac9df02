package com.billsync.client.sync;

import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SyncStateMachineTest {

    private final SyncStateMachine machine = new SyncStateMachine();

    @Test
    void changesShouldReplayCurrentThenFollow() {
        machine.start(SyncRole.SENDER);

        StepVerifier.create(machine.changes().map(SyncProgress::state).take(3))
                .expectNext(SyncState.CONNECTING)
                .then(() -> machine.sessionCreated("482913"))
                .expectNext(SyncState.WAITING)
                .then(() -> machine.fail("boom"))
                .expectNext(SyncState.ERROR)
                .verifyComplete();
    }

    @Test
    void sessionCreatedShouldRecordCodeAndRole() {
        machine.start(SyncRole.SENDER);
        machine.sessionCreated("482913");

        assertEquals(new SyncProgress(SyncState.WAITING, SyncRole.SENDER, "482913", null), machine.current());
    }

    @Test
    void failureKeepsRoleAndCarriesMessage() {
        machine.start(SyncRole.RECEIVER);
        machine.fail("The other device disconnected.");

        assertEquals(SyncState.ERROR, machine.current().state());
        assertEquals(SyncRole.RECEIVER, machine.current().role());
        assertEquals("The other device disconnected.", machine.current().message());
    }

    @Test
    void disallowedEventShouldLeaveStateUntouched() {
        assertFalse(machine.tryTransition(SyncEvent.PEER_COMPLETED));
        assertThrows(IllegalStateException.class, () -> machine.transition(SyncEvent.DECRYPTED));
        assertEquals(SyncProgress.idle(), machine.current());
    }

    @Test
    void secondStartShouldBeRefused() {
        assertTrue(machine.start(SyncRole.SENDER));
        assertFalse(machine.start(SyncRole.RECEIVER));
        assertEquals(SyncRole.SENDER, machine.current().role());
    }

    @Test
    void cancelShouldClearEverythingButTheNotice() {
        machine.start(SyncRole.SENDER);
        machine.sessionCreated("482913");

        machine.cancel("The other device declined the import.");

        assertEquals(SyncState.IDLE, machine.current().state());
        assertNull(machine.current().code());
        assertNull(machine.current().role());
        assertEquals("The other device declined the import.", machine.current().message());
    }

    @Test
    void resetShouldOnlyLeaveTerminalStates() {
        machine.start(SyncRole.SENDER);
        assertFalse(machine.tryTransition(SyncEvent.RESET));

        machine.fail("x");
        assertTrue(machine.tryTransition(SyncEvent.RESET));
        assertEquals(SyncProgress.idle(), machine.current());
    }
}
