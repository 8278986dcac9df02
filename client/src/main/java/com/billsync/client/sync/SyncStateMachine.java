package com.billsync.client.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.Optional;

/**
 * Holds the single {@link SyncProgress} value and applies {@link SyncTransitionTable}.
 * Every change is published to {@link #changes()}, which replays the latest value to late subscribers.
 * Subscribers are called while the machine's lock is held and must not block.
 */
public class SyncStateMachine {

    private static final Logger log = LoggerFactory.getLogger(SyncStateMachine.class);

    private final Sinks.Many<SyncProgress> changes = Sinks.many().replay().latest();
    private SyncProgress current = SyncProgress.idle();

    public SyncStateMachine() {
        changes.tryEmitNext(current);
    }

    public synchronized SyncProgress current() {
        return current;
    }

    public Flux<SyncProgress> changes() {
        return changes.asFlux();
    }

    /**
     * @throws IllegalStateException if {@code event} is not allowed in the current state
     */
    public synchronized SyncProgress transition(SyncEvent event) {
        if (!tryTransition(event)) {
            throw new IllegalStateException("Cannot " + event + " while " + current.state());
        }
        return current;
    }

    /** Applies {@code event} if allowed; returns false and changes nothing otherwise. */
    public synchronized boolean tryTransition(SyncEvent event) {
        return apply(event, null, current.code(), null);
    }

    public synchronized boolean start(SyncRole role) {
        return apply(role == SyncRole.SENDER ? SyncEvent.START_SENDING : SyncEvent.START_RECEIVING, role, null, null);
    }

    public synchronized boolean sessionCreated(String code) {
        return apply(SyncEvent.SESSION_CREATED, current.role(), code, null);
    }

    /** Moves to ERROR with a user-facing message. No-op from a state where failing is not allowed. */
    public synchronized boolean fail(String message) {
        return apply(SyncEvent.FAIL, current.role(), current.code(), message);
    }

    /** Back to IDLE from an active state, optionally with a notice for the user. */
    public synchronized boolean cancel(String notice) {
        return apply(SyncEvent.CANCEL, null, null, notice);
    }

    private boolean apply(SyncEvent event, SyncRole role, String code, String message) {
        Optional<SyncState> next = SyncTransitionTable.next(current.state(), event);
        if (next.isEmpty()) {
            log.debug("Ignoring {} while {}", event, current.state());
            return false;
        }
        SyncState to = next.get();
        SyncProgress updated = to == SyncState.IDLE
                ? new SyncProgress(SyncState.IDLE, null, null, message)
                : new SyncProgress(to, role != null ? role : current.role(), code, message);
        log.debug("{} --{}--> {}", current.state(), event, to);
        current = updated;
        changes.tryEmitNext(updated);
        return true;
    }
}
