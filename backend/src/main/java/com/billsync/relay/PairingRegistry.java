package com.billsync.relay;

import com.billsync.protocol.BillSyncException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns every live {@link SyncPairing} of this relay process, indexed by code and by connection.
 * Nothing here is persisted; a restart forgets all pairings.
 */
@Component
public class PairingRegistry {

    private static final Logger log = LoggerFactory.getLogger(PairingRegistry.class);

    static final int MAX_CODE_ATTEMPTS = 20;

    public enum BindOutcome {
        BOUND,
        UNKNOWN_CODE,
        ALREADY_PAIRED
    }

    private final ConcurrentHashMap<String, SyncPairing> byCode = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, SyncPairing> byPeer = new ConcurrentHashMap<>();

    private final PairingCodeGenerator codes;
    private final Clock clock;

    public PairingRegistry(PairingCodeGenerator codes, Clock clock) {
        this.codes = codes;
        this.clock = clock;
    }

    /**
     * Allocates a code no live pairing is using and registers {@code sender} under it.
     *
     * @throws BillSyncException TRANSPORT_FAILURE if no free code turned up
     */
    public SyncPairing create(RelayPeer sender) {
        for (int attempt = 0; attempt < MAX_CODE_ATTEMPTS; attempt++) {
            SyncPairing pairing = new SyncPairing(codes.nextCode(), sender, clock.instant());
            if (byCode.putIfAbsent(pairing.code(), pairing) == null) {
                byPeer.put(sender.id(), pairing);
                log.info("Pairing {} created", pairing.code());
                return pairing;
            }
        }
        throw BillSyncException.transport("Could not allocate a free pairing code.", null);
    }

    public BindOutcome bind(String code, RelayPeer receiver) {
        SyncPairing pairing = byCode.get(code);
        if (pairing == null) {
            return BindOutcome.UNKNOWN_CODE;
        }
        if (!pairing.bindReceiver(receiver)) {
            return pairing.isPaired() ? BindOutcome.ALREADY_PAIRED : BindOutcome.UNKNOWN_CODE;
        }
        byPeer.put(receiver.id(), pairing);
        if (pairing.isReleased()) {
            // sender went away between the bind and the index update
            byPeer.remove(receiver.id(), pairing);
            return BindOutcome.UNKNOWN_CODE;
        }
        log.info("Pairing {} bound", code);
        return BindOutcome.BOUND;
    }

    public Optional<SyncPairing> find(String code) {
        return Optional.ofNullable(byCode.get(code));
    }

    public Optional<SyncPairing> pairingOf(RelayPeer peer) {
        return Optional.ofNullable(byPeer.get(peer.id()));
    }

    /**
     * Tears the pairing down so its code can never bind again. Idempotent.
     *
     * @return the pairing that was removed, if it was still live
     */
    public Optional<SyncPairing> release(String code) {
        SyncPairing pairing = byCode.remove(code);
        if (pairing == null) {
            return Optional.empty();
        }
        pairing.markReleased();
        byPeer.remove(pairing.sender().id(), pairing);
        pairing.receiver().ifPresent(receiver -> byPeer.remove(receiver.id(), pairing));
        log.info("Pairing {} released", code);
        return Optional.of(pairing);
    }

    public int size() {
        return byCode.size();
    }
}
