package com.billsync.client.sync;

import com.billsync.client.ClientSettings;
import com.billsync.client.crypto.CryptoEngine;
import com.billsync.client.transport.RelayChannel;
import com.billsync.client.transport.RelayChannelFactory;
import com.billsync.client.transport.RelayListener;
import com.billsync.protocol.BillSyncException;
import com.billsync.protocol.JsonWebKey;
import com.billsync.protocol.PairingCodes;
import com.billsync.protocol.relay.RelayMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import javax.crypto.SecretKey;
import java.time.Duration;
import java.util.Optional;

/**
 * Moves a full data snapshot from one device to another through the sync relay.
 *
 * <p>The sender asks the relay for a pairing code and waits. Once a receiver joins with that code,
 * the sender generates a fresh transfer key, sends it, then sends the snapshot encrypted under it.
 * The receiver decrypts and asks the user before overwriting anything; on approval it imports,
 * answers {@code sync_complete} and both sides finish. Declining answers {@code sync_cancelled}
 * and returns both sides to idle.
 *
 * <p>Only one transfer runs at a time. Callbacks from an abandoned connection are ignored.
 */
public class DeviceSyncClient {

    private static final Logger log = LoggerFactory.getLogger(DeviceSyncClient.class);

    static final String CONFIRM_TITLE = "Confirm Data Import";
    static final String CONFIRM_BODY =
            "Data has been received. This will overwrite all current bills and settings. Do you want to continue?";

    static final String CONNECT_FAILED = "Could not connect to sync service. Please try again.";
    static final String CONNECTION_LOST = "Connection to the sync service was lost.";
    static final String PEER_LEFT = "The other device disconnected.";
    static final String PEER_ERROR = "An error occurred on the other device.";
    static final String PEER_DECLINED = "The other device declined the import.";
    static final String KEY_MISSING = "Data received before encryption key. Sync failed.";
    static final String KEY_INVALID = "Received an invalid encryption key.";
    static final String DECRYPT_FAILED = "Failed to decrypt the received data.";
    static final String SEND_FAILED = "Failed to send data.";
    static final String IMPORT_FAILED = "Failed to import data.";

    private final RelayChannelFactory channels;
    private final CryptoEngine crypto;
    private final ObjectMapper objectMapper;
    private final LocalDataStore store;
    private final ConfirmationPrompt prompt;
    private final QrCodeCodec qrCodes;
    private final Duration connectTimeout;

    private final SyncStateMachine machine = new SyncStateMachine();
    private Session session; // guarded by this

    public DeviceSyncClient(RelayChannelFactory channels,
                            CryptoEngine crypto,
                            ObjectMapper objectMapper,
                            LocalDataStore store,
                            ConfirmationPrompt prompt,
                            QrCodeCodec qrCodes,
                            ClientSettings settings) {
        this.channels = channels;
        this.crypto = crypto;
        this.objectMapper = objectMapper;
        this.store = store;
        this.prompt = prompt;
        this.qrCodes = qrCodes;
        this.connectTimeout = settings.connectTimeout();
    }

    public SyncProgress state() {
        return machine.current();
    }

    /** Every state change, starting with the current one. */
    public Flux<SyncProgress> changes() {
        return machine.changes();
    }

    /**
     * Opens a relay channel and requests a fresh pairing code.
     *
     * @throws IllegalStateException unless idle
     */
    public synchronized void startSending() {
        if (!machine.start(SyncRole.SENDER)) {
            throw new IllegalStateException("A sync is already in progress.");
        }
        open(null);
    }

    /**
     * Joins the sender holding {@code typedCode}. Input that is not six digits moves straight to
     * ERROR without contacting the relay.
     *
     * @throws IllegalStateException unless idle
     */
    public synchronized void startReceiving(String typedCode) {
        if (machine.current().state() != SyncState.IDLE) {
            throw new IllegalStateException("A sync is already in progress.");
        }
        String code;
        try {
            code = PairingCodes.normalize(typedCode);
        } catch (BillSyncException e) {
            machine.fail(e.getMessage());
            return;
        }
        machine.start(SyncRole.RECEIVER);
        open(code);
    }

    /**
     * Starts receiving if {@code scanned} carries a pairing code.
     *
     * @return false, with nothing changed, for scans that hold no code
     */
    public boolean startReceivingFromScan(String scanned) {
        Optional<String> code = qrCodes.decode(scanned);
        if (code.isEmpty()) {
            log.debug("Scan did not contain a pairing code");
            return false;
        }
        startReceiving(code.get());
        return true;
    }

    /** The sender's code rendered for scanning, once the relay has assigned one. */
    public Optional<String> pairingQrCode() {
        return Optional.ofNullable(machine.current().code()).map(qrCodes::encode);
    }

    /**
     * Abandons the transfer and returns to idle. While the user is being asked to confirm an import,
     * this is the same as declining it. Once a confirmed import is committing, it is ignored.
     */
    public synchronized void cancel() {
        Session current = session;
        if (current != null && current.importing) {
            log.debug("Ignoring cancel while the import commits");
            return;
        }
        if (current != null && machine.current().state() == SyncState.CONFIRMING) {
            current.channel.send(RelayMessage.syncCancelled());
        }
        endSession();
        machine.cancel(null);
    }

    /** Leaves COMPLETE or ERROR for idle; anywhere else it cancels. */
    public synchronized void reset() {
        if (machine.current().state().isTerminal()) {
            endSession();
            machine.tryTransition(SyncEvent.RESET);
        } else {
            cancel();
        }
    }

    // ── Connection ───────────────────────────────────────────────────────────

    private void open(String code) {
        Session opened = new Session(channels.create());
        session = opened;
        opened.timeout = Mono.delay(connectTimeout).subscribe(tick -> onConnectTimeout(opened));
        try {
            opened.channel.open(code, opened);
        } catch (RuntimeException e) {
            log.warn("Could not open relay channel", e);
            failSession(CONNECT_FAILED);
        }
    }

    private synchronized void onConnectTimeout(Session source) {
        if (source != session || source.connected) {
            return;
        }
        log.warn("Relay did not answer within {}", connectTimeout);
        failSession(CONNECT_FAILED);
    }

    private synchronized void onClosed(Session source) {
        if (source != session) {
            return;
        }
        log.debug("Relay channel closed in {}", machine.current().state());
        failSession(source.connected ? CONNECTION_LOST : CONNECT_FAILED);
    }

    private synchronized void onFailure(Session source, Throwable error) {
        if (source != session) {
            return;
        }
        log.warn("Relay channel failed: {}", error.toString());
        failSession(source.connected ? CONNECTION_LOST : CONNECT_FAILED);
    }

    private synchronized void onMessage(Session source, RelayMessage message) {
        if (source != session) {
            return;
        }
        if (message.type() == null) {
            log.warn("Ignoring relay frame without a type");
            return;
        }
        switch (message.type()) {
            case SESSION_CREATED -> {
                if (machine.sessionCreated(message.code())) {
                    source.markConnected();
                }
            }
            case PEER_JOINED -> {
                if (machine.tryTransition(SyncEvent.PEER_JOINED)) {
                    source.markConnected();
                    if (machine.current().role() == SyncRole.SENDER) {
                        beginTransfer(source);
                    }
                }
            }
            case KEY -> acceptKey(source, message.key());
            case DATA -> acceptData(source, message.payload());
            case SYNC_COMPLETE -> {
                if (machine.tryTransition(SyncEvent.PEER_COMPLETED)) {
                    log.info("Device sync sent successfully");
                    endSession();
                }
            }
            case SYNC_CANCELLED -> {
                endSession();
                machine.cancel(PEER_DECLINED);
            }
            case ERROR -> failSession(message.message() != null ? message.message() : PEER_ERROR);
            case PEER_DISCONNECTED -> failSession(PEER_LEFT);
        }
    }

    // ── Sender ───────────────────────────────────────────────────────────────

    private void beginTransfer(Session source) {
        machine.transition(SyncEvent.TRANSFER_STARTED);
        SecretKey key = crypto.generateContentKey();
        source.channel.send(RelayMessage.key(crypto.exportKey(key)));
        source.pending = store.exportAllData()
                .map(snapshot -> crypto.encrypt(toJson(snapshot), key))
                .subscribe(payload -> sendData(source, payload),
                        error -> onTransferError(source, SEND_FAILED, error));
    }

    private synchronized void sendData(Session source, String payload) {
        if (source == session) {
            source.channel.send(RelayMessage.data(payload));
        }
    }

    // ── Receiver ─────────────────────────────────────────────────────────────

    private void acceptKey(Session source, JsonWebKey jwk) {
        try {
            source.key = crypto.importContentKey(jwk);
        } catch (BillSyncException e) {
            log.warn("Rejected transfer key: {}", e.getMessage());
            failSession(KEY_INVALID);
        }
    }

    private void acceptData(Session source, String payload) {
        if (source.key == null) {
            failSession(KEY_MISSING);
            return;
        }
        if (!machine.tryTransition(SyncEvent.DATA_RECEIVED)) {
            return;
        }
        SecretKey key = source.key;
        source.pending = Mono.fromCallable(() -> objectMapper.readTree(crypto.decryptToString(payload, key)))
                .subscribe(snapshot -> awaitConfirmation(source, snapshot),
                        error -> onTransferError(source, DECRYPT_FAILED, error));
    }

    private synchronized void awaitConfirmation(Session source, JsonNode snapshot) {
        if (source != session || !machine.tryTransition(SyncEvent.DECRYPTED)) {
            return;
        }
        source.snapshot = snapshot;
        prompt.request(CONFIRM_TITLE, CONFIRM_BODY, () -> confirmImport(source), () -> declineImport(source));
    }

    private synchronized void confirmImport(Session source) {
        if (source != session || machine.current().state() != SyncState.CONFIRMING || source.importing) {
            return;
        }
        source.importing = true;
        source.pending = store.importAllData(source.snapshot)
                .subscribe(null,
                        error -> onTransferError(source, IMPORT_FAILED, error),
                        () -> importApplied(source));
    }

    private synchronized void importApplied(Session source) {
        if (source != session) {
            return;
        }
        source.importing = false;
        source.channel.send(RelayMessage.syncComplete());
        machine.transition(SyncEvent.IMPORT_APPLIED);
        log.info("Device sync imported successfully");
        endSession();
    }

    private synchronized void declineImport(Session source) {
        if (source != session || machine.current().state() != SyncState.CONFIRMING || source.importing) {
            return;
        }
        source.channel.send(RelayMessage.syncCancelled());
        endSession();
        machine.cancel(null);
    }

    // ── Teardown ─────────────────────────────────────────────────────────────

    private synchronized void onTransferError(Session source, String message, Throwable error) {
        if (source != session) {
            return;
        }
        source.importing = false;
        log.warn(message, error);
        source.channel.send(RelayMessage.error(message));
        failSession(message);
    }

    private void failSession(String message) {
        Session current = session;
        if (current != null && current.importing) {
            // The import is already committing; its outcome decides the final state.
            log.debug("Deferring failure during import: {}", message);
            return;
        }
        log.warn("Device sync failed: {}", message);
        endSession();
        machine.fail(message);
    }

    private void endSession() {
        Session current = session;
        session = null;
        if (current != null) {
            current.dispose();
        }
    }

    private String toJson(JsonNode snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw BillSyncException.invalid("Local data could not be serialized.", e);
        }
    }

    /**
     * One relay connection and what this side has learned over it. Fields are guarded by the
     * enclosing client's lock.
     */
    private final class Session implements RelayListener {

        private final RelayChannel channel;
        private Disposable timeout;
        private Disposable pending;
        private boolean connected;
        private boolean importing;
        private SecretKey key;
        private JsonNode snapshot;

        private Session(RelayChannel channel) {
            this.channel = channel;
        }

        private void markConnected() {
            connected = true;
            timeout.dispose();
        }

        private void dispose() {
            timeout.dispose();
            if (pending != null) {
                pending.dispose();
            }
            channel.close();
        }

        @Override
        public void onMessage(RelayMessage message) {
            DeviceSyncClient.this.onMessage(this, message);
        }

        @Override
        public void onClosed() {
            DeviceSyncClient.this.onClosed(this);
        }

        @Override
        public void onFailure(Throwable error) {
            DeviceSyncClient.this.onFailure(this, error);
        }
    }
}
