package com.billsync.relay;

import com.billsync.protocol.BillSyncException;
import com.billsync.protocol.FailureKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PairingRegistryTest {

    @Mock
    private PairingCodeGenerator codes;

    private PairingRegistry registry;

    @BeforeEach
    void setup() {
        registry = new PairingRegistry(codes, Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void createShouldSkipCodesThatAreStillLive() {
        when(codes.nextCode()).thenReturn("111111", "111111", "222222");

        SyncPairing first = registry.create(new RecordingPeer("a"));
        SyncPairing second = registry.create(new RecordingPeer("b"));

        assertEquals("111111", first.code());
        assertEquals("222222", second.code());
        verify(codes, times(3)).nextCode();
    }

    @Test
    void createShouldGiveUpAfterBoundedAttempts() {
        when(codes.nextCode()).thenReturn("111111");
        registry.create(new RecordingPeer("a"));

        BillSyncException ex = assertThrows(BillSyncException.class, () -> registry.create(new RecordingPeer("b")));
        assertEquals(FailureKind.TRANSPORT_FAILURE, ex.kind());
    }

    @Test
    void bindShouldReportUnknownAlreadyPairedAndBound() {
        when(codes.nextCode()).thenReturn("482913");
        RecordingPeer sender = new RecordingPeer("sender");
        registry.create(sender);

        assertEquals(PairingRegistry.BindOutcome.UNKNOWN_CODE, registry.bind("000000", new RecordingPeer("x")));
        assertEquals(PairingRegistry.BindOutcome.BOUND, registry.bind("482913", new RecordingPeer("r1")));
        assertEquals(PairingRegistry.BindOutcome.ALREADY_PAIRED, registry.bind("482913", new RecordingPeer("r2")));
    }

    @Test
    void releasedCodeShouldNeverBindAgain() {
        when(codes.nextCode()).thenReturn("482913");
        RecordingPeer sender = new RecordingPeer("sender");
        RecordingPeer receiver = new RecordingPeer("receiver");
        registry.create(sender);
        registry.bind("482913", receiver);

        assertTrue(registry.release("482913").isPresent());
        assertTrue(registry.release("482913").isEmpty());

        assertEquals(PairingRegistry.BindOutcome.UNKNOWN_CODE, registry.bind("482913", new RecordingPeer("late")));
        assertTrue(registry.pairingOf(sender).isEmpty());
        assertTrue(registry.pairingOf(receiver).isEmpty());
        assertEquals(0, registry.size());
    }

    @Test
    void pairingOfShouldResolveBothSides() {
        when(codes.nextCode()).thenReturn("482913");
        RecordingPeer sender = new RecordingPeer("sender");
        RecordingPeer receiver = new RecordingPeer("receiver");
        SyncPairing pairing = registry.create(sender);
        registry.bind("482913", receiver);

        assertSame(pairing, registry.pairingOf(sender).orElseThrow());
        assertSame(pairing, registry.pairingOf(receiver).orElseThrow());
        assertSame(receiver, pairing.counterpart(sender).orElseThrow());
        assertSame(sender, pairing.counterpart(receiver).orElseThrow());
        assertFalse(pairing.counterpart(new RecordingPeer("stranger")).isPresent());
    }

    @Test
    void concurrentReceiversShouldBindExactlyOnce() throws Exception {
        when(codes.nextCode()).thenReturn("482913");
        registry.create(new RecordingPeer("sender"));

        int contenders = 8;
        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<PairingRegistry.BindOutcome>> outcomes = new ArrayList<>();
            for (int i = 0; i < contenders; i++) {
                RecordingPeer receiver = new RecordingPeer("receiver-" + i);
                outcomes.add(pool.submit(() -> {
                    start.await();
                    return registry.bind("482913", receiver);
                }));
            }
            start.countDown();

            int bound = 0;
            for (Future<PairingRegistry.BindOutcome> outcome : outcomes) {
                PairingRegistry.BindOutcome result = outcome.get(5, TimeUnit.SECONDS);
                if (result == PairingRegistry.BindOutcome.BOUND) {
                    bound++;
                } else {
                    assertEquals(PairingRegistry.BindOutcome.ALREADY_PAIRED, result);
                }
            }
            assertEquals(1, bound);
        } finally {
            pool.shutdownNow();
        }
    }
}
