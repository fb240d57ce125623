package com.litigation.pipeline.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CancellationToken Tests")
class CancellationTokenTest {

    @Test
    @DisplayName("Should record the reason of the first cancel only")
    void firstCancelWins() {
        CancellationToken token = CancellationToken.create();

        assertTrue(token.cancel("user abort"));
        assertFalse(token.cancel("second"));

        assertTrue(token.isCancelled());
        assertEquals("user abort", token.getReason());
    }

    @Test
    @DisplayName("Should run callbacks once, including those registered after cancellation")
    void callbacksRunOnce() {
        CancellationToken token = CancellationToken.create();
        AtomicInteger early = new AtomicInteger();
        AtomicInteger late = new AtomicInteger();

        token.onCancel(early::incrementAndGet);
        token.cancel("stop");
        token.cancel("again");
        token.onCancel(late::incrementAndGet);

        assertEquals(1, early.get());
        assertEquals(1, late.get());
    }

    @Test
    @DisplayName("Should throw with the cancel reason at a checkpoint")
    void throwIfCancelled() {
        CancellationToken token = CancellationToken.create();
        assertDoesNotThrow(token::throwIfCancelled);

        token.cancel("withdrawn");

        OperationCancelledException e = assertThrows(OperationCancelledException.class, token::throwIfCancelled);
        assertEquals("withdrawn", e.getMessage());
    }

    @Test
    @DisplayName("Should use a default message when cancelled without a reason")
    void nullReason() {
        CancellationToken token = CancellationToken.create();
        token.cancel(null);

        OperationCancelledException e = assertThrows(OperationCancelledException.class, token::throwIfCancelled);
        assertEquals("cancelled", e.getMessage());
    }

    @Test
    @DisplayName("The none token should never cancel")
    void noneToken() {
        CancellationToken none = CancellationToken.none();
        AtomicInteger calls = new AtomicInteger();
        none.onCancel(calls::incrementAndGet);

        assertFalse(none.cancel("ignored"));
        assertFalse(none.isCancelled());
        assertEquals(0, calls.get());
    }

    @Test
    @DisplayName("Should drop a callback once its registration is closed")
    void closedRegistration() {
        CancellationToken token = CancellationToken.create();
        AtomicInteger calls = new AtomicInteger();

        CancellationToken.Registration registration = token.onCancel(calls::incrementAndGet);
        try (CancellationToken.Registration kept = token.onCancel(calls::incrementAndGet)) {
            assertEquals(2, token.registeredCallbacks());
        }
        registration.close();
        token.cancel("stop");

        assertEquals(0, calls.get());
        assertEquals(0, token.registeredCallbacks());
    }
}
