package com.smartroute.core.execution;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CancellationTokenTest {

    @Test
    void cancelRunsCallbacksOnce() {
        var token = new CancellationToken();
        var calls = new AtomicInteger();
        token.onCancel(calls::incrementAndGet);

        token.cancel();
        token.cancel();

        assertTrue(token.isCancelled());
        assertEquals(1, calls.get());
    }

    @Test
    void callbackRegisteredAfterCancelRunsImmediately() {
        var token = new CancellationToken();
        token.cancel();
        var calls = new AtomicInteger();

        token.onCancel(calls::incrementAndGet);

        assertEquals(1, calls.get());
    }

    @Test
    void removedCallbackDoesNotRun() {
        var token = new CancellationToken();
        var calls = new AtomicInteger();
        var registration = token.onCancel(calls::incrementAndGet);

        registration.remove();
        token.cancel();

        assertEquals(0, calls.get());
    }

    @Test
    void failingCallbackDoesNotStopOthers() {
        var token = new CancellationToken();
        var calls = new AtomicInteger();
        token.onCancel(() -> { throw new IllegalStateException("boom"); });
        token.onCancel(calls::incrementAndGet);

        token.cancel();

        assertEquals(1, calls.get());
    }

    @Test
    void noneIsNotCancelled() {
        assertFalse(CancellationToken.none().isCancelled());
    }
}
