// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.rpc;

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import sh.aptos4j.core.error.TransportException;

class TransportRetryTest {

    @ParameterizedTest
    @ValueSource(ints = {429, 502, 503, 504})
    void retriesGatewayStatuses(int status) {
        assertTrue(TransportRetry.isRetryable(new TransportException(status, null, "HTTP " + status, null, null)));
    }

    @ParameterizedTest
    @ValueSource(ints = {400, 403, 404, 500})
    void doesNotRetryAnswers(int status) {
        assertFalse(TransportRetry.isRetryable(new TransportException(status, null, "HTTP " + status, null, null)));
    }

    @Test
    void retriesNetworkErrors() {
        assertTrue(TransportRetry.isRetryable(new TransportException("connection refused")));
    }

    @Test
    void returnsAfterTransientFailure() {
        AtomicInteger calls = new AtomicInteger();

        String value = TransportRetry.run(() -> {
            if (calls.incrementAndGet() == 1) {
                throw new TransportException("connection reset");
            }
            return "ok";
        }, 3);

        assertEquals("ok", value);
        assertEquals(2, calls.get());
    }

    @Test
    void stopsAtMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();

        TransportException ex = assertThrows(TransportException.class, () -> TransportRetry.run(() -> {
            calls.incrementAndGet();
            throw new TransportException(503, null, "HTTP 503", null, null);
        }, 2));

        assertEquals(503, ex.statusCode());
        assertEquals(2, calls.get());
    }

    @Test
    void throwsNonRetryableImmediately() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(TransportException.class, () -> TransportRetry.run(() -> {
            calls.incrementAndGet();
            throw new TransportException(400, "invalid_input", "HTTP 400", null, null);
        }, 3));

        assertEquals(1, calls.get());
    }

    @Test
    void backoffGrowsLinearly() {
        assertEquals(200, TransportRetry.backoff(1));
        assertEquals(400, TransportRetry.backoff(2));
        assertThrows(IllegalArgumentException.class, () -> TransportRetry.run(() -> "x", 0));
    }
}
