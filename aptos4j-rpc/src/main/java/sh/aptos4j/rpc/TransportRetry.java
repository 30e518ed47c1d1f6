// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.rpc;

import java.util.Objects;
import java.util.function.Supplier;

import sh.aptos4j.core.error.TransportException;

/**
 * Retries idempotent node reads with linear backoff.
 *
 * <p>Only network failures, rate limiting and gateway errors are retried. Anything the node
 * answered deliberately (4xx other than 429) is thrown on the first attempt.
 */
final class TransportRetry {

    static final long BACKOFF_BASE_MS = 200;

    private TransportRetry() {
    }

    static <T> T run(final Supplier<T> supplier, final int maxAttempts) {
        Objects.requireNonNull(supplier, "supplier cannot be null");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        for (int attempt = 1; ; attempt++) {
            try {
                return supplier.get();
            } catch (TransportException e) {
                if (!isRetryable(e) || attempt >= maxAttempts) {
                    throw e;
                }
                try {
                    Thread.sleep(backoff(attempt));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
    }

    static boolean isRetryable(final TransportException e) {
        final int status = e.statusCode();
        return e.isNetworkError() || status == 429 || status == 502 || status == 503 || status == 504;
    }

    static long backoff(final int attempt) {
        return BACKOFF_BASE_MS * attempt;
    }
}
