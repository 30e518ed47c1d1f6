// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.rpc;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Settings for {@link HttpAptosTransport}. Null durations fall back to the defaults.
 *
 * @param url            node REST base URL, for example {@code https://fullnode.devnet.aptoslabs.com/v1}
 * @param connectTimeout TCP connect timeout (default 10s)
 * @param readTimeout    per-request timeout (default 30s)
 * @param headers        extra headers sent with every request
 * @param pollInterval   delay between transaction status polls (default 500ms)
 * @param waitTimeout    how long {@link AptosTransport#waitForTransaction(String)} polls (default 60s)
 * @param maxAttempts    attempts for idempotent reads before giving up (default 3)
 * @since 0.1.0
 */
public record TransportConfig(
        String url,
        Duration connectTimeout,
        Duration readTimeout,
        Map<String, String> headers,
        Duration pollInterval,
        Duration waitTimeout,
        int maxAttempts) {

    static final Duration DEFAULT_CONNECT = Duration.ofSeconds(10);
    static final Duration DEFAULT_READ = Duration.ofSeconds(30);
    static final Duration DEFAULT_POLL = Duration.ofMillis(500);
    static final Duration DEFAULT_WAIT = Duration.ofSeconds(60);
    static final int DEFAULT_MAX_ATTEMPTS = 3;

    public TransportConfig {
        Objects.requireNonNull(url, "url cannot be null");
        if (url.isBlank()) {
            throw new IllegalArgumentException("url cannot be blank");
        }
        connectTimeout = connectTimeout == null ? DEFAULT_CONNECT : connectTimeout;
        readTimeout = readTimeout == null ? DEFAULT_READ : readTimeout;
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        pollInterval = pollInterval == null ? DEFAULT_POLL : pollInterval;
        waitTimeout = waitTimeout == null ? DEFAULT_WAIT : waitTimeout;
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive, got: " + pollInterval);
        }
        if (waitTimeout.isNegative()) {
            throw new IllegalArgumentException("waitTimeout must not be negative, got: " + waitTimeout);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
    }

    public static TransportConfig withDefaults(final String url) {
        return new TransportConfig(url, DEFAULT_CONNECT, DEFAULT_READ, Map.of(), DEFAULT_POLL, DEFAULT_WAIT,
                DEFAULT_MAX_ATTEMPTS);
    }
}
