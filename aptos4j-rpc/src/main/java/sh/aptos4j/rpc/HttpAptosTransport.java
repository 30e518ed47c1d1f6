// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.rpc;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import sh.aptos4j.core.DebugLogger;
import sh.aptos4j.core.LogFormatter;
import sh.aptos4j.core.error.TransactionTimeoutException;
import sh.aptos4j.core.error.TransportException;
import sh.aptos4j.core.tx.SignedTransaction;
import sh.aptos4j.core.tx.ViewPayload;
import sh.aptos4j.core.types.AccountAddress;

/**
 * {@link AptosTransport} over the node REST API.
 *
 * <p>
 * Reads are retried on network failures and gateway errors up to
 * {@link TransportConfig#maxAttempts()}; submissions are sent once. Error responses become
 * {@link TransportException}s carrying the HTTP status and the node's {@code error_code}.
 *
 * <p>
 * <strong>Usage:</strong>
 * <pre>{@code
 * AptosTransport transport = HttpAptosTransport.builder("http://127.0.0.1:8080/v1")
 *         .readTimeout(Duration.ofSeconds(10))
 *         .header("Authorization", "Bearer " + apiKey)
 *         .build();
 * int chainId = transport.getChainId();
 * }</pre>
 *
 * @since 0.1.0
 */
public final class HttpAptosTransport implements AptosTransport {

    private static final Logger LOG = LoggerFactory.getLogger(HttpAptosTransport.class);
    private static final String JSON = "application/json";
    private static final String ACCOUNT_NOT_FOUND = "account_not_found";
    private static final String TRANSACTION_NOT_FOUND = "transaction_not_found";
    private static final TypeReference<List<Object>> VALUES = new TypeReference<>() {
    };

    private final TransportConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String baseUrl;

    private HttpAptosTransport(final TransportConfig config) {
        this.config = config;
        this.baseUrl = stripTrailingSlash(config.url());
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(config.connectTimeout())
                .build();
    }

    public static Builder builder(final String url) {
        return new Builder(url);
    }

    public static HttpAptosTransport create(final TransportConfig config) {
        return new HttpAptosTransport(Objects.requireNonNull(config, "config cannot be null"));
    }

    public TransportConfig config() {
        return config;
    }

    @Override
    public int getChainId() {
        final JsonNode info = readJson(get(""));
        final JsonNode chainId = info.get("chain_id");
        if (chainId == null || !chainId.canConvertToInt()) {
            throw new TransportException("Ledger info has no chain_id");
        }
        return chainId.asInt();
    }

    @Override
    public long getSequenceNumber(final AccountAddress address) {
        Objects.requireNonNull(address, "address cannot be null");
        final String body;
        try {
            body = get("accounts/" + address.toLongString());
        } catch (TransportException e) {
            if (e.isNotFound() && ACCOUNT_NOT_FOUND.equals(e.errorCode())) {
                return 0L;
            }
            throw e;
        }
        return parseU64(readJson(body), "sequence_number");
    }

    @Override
    public String submitSignedTransaction(final byte[] bcsSignedTransaction) {
        Objects.requireNonNull(bcsSignedTransaction, "bcsSignedTransaction cannot be null");
        final JsonNode pending = readJson(post("transactions", SignedTransaction.CONTENT_TYPE, bcsSignedTransaction));
        final String hash = pending.path("hash").asText(null);
        if (hash == null) {
            throw new TransportException("Submission response has no hash");
        }
        return hash;
    }

    @Override
    public TransactionResult waitForTransaction(final String hash) {
        Objects.requireNonNull(hash, "hash cannot be null");
        final Duration timeout = config.waitTimeout();
        DebugLogger.logTx(LogFormatter.formatTxWait(hash, timeout.toMillis()));
        final Instant deadline = Instant.now().plus(timeout);
        while (true) {
            final TransactionResult result = fetchByHash(hash);
            if (result != null && !result.isPending()) {
                return result;
            }
            if (!Instant.now().isBefore(deadline)) {
                throw new TransactionTimeoutException(hash, timeout);
            }
            try {
                Thread.sleep(config.pollInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransportException("Interrupted while waiting for transaction " + hash, e);
            }
        }
    }

    private @Nullable TransactionResult fetchByHash(final String hash) {
        try {
            return TransactionResult.fromJson(readJson(get("transactions/wait_by_hash/" + hash)));
        } catch (TransportException e) {
            // not yet visible to this node
            if (e.isNotFound() && TRANSACTION_NOT_FOUND.equals(e.errorCode())) {
                LOG.debug("Transaction {} not yet known to the node, polling again", hash);
                return null;
            }
            throw e;
        }
    }

    @Override
    public List<Object> view(final byte[] bcsViewPayload, final @Nullable Long ledgerVersion) {
        Objects.requireNonNull(bcsViewPayload, "bcsViewPayload cannot be null");
        final String path = ledgerVersion == null
                ? "view"
                : "view?ledger_version=" + Long.toUnsignedString(ledgerVersion);
        final String body = TransportRetry.run(
                () -> send("POST", path, ViewPayload.CONTENT_TYPE, bcsViewPayload), config.maxAttempts());
        try {
            return mapper.readValue(body, VALUES);
        } catch (JsonProcessingException e) {
            throw new TransportException(200, null, "Unable to parse view response", body, e);
        }
    }

    @Override
    public long estimateGasPrice() {
        return parseU64(readJson(get("estimate_gas_price")), "gas_estimate");
    }

    @Override
    public List<TransactionResult> simulateTransaction(final byte[] bcsSignedTransaction) {
        Objects.requireNonNull(bcsSignedTransaction, "bcsSignedTransaction cannot be null");
        final JsonNode results = readJson(
                post("transactions/simulate", SignedTransaction.CONTENT_TYPE, bcsSignedTransaction));
        if (!results.isArray()) {
            throw new TransportException("Simulation response is not an array");
        }
        final List<TransactionResult> out = new ArrayList<>(results.size());
        for (JsonNode node : results) {
            out.add(TransactionResult.fromJson(node));
        }
        return List.copyOf(out);
    }

    private String get(final String path) {
        return TransportRetry.run(() -> send("GET", path, null, null), config.maxAttempts());
    }

    private String post(final String path, final String contentType, final byte[] body) {
        return send("POST", path, contentType, body);
    }

    private String send(
            final String method,
            final String path,
            final @Nullable String contentType,
            final byte @Nullable [] body) {
        final HttpRequest request = buildRequest(method, path, contentType, body);

        final long start = System.nanoTime();
        final HttpResponse<String> response = execute(request, method, path, start);
        final long durationMicros = (System.nanoTime() - start) / 1_000L;

        final int status = response.statusCode();
        if (status < 200 || status >= 300) {
            DebugLogger.logTransport(
                    LogFormatter.formatHttpError(method, "/" + path, "HTTP " + status, durationMicros));
            throw toException(method, path, status, response.body());
        }
        DebugLogger.logTransport(LogFormatter.formatHttp(method, "/" + path, status, durationMicros));
        return response.body();
    }

    private HttpRequest buildRequest(
            final String method,
            final String path,
            final @Nullable String contentType,
            final byte @Nullable [] body) {
        final URI uri = URI.create(path.isEmpty() ? baseUrl : baseUrl + "/" + path);
        final HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .header("Accept", JSON)
                .timeout(config.readTimeout());
        if (body != null) {
            builder.header("Content-Type", contentType != null ? contentType : JSON)
                    .method(method, HttpRequest.BodyPublishers.ofByteArray(body));
        } else {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        }

        for (Map.Entry<String, String> entry : config.headers().entrySet()) {
            builder.header(entry.getKey(), entry.getValue());
        }
        return builder.build();
    }

    private HttpResponse<String> execute(
            final HttpRequest request, final String method, final String path, final long start) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted during " + method + " /" + path, e);
        } catch (IOException e) {
            DebugLogger.logTransport(LogFormatter.formatHttpError(
                    method, "/" + path, e.getClass().getSimpleName(), (System.nanoTime() - start) / 1_000L));
            throw new TransportException("Network error during " + method + " /" + path, e);
        }
    }

    private TransportException toException(
            final String method, final String path, final int status, final @Nullable String body) {
        String message = null;
        String errorCode = null;
        if (body != null && !body.isBlank()) {
            try {
                final JsonNode node = mapper.readTree(body);
                message = node.path("message").asText(null);
                errorCode = node.path("error_code").asText(null);
            } catch (JsonProcessingException e) {
                // plain-text error page from a proxy
                LOG.debug("Non-JSON error body for {} /{} (HTTP {}): {}", method, path, status, e.getMessage());
                message = body.length() > 200 ? body.substring(0, 200) : body.strip();
            }
        }
        final String text = "HTTP " + status + " for " + method + " /" + path
                + (message != null ? ": " + message : "");
        return new TransportException(status, errorCode, text, body, null);
    }

    private JsonNode readJson(final String body) {
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new TransportException(200, null, "Unable to parse node response", body, e);
        }
    }

    private static long parseU64(final JsonNode node, final String field) {
        final JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new TransportException("Response has no " + field);
        }
        try {
            return Long.parseUnsignedLong(value.asText());
        } catch (NumberFormatException e) {
            throw new TransportException("Invalid " + field + ": " + value.asText(), e);
        }
    }

    private static String stripTrailingSlash(final String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public static final class Builder {
        private final String url;
        private Duration connectTimeout = TransportConfig.DEFAULT_CONNECT;
        private Duration readTimeout = TransportConfig.DEFAULT_READ;
        private Duration pollInterval = TransportConfig.DEFAULT_POLL;
        private Duration waitTimeout = TransportConfig.DEFAULT_WAIT;
        private int maxAttempts = TransportConfig.DEFAULT_MAX_ATTEMPTS;
        private final Map<String, String> headers = new LinkedHashMap<>();

        private Builder(final String url) {
            this.url = url;
        }

        public Builder connectTimeout(final Duration connectTimeout) {
            if (connectTimeout != null) {
                this.connectTimeout = connectTimeout;
            }
            return this;
        }

        public Builder readTimeout(final Duration readTimeout) {
            if (readTimeout != null) {
                this.readTimeout = readTimeout;
            }
            return this;
        }

        public Builder pollInterval(final Duration pollInterval) {
            if (pollInterval != null) {
                this.pollInterval = pollInterval;
            }
            return this;
        }

        public Builder waitTimeout(final Duration waitTimeout) {
            if (waitTimeout != null) {
                this.waitTimeout = waitTimeout;
            }
            return this;
        }

        public Builder maxAttempts(final int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder header(final String key, final String value) {
            headers.put(key, value);
            return this;
        }

        public HttpAptosTransport build() {
            return new HttpAptosTransport(new TransportConfig(url, connectTimeout, readTimeout,
                    new LinkedHashMap<>(headers), pollInterval, waitTimeout, maxAttempts));
        }
    }
}
