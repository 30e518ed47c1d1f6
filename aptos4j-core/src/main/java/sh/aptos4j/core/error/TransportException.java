// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.error;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when a call to an Aptos node fails.
 *
 * <p>
 * {@link #statusCode()} is the HTTP status, or {@link #NETWORK_ERROR} when no response
 * arrived. {@link #errorCode()} is the node's {@code error_code} field when the body carried one
 * (for example {@code account_not_found} or {@code invalid_input}).
 *
 * @since 0.1.0
 */
public final class TransportException extends AptosException {

    /** Status used when the request never produced an HTTP response. */
    public static final int NETWORK_ERROR = -1;

    private final int statusCode;
    private final @Nullable String errorCode;
    private final @Nullable String body;

    public TransportException(final String message) {
        this(NETWORK_ERROR, null, message, null, null);
    }

    public TransportException(final String message, final Throwable cause) {
        this(NETWORK_ERROR, null, message, null, cause);
    }

    public TransportException(
            final int statusCode,
            final @Nullable String errorCode,
            final String message,
            final @Nullable String body,
            final @Nullable Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.errorCode = errorCode;
        this.body = body;
    }

    public int statusCode() {
        return statusCode;
    }

    public @Nullable String errorCode() {
        return errorCode;
    }

    public @Nullable String body() {
        return body;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }

    public boolean isNetworkError() {
        return statusCode == NETWORK_ERROR;
    }
}
