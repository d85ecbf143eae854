// SPDX-License-Identifier: MIT OR Apache-2.0
package io.omni.core.error;

import org.jspecify.annotations.Nullable;

/**
 * Exception thrown when a call to a validator (or a conventional JSON-RPC node)
 * fails.
 *
 * <p>
 * Every failure carries a {@link Kind} describing where the call stopped, so
 * wallet code can tell "the call never left the client" apart from "the
 * validator answered with an error":
 * <ul>
 * <li>{@link Kind#NOT_CONNECTED}: no connection within the grace period, nothing sent</li>
 * <li>{@link Kind#SEND_FAILED}: registered but the frame could not be written</li>
 * <li>{@link Kind#TIMEOUT}: no response before the call's deadline</li>
 * <li>{@link Kind#CONNECTION_LOST}: reconnect budget exhausted</li>
 * <li>{@link Kind#DISCONNECTED}: the caller disconnected the client</li>
 * <li>{@link Kind#REMOTE_ERROR}: well-formed error envelope, see {@link #code()}</li>
 * <li>{@link Kind#DUPLICATE_ID}: correlation id already outstanding</li>
 * <li>{@link Kind#TRANSPORT}: HTTP or serialization failure on the JSON-RPC path</li>
 * </ul>
 *
 * <p>
 * For {@link Kind#REMOTE_ERROR} the {@code code} is the backend's error code.
 * Client-side kinds use codes in the JSON-RPC server range:
 * <ul>
 * <li><strong>-32000</strong>: generic client failure (send, transport)</li>
 * <li><strong>-32002</strong>: timeout</li>
 * <li><strong>-32003</strong>: not connected, connection lost, disconnected</li>
 * <li><strong>-32603</strong>: duplicate correlation id (internal error)</li>
 * </ul>
 *
 * @see <a href="https://www.jsonrpc.org/specification#error_object">JSON-RPC
 *      Error Specification</a>
 */
public final class RpcException extends OmniException {

    /**
     * Where in the call lifecycle the failure happened.
     */
    public enum Kind {
        NOT_CONNECTED(-32003),
        SEND_FAILED(-32000),
        TIMEOUT(-32002),
        CONNECTION_LOST(-32003),
        DISCONNECTED(-32003),
        REMOTE_ERROR(-32000),
        DUPLICATE_ID(-32603),
        TRANSPORT(-32000);

        private final int defaultCode;

        Kind(final int defaultCode) {
            this.defaultCode = defaultCode;
        }

        public int defaultCode() {
            return defaultCode;
        }
    }

    private final Kind kind;
    private final int code;
    private final @Nullable String data;
    private final @Nullable String callId;

    public RpcException(
            final Kind kind,
            final int code,
            final String message,
            final @Nullable String data,
            final @Nullable String callId,
            final @Nullable Throwable cause) {
        super(augmentMessage(message, callId), cause);
        this.kind = kind;
        this.code = code;
        this.data = data;
        this.callId = callId;
    }

    public RpcException(final Kind kind, final String message, final @Nullable String callId) {
        this(kind, kind.defaultCode(), message, null, callId, null);
    }

    public RpcException(final Kind kind, final String message, final @Nullable String callId,
            final @Nullable Throwable cause) {
        this(kind, kind.defaultCode(), message, null, callId, cause);
    }

    /**
     * Creates an exception for an error envelope returned by the backend.
     */
    public static RpcException remote(final int code, final String message, final @Nullable String data,
            final @Nullable String callId) {
        return new RpcException(Kind.REMOTE_ERROR, code, message, data, callId, null);
    }

    public Kind kind() {
        return kind;
    }

    public int code() {
        return code;
    }

    public @Nullable String data() {
        return data;
    }

    public @Nullable String callId() {
        return callId;
    }

    /**
     * Returns {@code true} if the call never reached the wire or the
     * connection went away underneath it, as opposed to a backend answer.
     */
    public boolean isConnectivityFailure() {
        return kind == Kind.NOT_CONNECTED
                || kind == Kind.CONNECTION_LOST
                || kind == Kind.DISCONNECTED
                || kind == Kind.SEND_FAILED;
    }

    @Override
    public String toString() {
        return "RpcException{"
                + "kind="
                + kind
                + ", code="
                + code
                + ", message="
                + getMessage()
                + ", data="
                + data
                + ", callId="
                + callId
                + "}";
    }

    private static String augmentMessage(final String message, final @Nullable String callId) {
        if (callId == null || message == null || message.isBlank()) {
            return message;
        }

        return "[callId=" + callId + "] " + message;
    }
}
