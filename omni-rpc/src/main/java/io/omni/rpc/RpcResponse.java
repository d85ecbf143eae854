// SPDX-License-Identifier: MIT OR Apache-2.0
package io.omni.rpc;

import static io.omni.rpc.internal.RpcUtils.MAPPER;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import io.omni.core.error.RpcException;
import io.omni.rpc.internal.RpcUtils;

/**
 * A response envelope read from the socket.
 *
 * <p>
 * Exactly one of {@code result} and {@code error} is meaningful; when a frame
 * carries both, the error wins. {@code cached} and {@code servedBy} are
 * optional hints from the validator network.
 */
public record RpcResponse(
        String id,
        @Nullable Object result,
        @Nullable RpcError error,
        boolean cached,
        @Nullable String servedBy) {

    public boolean hasError() {
        return error != null;
    }

    /**
     * Parses a response from a JSON tree.
     *
     * @throws MalformedFrameException if the node is not a response envelope
     */
    static RpcResponse fromNode(final @Nullable JsonNode node) throws MalformedFrameException {
        if (node == null || !node.isObject()) {
            throw new MalformedFrameException("frame is not a JSON object");
        }
        final JsonNode idNode = node.get("id");
        if (idNode == null || !idNode.isTextual()) {
            throw new MalformedFrameException("missing textual id");
        }
        final JsonNode errorNode = node.get("error");
        final boolean hasError = errorNode != null && !errorNode.isNull();
        if (!hasError && !node.has("result")) {
            throw new MalformedFrameException("neither result nor error present");
        }

        final JsonNode servedByNode = node.get("servedBy");
        final boolean cached = node.path("cached").asBoolean(false);
        final String servedBy = servedByNode != null && servedByNode.isTextual() ? servedByNode.asText() : null;

        if (hasError) {
            if (!errorNode.isObject()) {
                throw new MalformedFrameException("error is not an object");
            }
            final int code = errorNode.path("code").asInt(RpcException.Kind.REMOTE_ERROR.defaultCode());
            final String message = errorNode.path("message").asText("Remote error");
            final String data = errorNode.has("data")
                    ? RpcUtils.extractErrorData(toObject(errorNode.get("data")))
                    : null;
            return new RpcResponse(idNode.asText(), null, new RpcError(code, message, data), cached, servedBy);
        }
        return new RpcResponse(idNode.asText(), toObject(node.get("result")), null, cached, servedBy);
    }

    private static @Nullable Object toObject(final JsonNode node) throws MalformedFrameException {
        try {
            return MAPPER.treeToValue(node, Object.class);
        } catch (JsonProcessingException e) {
            throw new MalformedFrameException("unreadable value: " + e.getOriginalMessage());
        }
    }

    /**
     * Signals a frame that cannot be read as a response envelope. Never
     * reaches callers.
     */
    static final class MalformedFrameException extends Exception {
        private static final long serialVersionUID = 1L;

        MalformedFrameException(final String reason) {
            super(reason);
        }
    }
}
