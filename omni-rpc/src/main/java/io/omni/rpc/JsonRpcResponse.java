// SPDX-License-Identifier: MIT OR Apache-2.0
package io.omni.rpc;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

/**
 * A JSON-RPC 2.0 response as read by {@link HttpJsonRpcProvider}.
 *
 * @param jsonrpc protocol version, {@code "2.0"}
 * @param result  the result, absent when {@code error} is set
 * @param error   the error, if the call failed
 * @param id      echo of the request id
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonRpcResponse(
        String jsonrpc,
        @Nullable Object result,
        @Nullable JsonRpcError error,
        @Nullable String id) {

    public boolean hasError() {
        return error != null;
    }

    public @Nullable String resultAsString() {
        return result != null ? result.toString() : null;
    }
}
