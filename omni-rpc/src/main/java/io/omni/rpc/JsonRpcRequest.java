// SPDX-License-Identifier: MIT OR Apache-2.0
package io.omni.rpc;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A JSON-RPC 2.0 request as sent by {@link HttpJsonRpcProvider}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonRpcRequest(String jsonrpc, String method, List<?> params, String id) {}
