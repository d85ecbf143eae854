// SPDX-License-Identifier: MIT OR Apache-2.0
package io.omni.rpc;

import org.jspecify.annotations.Nullable;

/**
 * The {@code error} member of a response envelope.
 */
public record RpcError(int code, String message, @Nullable String data) {}
