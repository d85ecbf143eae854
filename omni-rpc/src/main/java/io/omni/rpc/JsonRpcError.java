// SPDX-License-Identifier: MIT OR Apache-2.0
package io.omni.rpc;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.jspecify.annotations.Nullable;

@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonRpcError(int code, String message, @Nullable Object data) {}
