// SPDX-License-Identifier: MIT OR Apache-2.0
package io.omni.core.error;

/**
 * Base runtime exception for all Omni client failures.
 *
 * <p>
 * This sealed class forms the root of the exception hierarchy so that wallet
 * code can catch every client failure with a single clause while still
 * switching on the concrete type.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * OmniException
 * └── {@link RpcException} - validator or JSON-RPC communication failures
 * </pre>
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try {
 *     BigInteger balance = client.getBalance(address).join();
 * } catch (CompletionException e) {
 *     if (e.getCause() instanceof RpcException rpc && rpc.kind() == RpcException.Kind.TIMEOUT) {
 *         // validator did not answer in time
 *     }
 * }
 * }</pre>
 */
public sealed class OmniException extends RuntimeException permits RpcException {

    public OmniException(final String message) {
        super(message);
    }

    public OmniException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
