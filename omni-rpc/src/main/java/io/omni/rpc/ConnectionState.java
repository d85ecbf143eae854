// SPDX-License-Identifier: MIT OR Apache-2.0
package io.omni.rpc;

/**
 * Lifecycle state of a {@link Connection}.
 *
 * <pre>
 * DISCONNECTED --connect()--&gt; CONNECTING --open--&gt; OPEN
 * OPEN/CONNECTING --close or connect failure--&gt; DISCONNECTED (reconnect scheduled)
 *                                            or FAILED (budget exhausted)
 * any --disconnect()--&gt; CLOSING --&gt; DISCONNECTED
 * </pre>
 */
public enum ConnectionState {
    /** No socket. A reconnect may be scheduled. */
    DISCONNECTED,
    /** A socket is being opened. */
    CONNECTING,
    /** The socket is open and calls are sent immediately. */
    OPEN,
    /** An explicit disconnect is in progress. */
    CLOSING,
    /** The reconnect budget is exhausted. Only an explicit {@code connect()} leaves this state. */
    FAILED
}
