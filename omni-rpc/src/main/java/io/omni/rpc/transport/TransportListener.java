// SPDX-License-Identifier: MIT OR Apache-2.0
package io.omni.rpc.transport;

import org.jspecify.annotations.Nullable;

/**
 * Callbacks from an open {@link TransportSession}. Invoked on the transport's
 * I/O thread; implementations must not block.
 */
public interface TransportListener {

    void onMessage(String frame);

    /**
     * The socket has closed. Called at most once per session.
     *
     * @param cause the error that closed it, or {@code null} for a clean close
     */
    void onClose(@Nullable Throwable cause);
}
