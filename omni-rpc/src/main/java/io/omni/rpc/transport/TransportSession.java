// SPDX-License-Identifier: MIT OR Apache-2.0
package io.omni.rpc.transport;

import java.util.concurrent.CompletableFuture;

/**
 * One open socket.
 */
public interface TransportSession {

    /**
     * Writes one text frame. Frames are written in the order this method is
     * called.
     *
     * @return completes when the frame is written, fails if it could not be
     */
    CompletableFuture<Void> send(String frame);

    /**
     * Closes the socket. The listener's {@code onClose} still fires.
     */
    void close();

    boolean isOpen();
}
