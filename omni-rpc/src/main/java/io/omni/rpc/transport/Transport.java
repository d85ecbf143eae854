// SPDX-License-Identifier: MIT OR Apache-2.0
package io.omni.rpc.transport;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Opens message-framed duplex sockets, one text frame per envelope.
 *
 * <p>
 * A transport may be shared by many connections; {@link #close()} releases
 * whatever the transport itself owns (threads, event loops) and must only be
 * called once no session is in use.
 */
public interface Transport extends AutoCloseable {

    /**
     * Opens a socket to {@code endpoint}.
     *
     * <p>
     * The returned future completes once the socket is ready for frames, or
     * fails if it cannot be opened. {@code listener} receives callbacks only
     * after the future has completed successfully.
     *
     * @param endpoint the {@code ws://} or {@code wss://} URI
     * @param listener receiver for inbound frames and the close signal
     */
    CompletableFuture<TransportSession> open(URI endpoint, TransportListener listener);

    @Override
    void close();
}
