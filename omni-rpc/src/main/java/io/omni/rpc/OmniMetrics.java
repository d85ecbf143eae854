// SPDX-License-Identifier: MIT OR Apache-2.0
package io.omni.rpc;

import java.net.URI;
import java.time.Duration;

/**
 * Interface for collecting metrics from the Omni client.
 *
 * <p>
 * Implementations can bridge to Micrometer, Prometheus or any custom
 * monitoring. By default a no-op implementation is used ({@link #noop()}).
 *
 * <pre>{@code
 * ClientConfig config = ClientConfig.builder()
 *         .endpoints(List.of(URI.create("wss://validator1.example:8546")))
 *         .identity(identity)
 *         .metrics(new MyMicrometerMetrics(meterRegistry))
 *         .build();
 * }</pre>
 *
 * <p>
 * <strong>Thread Safety:</strong> implementations must be thread-safe; methods
 * are called from caller threads, the scheduler thread and the I/O thread.
 */
public interface OmniMetrics {

    /**
     * Called when a call is registered and about to be sent.
     *
     * @param method the method name (e.g., "eth_getBalance")
     */
    default void onRequestStarted(String method) {
    }

    /**
     * Called when a call completes successfully.
     *
     * @param method  the method name
     * @param latency time from registration to result
     */
    default void onRequestCompleted(String method, Duration latency) {
    }

    /**
     * Called when a call fails for any reason other than a timeout.
     *
     * @param method the method name
     * @param error  the failure
     */
    default void onRequestFailed(String method, Throwable error) {
    }

    /**
     * Called when a call reaches its deadline without a response.
     *
     * @param method the method name
     */
    default void onRequestTimeout(String method) {
    }

    /**
     * Called when a socket to {@code endpoint} is open and ready.
     */
    default void onConnectionOpened(URI endpoint) {
    }

    /**
     * Called when the reconnect budget is exhausted and pending calls have
     * been failed.
     */
    default void onConnectionLost() {
    }

    /**
     * Called when a reconnect attempt is scheduled.
     *
     * @param attempt the attempt number, starting at 1
     * @param delay   the backoff delay before the attempt
     */
    default void onReconnectScheduled(int attempt, Duration delay) {
    }

    /**
     * Called when a response arrives for a call that is no longer pending
     * (timed out, rejected, or never sent by this client).
     *
     * @param callId the id carried by the response
     */
    default void onOrphanedResponse(String callId) {
    }

    /**
     * Called when an inbound frame is discarded because it is not a valid
     * response envelope.
     *
     * @param reason short description of what was wrong with the frame
     */
    default void onMalformedFrame(String reason) {
    }

    /**
     * Returns a no-op metrics implementation that does nothing.
     */
    static OmniMetrics noop() {
        return NoopMetrics.INSTANCE;
    }
}

/**
 * Internal no-op implementation of OmniMetrics.
 */
enum NoopMetrics implements OmniMetrics {
    INSTANCE
}
