// SPDX-License-Identifier: MIT OR Apache-2.0
package io.omni.rpc;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

import org.jspecify.annotations.Nullable;

import io.omni.core.error.RpcException;

/**
 * Correlation table from call id to the caller's pending future.
 *
 * <p>
 * Every completion path (response, error, timeout, bulk rejection) removes
 * the entry with an atomic {@link ConcurrentHashMap#remove} before touching
 * the future, so at most one path wins for any id and a future is never
 * completed twice. Once an entry is gone its id is free for reuse, and a late
 * response for it is silently discarded.
 *
 * <p><b>Thread Safety:</b> all methods may be called concurrently from caller
 * threads, the scheduler thread and the I/O thread.
 */
public final class PendingCallRegistry {

    /**
     * An outstanding call.
     *
     * @param id        the correlation id
     * @param method    the method name, for logging and metrics
     * @param createdAt ticker value at registration, in milliseconds
     * @param deadline  ticker value at or after which the call times out
     * @param future    the caller's handle
     */
    public record PendingCall(
            String id, String method, long createdAt, long deadline, CompletableFuture<Object> future) {}

    private final ConcurrentHashMap<String, PendingCall> calls = new ConcurrentHashMap<>();
    private final LongSupplier ticker;

    /**
     * Creates a registry using the monotonic {@link System#nanoTime()} clock,
     * in milliseconds.
     */
    public PendingCallRegistry() {
        this(() -> System.nanoTime() / 1_000_000L);
    }

    /**
     * @param ticker monotonic millisecond clock used for {@code createdAt}
     */
    public PendingCallRegistry(final LongSupplier ticker) {
        this.ticker = Objects.requireNonNull(ticker, "ticker");
    }

    /**
     * Returns the current ticker value in milliseconds.
     */
    public long now() {
        return ticker.getAsLong();
    }

    public CompletableFuture<Object> register(final String id, final long deadline) {
        return register(id, "unknown", deadline);
    }

    /**
     * Registers a new pending call.
     *
     * @param id       correlation id
     * @param method   method name
     * @param deadline ticker value at which the call expires
     * @return the future completed with the call's outcome
     * @throws RpcException of kind {@link RpcException.Kind#DUPLICATE_ID} if
     *                      {@code id} is already outstanding
     */
    public CompletableFuture<Object> register(final String id, final String method, final long deadline) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(method, "method");
        final PendingCall call = new PendingCall(id, method, ticker.getAsLong(), deadline, new CompletableFuture<>());
        if (calls.putIfAbsent(id, call) != null) {
            throw new RpcException(RpcException.Kind.DUPLICATE_ID, "Call id already outstanding", id);
        }
        return call.future();
    }

    /**
     * Completes the call with {@code result}.
     *
     * @return {@code false} if no call with that id is pending
     */
    public boolean resolve(final String id, final @Nullable Object result) {
        final PendingCall call = take(id);
        if (call == null) {
            return false;
        }
        return call.future().complete(result);
    }

    /**
     * Fails the call with {@code error}.
     *
     * @return {@code false} if no call with that id is pending
     */
    public boolean reject(final String id, final Throwable error) {
        Objects.requireNonNull(error, "error");
        final PendingCall call = take(id);
        if (call == null) {
            return false;
        }
        return call.future().completeExceptionally(error);
    }

    /**
     * Fails and removes every pending call. Each call gets its own exception
     * carrying its id.
     *
     * @return the number of calls rejected
     */
    public int rejectAll(final RpcException.Kind kind, final String message) {
        int rejected = 0;
        for (String id : calls.keySet()) {
            if (reject(id, new RpcException(kind, message, id))) {
                rejected++;
            }
        }
        return rejected;
    }

    /**
     * Fails with {@link RpcException.Kind#TIMEOUT} every call whose deadline
     * is at or before {@code now}.
     *
     * @return the number of calls expired
     */
    public int expire(final long now) {
        int expired = 0;
        for (PendingCall call : calls.values()) {
            if (call.deadline() <= now && calls.remove(call.id(), call)) {
                call.future().completeExceptionally(new RpcException(
                        RpcException.Kind.TIMEOUT,
                        "Call " + call.method() + " timed out after " + (call.deadline() - call.createdAt()) + " ms",
                        call.id()));
                expired++;
            }
        }
        return expired;
    }

    /**
     * Removes and returns the pending call with {@code id}, leaving its future
     * for the caller to complete.
     */
    @Nullable PendingCall take(final String id) {
        return calls.remove(id);
    }

    public boolean contains(final String id) {
        return calls.containsKey(id);
    }

    public int size() {
        return calls.size();
    }
}
