// SPDX-License-Identifier: MIT OR Apache-2.0
package io.omni.rpc;

import java.net.URI;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Round-robin over an immutable, non-empty list of interchangeable validator
 * endpoints. {@code [A, B, C]} yields {@code A, B, C, A, ...}.
 */
public final class EndpointSelector {

    private final List<URI> endpoints;
    private final AtomicLong cursor = new AtomicLong();

    public EndpointSelector(final List<URI> endpoints) {
        Objects.requireNonNull(endpoints, "endpoints");
        if (endpoints.isEmpty()) {
            throw new IllegalArgumentException("At least one endpoint is required");
        }
        for (URI endpoint : endpoints) {
            validate(endpoint);
        }
        this.endpoints = List.copyOf(endpoints);
    }

    public static EndpointSelector of(final String... urls) {
        return new EndpointSelector(Arrays.stream(urls).map(URI::create).toList());
    }

    /**
     * Returns the next endpoint, wrapping after the last.
     */
    public URI next() {
        return endpoints.get((int) Math.floorMod(cursor.getAndIncrement(), (long) endpoints.size()));
    }

    public List<URI> endpoints() {
        return endpoints;
    }

    private static void validate(final URI endpoint) {
        Objects.requireNonNull(endpoint, "endpoint");
        final String scheme = endpoint.getScheme() == null ? "" : endpoint.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("ws") && !scheme.equals("wss")) {
            throw new IllegalArgumentException("Endpoint must use ws:// or wss://, got: " + endpoint);
        }
        if (endpoint.getHost() == null) {
            throw new IllegalArgumentException("Endpoint has no host: " + endpoint);
        }
    }
}
