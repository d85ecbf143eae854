// SPDX-License-Identifier: MIT OR Apache-2.0
package io.omni.rpc;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.jspecify.annotations.Nullable;

/**
 * A signed request as written to the socket, one per text frame.
 *
 * <pre>{@code
 * {"id":"3f9a...","method":"eth_getBalance","params":["0xabc","latest",1],
 *  "auth":{"clientId":"omni_...","signature":"5bdc...","timestamp":1718000000000,"version":"1.0.0"}}
 * }</pre>
 *
 * @param id     correlation id, unique among this client's outstanding calls
 * @param method the method name
 * @param params any JSON-serializable value, usually a list or a map
 * @param auth   the signature block
 */
@JsonPropertyOrder({"id", "method", "params", "auth"})
public record Envelope(String id, String method, @Nullable Object params, Auth auth) {

    public Envelope {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(auth, "auth");
    }

    /**
     * The {@code auth} block of an envelope.
     *
     * @param clientId  the signing client's id
     * @param signature hex HMAC-SHA256 signature
     * @param timestamp sender wall-clock time in milliseconds
     * @param version   protocol version
     */
    public record Auth(String clientId, String signature, long timestamp, String version) {}
}
