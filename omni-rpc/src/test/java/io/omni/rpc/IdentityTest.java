// SPDX-License-Identifier: MIT OR Apache-2.0
package io.omni.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class IdentityTest {

    @Test
    void generatedClientIdHasWalletFormat() {
        String clientId = Identity.generateClientId();

        assertTrue(clientId.matches("omni_[0-9a-z]+_[0-9a-f]{16}"), clientId);
    }

    @Test
    void generatedClientIdsDiffer() {
        assertNotEquals(Identity.generateClientId(), Identity.generateClientId());
    }

    @Test
    void defaultsProtocolVersion() {
        assertEquals("1.0.0", new Identity("omni_c", "s", null).protocolVersion());
        assertEquals("1.0.0", Identity.generate("s").protocolVersion());
    }

    @Test
    void toStringHidesSecret() {
        Identity identity = new Identity("omni_c", "omnibazaar-wallet-v1", "1.0.0");

        assertFalse(identity.toString().contains("omnibazaar-wallet-v1"));
        assertTrue(identity.toString().contains("omni_c"));
    }

    @Test
    void rejectsBlankValues() {
        assertThrows(IllegalArgumentException.class, () -> new Identity(" ", "s", "1.0.0"));
        assertThrows(IllegalArgumentException.class, () -> new Identity("omni_c", "", "1.0.0"));
        assertThrows(NullPointerException.class, () -> new Identity("omni_c", null, "1.0.0"));
    }
}
