// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.crypto;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import sh.aptos4j.core.error.CryptoException;
import sh.aptos4j.primitives.Hex;
import sh.aptos4j.primitives.bcs.Bcs;
import sh.aptos4j.primitives.bcs.BcsException;

class Ed25519Test {

    static final String PRIVATE_KEY = "0xc5338cd251c22daa8c9c9cc94f498cc8a5c7e1d2e75287a5dda91096fe64efa5";
    static final String AIP80 = "ed25519-priv-" + PRIVATE_KEY;
    static final String PUBLIC_KEY = "0xde19e5d1880cac87d57484ce9ed2e84cf0f9599f12e7cc3a52e4e7657a763f2c";
    static final String AUTH_KEY = "0x978c213990c4833df71548df7ce49d54c759d6b6d932de22b24d56060b7af2aa";
    static final String SIGNATURE = "0x9e653d56a09247570bb174a389e85b9226abd5c403ea6c504b386626a145158c"
            + "d4efd66fc5e071c0e19538a96a05ddbda24d3c51e1e6a9dacc6bb1ce775cce07";
    static final byte[] MESSAGE = "hello world".getBytes(StandardCharsets.UTF_8);

    @Test
    @DisplayName("known key derives the known public key and auth key")
    void knownVector() {
        Ed25519PrivateKey key = Ed25519PrivateKey.fromAip80(AIP80);

        assertEquals(PUBLIC_KEY, Hex.encode(key.publicKey().toBytes()));
        assertEquals(AUTH_KEY, AuthenticationKey.fromPublicKey(key.publicKey()).toString());
        assertEquals(AIP80, key.toAip80());
        assertArrayEquals(Hex.decode(PRIVATE_KEY), key.toBytes());
    }

    @Test
    @DisplayName("RFC 8032 signatures are deterministic and verify")
    void signAndVerify() {
        Ed25519PrivateKey key = Ed25519PrivateKey.fromAip80(AIP80);
        Ed25519Signature signature = key.sign(MESSAGE);

        assertEquals(SIGNATURE, Hex.encode(signature.toBytes()));
        assertTrue(key.publicKey().verify(MESSAGE, signature));
        assertFalse(key.publicKey().verify("hello world!".getBytes(StandardCharsets.UTF_8), signature));
    }

    @Test
    void verifyRejectsOtherSignatureTypes() {
        Ed25519PrivateKey key = Ed25519PrivateKey.generate();
        assertFalse(key.publicKey().verify(MESSAGE, Secp256k1Signature.zero()));
        assertFalse(key.publicKey().verify(MESSAGE, Ed25519Signature.zero()));
    }

    @Test
    void wrongLengthsFailConstruction() {
        assertThrows(CryptoException.class, () -> new Ed25519PublicKey(new byte[31]));
        assertThrows(CryptoException.class, () -> new Ed25519Signature(new byte[63]));
        assertThrows(CryptoException.class, () -> Ed25519PrivateKey.fromBytes(new byte[33]));
    }

    @Test
    @DisplayName("BCS public key is length-prefixed and decoding checks the length")
    void publicKeyBcs() {
        Ed25519PublicKey key = Ed25519PublicKey.fromHex(PUBLIC_KEY);
        byte[] encoded = key.toBcs();

        assertEquals(33, encoded.length);
        assertEquals(32, encoded[0]);
        assertEquals(key, Bcs.deserialize(encoded, Ed25519PublicKey::deserialize));
        assertThrows(BcsException.class, () -> Bcs.deserialize(Hex.decode("0200ff"), Ed25519PublicKey::deserialize));
    }

    @Test
    void destroyedKeyRefusesToSign() {
        Ed25519PrivateKey key = Ed25519PrivateKey.generate();
        key.destroy();

        assertTrue(key.isDestroyed());
        assertThrows(IllegalStateException.class, () -> key.sign(MESSAGE));
        assertThrows(IllegalStateException.class, key::toBytes);
        assertEquals("Ed25519PrivateKey[destroyed]", key.toString());
    }

    @Test
    void toStringHidesKeyMaterial() {
        Ed25519PrivateKey key = Ed25519PrivateKey.fromAip80(AIP80);
        assertFalse(key.toString().contains(PRIVATE_KEY.substring(2)));
    }
}
