// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.crypto;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import sh.aptos4j.primitives.bcs.Bcs;

class MultiEd25519Test {

    private static final byte[] MESSAGE = "legacy".getBytes(StandardCharsets.UTF_8);

    private final Ed25519PrivateKey a = Ed25519PrivateKey.generate();
    private final Ed25519PrivateKey b = Ed25519PrivateKey.generate();
    private final Ed25519PrivateKey c = Ed25519PrivateKey.generate();
    private final MultiEd25519PublicKey key =
            new MultiEd25519PublicKey(List.of(a.publicKey(), b.publicKey(), c.publicKey()), 2);

    @Test
    void twoOfThreeVerifies() {
        MultiEd25519Signature signature = MultiEd25519Signature.of(Map.of(0, a.sign(MESSAGE), 2, c.sign(MESSAGE)));
        assertTrue(key.verify(MESSAGE, signature));
    }

    @Test
    void oneOfThreeFails() {
        MultiEd25519Signature signature = MultiEd25519Signature.of(Map.of(1, b.sign(MESSAGE)));
        assertFalse(key.verify(MESSAGE, signature));
    }

    @Test
    void twoValidOfThreeSignaturesVerify() {
        byte[] other = "other".getBytes(StandardCharsets.UTF_8);
        MultiEd25519Signature signature = MultiEd25519Signature.of(
                Map.of(0, a.sign(MESSAGE), 1, b.sign(MESSAGE), 2, c.sign(other)));
        assertTrue(key.verify(MESSAGE, signature));
    }

    @Test
    void oneValidOfThreeSignaturesFails() {
        byte[] other = "other".getBytes(StandardCharsets.UTF_8);
        MultiEd25519Signature signature = MultiEd25519Signature.of(
                Map.of(0, a.sign(MESSAGE), 1, b.sign(other), 2, c.sign(other)));
        assertFalse(key.verify(MESSAGE, signature));
    }

    @Test
    void publicKeyBytesAreKeysThenThreshold() {
        byte[] bytes = key.toBytes();
        assertEquals(3 * 32 + 1, bytes.length);
        assertEquals(2, bytes[bytes.length - 1]);
        assertEquals(key, MultiEd25519PublicKey.fromBytes(bytes));
    }

    @Test
    void signatureUsesFixedFourByteBitmap() {
        MultiEd25519Signature signature = MultiEd25519Signature.of(Map.of(0, a.sign(MESSAGE), 1, b.sign(MESSAGE)));
        byte[] bytes = signature.toBytes();

        assertEquals(2 * 64 + 4, bytes.length);
        assertEquals((byte) 0xC0, bytes[128]);
        assertArrayEquals(new byte[] {(byte) 0xC0, 0, 0, 0}, signature.bitmap().toBytes());
        assertEquals(signature, MultiEd25519Signature.fromBytes(bytes));
        assertEquals(signature, Bcs.deserialize(signature.toBcs(), MultiEd25519Signature::deserialize));
    }

    @Test
    void authenticationKeyUsesSchemeOne() {
        byte[] material = key.toBytes();
        assertEquals(AuthenticationKey.fromBytesAndScheme(material, DeriveScheme.MULTI_ED25519),
                AuthenticationKey.fromPublicKey(key));
    }
}
