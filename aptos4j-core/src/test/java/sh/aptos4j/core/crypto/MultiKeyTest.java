// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.crypto;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import sh.aptos4j.core.error.BitmapException;
import sh.aptos4j.core.error.CryptoException;
import sh.aptos4j.primitives.Hex;
import sh.aptos4j.primitives.bcs.Bcs;

class MultiKeyTest {

    private static final String SIGNATURE_FIXTURE = "020140118d6ebe543aaf3a541453f98a5748ab5b9e3f96d781b8c0a43740af2b65c0"
            + "3529fdf62b7de7aad9150770e0994dc4e0714795fdebf312be66cd0550c607755e00401a90421453aa53fa5a7aa3dfe7"
            + "0d913823cbf087bf372a762219ccc824d3a0eeecccaa9d34f22db4366aec61fb6c204d2440f4ed288bc7cc7e407b7667"
            + "23a60901c0";

    private static final byte[] MESSAGE = "multikey".getBytes(StandardCharsets.UTF_8);

    private Ed25519PrivateKey key0;
    private Secp256k1PrivateKey key1;
    private Ed25519PrivateKey key2;
    private MultiKey multiKey;

    @BeforeEach
    void setUp() {
        key0 = Ed25519PrivateKey.generate();
        key1 = Secp256k1PrivateKey.generate();
        key2 = Ed25519PrivateKey.generate();
        multiKey = new MultiKey(List.of(
                AnyPublicKey.of(key0.publicKey()),
                AnyPublicKey.of(key1.publicKey()),
                AnyPublicKey.of(key2.publicKey())), 2);
    }

    private static AnySignature any(final SingleKeySignature signature) {
        return new AnySignature(signature);
    }

    @Test
    @DisplayName("signature fixture decodes and re-encodes byte for byte")
    void fixtureRoundTrip() {
        byte[] bytes = Hex.decode(SIGNATURE_FIXTURE);
        MultiKeySignature signature = Bcs.deserialize(bytes, MultiKeySignature::deserialize);

        assertEquals(2, signature.signatures().size());
        assertEquals(AnySignature.SECP256K1, signature.signatures().get(0).variant());
        assertEquals(AnySignature.ED25519, signature.signatures().get(1).variant());
        assertArrayEquals(new int[] {0, 1}, signature.bitmap().indices());
        assertEquals(SIGNATURE_FIXTURE, Hex.encodeNoPrefix(signature.toBcs()));
    }

    @Nested
    @DisplayName("threshold verification")
    class Threshold {

        @Test
        void thresholdSignaturesVerify() {
            MultiKeySignature signature = MultiKeySignature.of(Map.of(
                    0, any(key0.sign(MESSAGE)),
                    2, any(key2.sign(MESSAGE))));
            assertTrue(multiKey.verify(MESSAGE, signature));
        }

        @Test
        void mixedKeyTypesVerify() {
            MultiKeySignature signature = MultiKeySignature.of(Map.of(
                    1, any(key1.sign(MESSAGE)),
                    2, any(key2.sign(MESSAGE))));
            assertTrue(multiKey.verify(MESSAGE, signature));
        }

        @Test
        void belowThresholdFails() {
            MultiKeySignature signature = MultiKeySignature.of(Map.of(0, any(key0.sign(MESSAGE))));
            assertFalse(multiKey.verify(MESSAGE, signature));
        }

        @Test
        @DisplayName("a bad extra signature is tolerated once the threshold verifies")
        void thresholdReachedDespiteBadSignature() {
            byte[] other = "other".getBytes(StandardCharsets.UTF_8);
            MultiKeySignature signature = MultiKeySignature.of(Map.of(
                    0, any(key0.sign(MESSAGE)),
                    1, any(key1.sign(MESSAGE)),
                    2, any(key2.sign(other))));
            assertTrue(multiKey.verify(MESSAGE, signature));
        }

        @Test
        void badSignaturesBelowThresholdFail() {
            MultiKeySignature signature = MultiKeySignature.of(Map.of(
                    0, any(key0.sign(MESSAGE)),
                    1, any(Secp256k1Signature.zero()),
                    2, any(Ed25519Signature.zero())));
            assertFalse(multiKey.verify(MESSAGE, signature));
        }

        @Test
        void signatureAtWrongIndexFails() {
            MultiKeySignature signature = MultiKeySignature.of(Map.of(
                    0, any(key2.sign(MESSAGE)),
                    2, any(key0.sign(MESSAGE))));
            assertFalse(multiKey.verify(MESSAGE, signature));
        }

        @Test
        void indexBeyondKeyCountFails() {
            MultiKeySignature signature = MultiKeySignature.of(Map.of(
                    0, any(key0.sign(MESSAGE)),
                    5, any(key2.sign(MESSAGE))));
            assertFalse(multiKey.verify(MESSAGE, signature));
        }
    }

    @Nested
    class Bitmaps {

        @Test
        @DisplayName("bit i is the i-th most significant bit")
        void bitOrder() {
            assertArrayEquals(new byte[] {(byte) 0xC0}, MultiKeyBitmap.of(0, 1).toBytes());
            assertArrayEquals(new byte[] {0x00, 0x01}, MultiKeyBitmap.of(15).toBytes());
            assertArrayEquals(new byte[] {(byte) 0x80, 0, 0, 0}, MultiKeyBitmap.of(0).toFixedBytes());
        }

        @Test
        void rejectsDuplicatesAndOutOfRange() {
            assertThrows(BitmapException.class, () -> MultiKeyBitmap.of(1, 1));
            assertThrows(BitmapException.class, () -> MultiKeyBitmap.of(32));
            assertThrows(BitmapException.class, () -> MultiKeyBitmap.of(-1));
            assertThrows(BitmapException.class, () -> MultiKeyBitmap.fromBytes(new byte[5]));
        }

        @Test
        void countMustMatchSignatures() {
            assertThrows(BitmapException.class,
                    () -> new MultiKeySignature(List.of(any(Ed25519Signature.zero())), MultiKeyBitmap.of(0, 1)));
        }
    }

    @Test
    void constructionLimits() {
        List<AnyPublicKey> keys = List.of(AnyPublicKey.of(key0.publicKey()));
        assertThrows(CryptoException.class, () -> new MultiKey(keys, 0));
        assertThrows(CryptoException.class, () -> new MultiKey(keys, 2));
        assertThrows(CryptoException.class, () -> new MultiKey(List.of(), 1));
    }

    @Test
    void publicKeyBcsRoundTrip() {
        MultiKey decoded = Bcs.deserialize(multiKey.toBcs(), MultiKey::deserialize);
        assertEquals(multiKey, decoded);
        assertEquals(2, multiKey.toBcs()[multiKey.toBcs().length - 1]);
    }
}
