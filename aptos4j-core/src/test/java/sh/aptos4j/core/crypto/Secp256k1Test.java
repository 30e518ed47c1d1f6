// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.crypto;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import sh.aptos4j.core.error.CryptoException;
import sh.aptos4j.primitives.Hex;
import sh.aptos4j.primitives.bcs.Bcs;

class Secp256k1Test {

    static final String PRIVATE_KEY = "0xd107155adf816a0a94c6db3c9489c13ad8a1eda7ada2e558ba3bfa47c020347e";
    static final String PUBLIC_KEY = "0x04acdd16651b839c24665b7e2033b55225f384554949fef46c397b5275f37f6ee9"
            + "5554d70fb5d9f93c5831ebf695c7206e7477ce708f03ae9bb2862dc6c9e033ea";
    static final String SINGLE_KEY_AUTH_KEY = "0x5792c985bc96f436270bd2a3c692210b09c7febb8889345ceefdbae4bacfe498";
    static final String SIGNATURE = "0xd0d634e843b61339473b028105930ace022980708b2855954b977da09df84a77"
            + "0c0b68c29c8ca1b5409a5085b0ec263be80e433c83fcf6debb82f3447e71edca";
    static final byte[] MESSAGE = "hello world".getBytes(StandardCharsets.UTF_8);

    private static final BigInteger HALF_ORDER = new BigInteger(
            "7fffffffffffffffffffffffffffffff5d576e7357a4501ddfe92f46681b20a0", 16);

    @Test
    @DisplayName("known key derives the known public key and SingleKey auth key")
    void knownVector() {
        Secp256k1PrivateKey key = Secp256k1PrivateKey.fromAip80("secp256k1-priv-" + PRIVATE_KEY);

        assertEquals(PUBLIC_KEY, Hex.encode(key.publicKey().toBytes()));
        assertEquals(SINGLE_KEY_AUTH_KEY, AuthenticationKey.fromPublicKey(AnyPublicKey.of(key.publicKey())).toString());
    }

    @Test
    @DisplayName("RFC 6979 signature over SHA3-256 matches the known vector")
    void deterministicSignature() {
        Secp256k1PrivateKey key = Secp256k1PrivateKey.fromBytes(Hex.decode(PRIVATE_KEY));
        Secp256k1Signature signature = key.sign(MESSAGE);

        assertEquals(SIGNATURE, Hex.encode(signature.toBytes()));
        assertArrayEquals(signature.toBytes(), key.sign(MESSAGE).toBytes());
        assertTrue(key.publicKey().verify(MESSAGE, signature));
        assertFalse(key.publicKey().verify("other".getBytes(StandardCharsets.UTF_8), signature));
    }

    @Test
    void signaturesAreLowS() {
        Secp256k1PrivateKey key = Secp256k1PrivateKey.generate();
        for (int i = 0; i < 16; i++) {
            byte[] sig = key.sign(("message " + i).getBytes(StandardCharsets.UTF_8)).toBytes();
            BigInteger s = new BigInteger(1, java.util.Arrays.copyOfRange(sig, 32, 64));
            assertTrue(s.compareTo(HALF_ORDER) <= 0);
        }
    }

    @Test
    @DisplayName("high-S signatures are rejected at construction")
    void rejectsHighS() {
        byte[] sig = Hex.decode(SIGNATURE);
        BigInteger n = HALF_ORDER.shiftLeft(1).add(BigInteger.ONE);
        BigInteger s = new BigInteger(1, java.util.Arrays.copyOfRange(sig, 32, 64));
        byte[] highS = n.subtract(s).toByteArray();
        byte[] flipped = sig.clone();
        System.arraycopy(highS, highS.length - 32, flipped, 32, 32);

        assertThrows(CryptoException.class, () -> new Secp256k1Signature(flipped));
    }

    @Test
    void publicKeyMustBeUncompressed() {
        byte[] compressed = new byte[65];
        compressed[0] = 0x02;
        assertThrows(CryptoException.class, () -> new Secp256k1PublicKey(compressed));
        assertThrows(CryptoException.class, () -> new Secp256k1PublicKey(new byte[33]));
    }

    @Test
    @DisplayName("AnyPublicKey BCS is variant 1, length 65, then the key")
    void anyPublicKeyBcs() {
        AnyPublicKey key = AnyPublicKey.of(Secp256k1PublicKey.fromHex(PUBLIC_KEY));
        byte[] encoded = key.toBcs();

        assertEquals(1, encoded[0]);
        assertEquals(65, encoded[1]);
        assertEquals(67, encoded.length);
        assertEquals(key, Bcs.deserialize(encoded, AnyPublicKey::deserialize));
    }

    @Test
    void aip80RoundTrip() {
        Secp256k1PrivateKey key = Secp256k1PrivateKey.fromBytes(Hex.decode(PRIVATE_KEY));
        assertEquals("secp256k1-priv-" + PRIVATE_KEY, key.toAip80());
    }
}
