// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.crypto;

import java.math.BigInteger;

import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.crypto.params.ECPublicKeyParameters;
import org.bouncycastle.crypto.signers.ECDSASigner;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;

/**
 * Deterministic secp256k1 ECDSA over a 32-byte digest.
 * <p>
 * Nonces follow <a href="https://tools.ietf.org/html/rfc6979">RFC 6979</a> with HMAC-SHA256.
 * Signatures are normalized to low-S; verification rejects high-S.
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Thread-safe. The shared {@link FixedPointCombMultiplier} keeps no mutable state, and each
 * call creates its own {@link HMacDSAKCalculator}.
 */
final class EcdsaSigner {

    private static final X9ECParameters CURVE_PARAMS = CustomNamedCurves.getByName("secp256k1");
    static final ECDomainParameters CURVE = new ECDomainParameters(
            CURVE_PARAMS.getCurve(),
            CURVE_PARAMS.getG(),
            CURVE_PARAMS.getN(),
            CURVE_PARAMS.getH());
    static final BigInteger HALF_CURVE_ORDER = CURVE_PARAMS.getN().shiftRight(1);

    private static final FixedPointCombMultiplier MULTIPLIER = new FixedPointCombMultiplier();

    private EcdsaSigner() {
    }

    /**
     * Signs a digest.
     *
     * @param digest     32-byte message digest
     * @param privateKey the scalar
     * @return 64-byte {@code r || s} with low S
     */
    static byte[] sign(final byte[] digest, final BigInteger privateKey) {
        final HMacDSAKCalculator kCalculator = new HMacDSAKCalculator(new SHA256Digest());
        kCalculator.init(CURVE.getN(), privateKey, digest);

        final BigInteger n = CURVE.getN();
        final BigInteger z = new BigInteger(1, digest);
        while (true) {
            final BigInteger k = kCalculator.nextK();
            final ECPoint p = MULTIPLIER.multiply(CURVE.getG(), k).normalize();

            // r = x1 mod n
            final BigInteger r = p.getAffineXCoord().toBigInteger().mod(n);
            if (r.signum() == 0) {
                continue;
            }
            // s = k^-1 * (z + r * d) mod n
            BigInteger s = k.modInverse(n).multiply(z.add(r.multiply(privateKey))).mod(n);
            if (s.signum() == 0) {
                continue;
            }
            if (s.compareTo(HALF_CURVE_ORDER) > 0) {
                s = n.subtract(s);
            }
            final byte[] out = new byte[64];
            System.arraycopy(toBytes32(r), 0, out, 0, 32);
            System.arraycopy(toBytes32(s), 0, out, 32, 32);
            return out;
        }
    }

    /**
     * Verifies {@code r || s} against a digest and an uncompressed public key.
     *
     * @return false for high-S signatures, invalid points or a failed check
     */
    static boolean verify(final byte[] digest, final byte[] signature, final byte[] publicKey) {
        final BigInteger r = new BigInteger(1, java.util.Arrays.copyOfRange(signature, 0, 32));
        final BigInteger s = new BigInteger(1, java.util.Arrays.copyOfRange(signature, 32, 64));
        if (s.compareTo(HALF_CURVE_ORDER) > 0) {
            return false;
        }
        try {
            final ECPoint point = CURVE.getCurve().decodePoint(publicKey);
            final ECDSASigner verifier = new ECDSASigner();
            verifier.init(false, new ECPublicKeyParameters(point, CURVE));
            return verifier.verifySignature(digest, r, s);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /** @return the 65-byte uncompressed public key {@code 04 || X || Y} */
    static byte[] publicKey(final BigInteger privateKey) {
        return MULTIPLIER.multiply(CURVE.getG(), privateKey).normalize().getEncoded(false);
    }

    static byte[] toBytes32(final BigInteger value) {
        final byte[] bytes = value.toByteArray();
        final byte[] result = new byte[32];
        if (bytes.length == 32) {
            return bytes;
        } else if (bytes.length < 32) {
            System.arraycopy(bytes, 0, result, 32 - bytes.length, bytes.length);
        } else {
            // strip the sign byte
            System.arraycopy(bytes, bytes.length - 32, result, 0, 32);
        }
        return result;
    }
}
