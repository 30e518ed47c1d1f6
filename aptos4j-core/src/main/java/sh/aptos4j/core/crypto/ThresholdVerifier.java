// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.crypto;

import java.util.List;

/**
 * Shared k-of-n check for MultiEd25519 and MultiKey.
 * <p>
 * Bitmap indices are visited in ascending order and matched positionally to the signatures.
 * The number of signatures must equal the number of set bits and every index must address an
 * existing key. Verification succeeds once at least {@code threshold} of the signatures verify.
 */
final class ThresholdVerifier {

    private ThresholdVerifier() {
    }

    static boolean verify(
            final byte[] message,
            final List<? extends PublicKey> keys,
            final int threshold,
            final List<? extends Signature> signatures,
            final MultiKeyBitmap bitmap) {
        if (message == null) {
            return false;
        }
        final int[] indices = bitmap.indices();
        if (indices.length != signatures.size() || signatures.size() < threshold) {
            return false;
        }
        for (int index : indices) {
            if (index >= keys.size()) {
                return false;
            }
        }
        int verified = 0;
        for (int i = 0; i < indices.length; i++) {
            if (keys.get(indices[i]).verify(message, signatures.get(i))) {
                verified++;
            }
        }
        return verified >= threshold;
    }
}
