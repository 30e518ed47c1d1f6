// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.crypto;

import sh.aptos4j.primitives.bcs.BcsSerializable;

/**
 * A signature produced by one of the supported schemes.
 *
 * @since 0.1.0
 */
public interface Signature extends BcsSerializable {

    /** @return a fresh copy of the signature bytes */
    byte[] toBytes();
}
