// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.crypto;

/**
 * Scheme byte appended before hashing when deriving an authentication key or an address.
 *
 * @since 0.1.0
 */
public enum DeriveScheme {
    ED25519(0x00),
    MULTI_ED25519(0x01),
    SINGLE_KEY(0x02),
    MULTI_KEY(0x03),
    OBJECT_FROM_OBJECT(0xFC),
    OBJECT_FROM_GUID(0xFD),
    OBJECT_FROM_SEED(0xFE),
    RESOURCE_ACCOUNT(0xFF);

    private final byte value;

    DeriveScheme(final int value) {
        this.value = (byte) value;
    }

    public byte value() {
        return value;
    }
}
