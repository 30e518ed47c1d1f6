// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.abi;

/**
 * Options for {@link ArgumentMarshaller}.
 *
 * @param compatibility when true, an {@code Option<T>} argument may also be given as a hex
 *                      string holding a BCS vector of zero or one {@code T}, the form other
 *                      Aptos SDKs emit for optional values
 * @since 0.1.0
 */
public record MarshalOptions(boolean compatibility) {

    private static final MarshalOptions DEFAULTS = new MarshalOptions(false);
    private static final MarshalOptions COMPATIBILITY = new MarshalOptions(true);

    public static MarshalOptions defaults() {
        return DEFAULTS;
    }

    public static MarshalOptions compatibilityMode() {
        return COMPATIBILITY;
    }
}
