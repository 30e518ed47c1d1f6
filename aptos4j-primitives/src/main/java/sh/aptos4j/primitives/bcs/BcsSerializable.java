// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.primitives.bcs;

/**
 * A value with a canonical BCS encoding.
 *
 * <p>Implementations pair this with a static {@code deserialize(Deserializer)} factory, which
 * can be passed around as a {@link BcsReader} method reference.
 *
 * @since 0.1.0
 */
public interface BcsSerializable {

    /**
     * Writes this value to {@code serializer}.
     *
     * @param serializer the destination
     */
    void serialize(Serializer serializer);

    /**
     * Returns the standalone BCS encoding of this value.
     *
     * @return freshly allocated bytes
     */
    default byte[] toBcs() {
        return Bcs.serialize(this);
    }
}
