// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.primitives.bcs;

/**
 * Writes one value of type {@code T} to a {@link Serializer}. Used for sequences and options
 * whose elements are not themselves {@link BcsSerializable}.
 *
 * @param <T> the encoded type
 * @since 0.1.0
 */
@FunctionalInterface
public interface BcsWriter<T> {

    void write(Serializer serializer, T value);
}
