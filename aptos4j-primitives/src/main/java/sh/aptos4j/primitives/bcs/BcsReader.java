// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.primitives.bcs;

/**
 * Reads one value of type {@code T} from a {@link Deserializer}.
 *
 * <p>Readers must not throw on malformed input; they record the problem with
 * {@link Deserializer#setError(String)} and return whatever partial value they have (usually
 * {@code null}).
 *
 * @param <T> the decoded type
 * @since 0.1.0
 */
@FunctionalInterface
public interface BcsReader<T> {

    T read(Deserializer deserializer);
}
