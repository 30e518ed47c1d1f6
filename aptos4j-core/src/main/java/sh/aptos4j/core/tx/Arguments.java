// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.aptos4j.core.tx;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import sh.aptos4j.primitives.bcs.Deserializer;
import sh.aptos4j.primitives.bcs.Serializer;

/**
 * Helpers for lists of pre-encoded argument blobs.
 */
final class Arguments {

    private Arguments() {
        // Utility class
    }

    static List<byte[]> copyOf(final List<byte[]> args) {
        Objects.requireNonNull(args, "args cannot be null");
        final List<byte[]> out = new ArrayList<>(args.size());
        for (byte[] arg : args) {
            Objects.requireNonNull(arg, "argument cannot be null");
            out.add(Arrays.copyOf(arg, arg.length));
        }
        return Collections.unmodifiableList(out);
    }

    static void write(final Serializer serializer, final List<byte[]> args) {
        serializer.sequence(args, Serializer::bytes);
    }

    static List<byte[]> read(final Deserializer deserializer) {
        return deserializer.sequence(Deserializer::bytes);
    }

    static boolean equal(final List<byte[]> a, final List<byte[]> b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (int i = 0; i < a.size(); i++) {
            if (!Arrays.equals(a.get(i), b.get(i))) {
                return false;
            }
        }
        return true;
    }

    static int hash(final List<byte[]> args) {
        int h = 1;
        for (byte[] arg : args) {
            h = 31 * h + Arrays.hashCode(arg);
        }
        return h;
    }
}
