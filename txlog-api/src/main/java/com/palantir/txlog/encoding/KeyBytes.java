/*
 * (c) Copyright 2026 Palantir Technologies Inc. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.palantir.txlog.encoding;

import com.google.common.collect.Ordering;
import com.google.common.io.BaseEncoding;
import com.google.common.primitives.UnsignedBytes;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import javax.annotation.Nullable;

public final class KeyBytes {
    private KeyBytes() {}

    public static final byte[] EMPTY_BYTE_ARRAY = new byte[0];
    public static final Ordering<byte[]> BYTES_COMPARATOR = Ordering.from(UnsignedBytes.lexicographicalComparator());

    /**
     * Keys longer than this are truncated by {@link #prettyPrint(byte[])}.
     */
    public static final int MAX_PRINTED_BYTES = 64;

    private static final byte MAX_BYTE = (byte) 0xFF;

    /**
     * Converts a string to a UTF-8 byte array.
     */
    public static byte[] toBytes(String str) {
        return str.getBytes(StandardCharsets.UTF_8);
    }

    public static String toString(@Nullable byte[] arr) {
        if (arr == null) {
            return null;
        }
        return new String(arr, StandardCharsets.UTF_8);
    }

    /**
     * Returns the first key that does not start with {@code prefix}: trailing 0xFF bytes are removed and the last
     * remaining byte is incremented.
     */
    public static byte[] increment(byte[] prefix) {
        int lastIndex = prefix.length - 1;
        while (lastIndex >= 0 && prefix[lastIndex] == MAX_BYTE) {
            lastIndex--;
        }
        Preconditions.checkArgument(
                lastIndex >= 0,
                "Key must contain at least one byte not equal to 0xFF",
                SafeArg.of("length", prefix.length));
        byte[] result = Arrays.copyOf(prefix, lastIndex + 1);
        result[lastIndex]++;
        return result;
    }

    /**
     * Human readable rendering of a key for diagnostics. Printable ASCII is kept as is and every other byte is
     * written as {@code <XX>}; the whole key is quoted. Keys longer than {@link #MAX_PRINTED_BYTES} are cut and
     * suffixed with {@code [...]}.
     */
    public static String prettyPrint(@Nullable byte[] key) {
        if (key == null) {
            return "<null>";
        }
        if (key.length == 0) {
            return "''";
        }
        int printed = Math.min(key.length, MAX_PRINTED_BYTES);
        StringBuilder sb = new StringBuilder(printed + 8).append('\'');
        for (int i = 0; i < printed; i++) {
            int b = key[i] & 0xFF;
            if (b >= 0x20 && b < 0x7F && b != '<' && b != '>' && b != '\'') {
                sb.append((char) b);
            } else {
                sb.append('<').append(BaseEncoding.base16().encode(key, i, 1)).append('>');
            }
        }
        sb.append('\'');
        if (printed < key.length) {
            sb.append("[...]");
        }
        return sb.toString();
    }
}
