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

package com.palantir.txlog.api;

import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import com.palantir.txlog.encoding.KeyBytes;
import org.immutables.value.Value;

/**
 * Half-open key interval {@code [begin, end)}.
 */
@Value.Immutable
public abstract class KeyRange {
    @Value.Parameter
    public abstract byte[] begin();

    @Value.Parameter
    public abstract byte[] end();

    public static KeyRange of(byte[] begin, byte[] end) {
        return ImmutableKeyRange.of(begin, end);
    }

    /**
     * All keys starting with {@code prefix}.
     */
    public static KeyRange startsWith(byte[] prefix) {
        if (prefix.length == 0) {
            return of(KeyBytes.EMPTY_BYTE_ARRAY, new byte[] {(byte) 0xFF});
        }
        return of(prefix, KeyBytes.increment(prefix));
    }

    public boolean contains(byte[] key) {
        return KeyBytes.BYTES_COMPARATOR.compare(begin(), key) <= 0 && KeyBytes.BYTES_COMPARATOR.compare(key, end()) < 0;
    }

    public int sizeInBytes() {
        return begin().length + end().length;
    }

    public String describe() {
        return "[" + KeyBytes.prettyPrint(begin()) + ", " + KeyBytes.prettyPrint(end()) + ")";
    }

    @Value.Check
    protected void check() {
        Preconditions.checkArgument(
                KeyBytes.BYTES_COMPARATOR.compare(begin(), end()) <= 0,
                "Range begin must not be after its end",
                SafeArg.of("beginLength", begin().length),
                SafeArg.of("endLength", end().length));
    }
}
