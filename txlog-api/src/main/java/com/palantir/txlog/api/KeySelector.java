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

import com.palantir.txlog.encoding.KeyBytes;
import org.immutables.value.Value;

/**
 * Identifies a key relative to a reference key: the selected key is the last key less than (or equal to, when
 * {@link #orEqual()}) the reference, shifted by {@link #offset()} positions.
 */
@Value.Immutable
public abstract class KeySelector {
    @Value.Parameter
    public abstract byte[] key();

    @Value.Parameter
    public abstract boolean orEqual();

    @Value.Parameter
    public abstract int offset();

    public static KeySelector of(byte[] key, boolean orEqual, int offset) {
        return ImmutableKeySelector.of(key, orEqual, offset);
    }

    public static KeySelector lastLessThan(byte[] key) {
        return of(key, false, 0);
    }

    public static KeySelector lastLessOrEqual(byte[] key) {
        return of(key, true, 0);
    }

    public static KeySelector firstGreaterThan(byte[] key) {
        return of(key, true, 1);
    }

    public static KeySelector firstGreaterOrEqual(byte[] key) {
        return of(key, false, 1);
    }

    /**
     * Compact form used in transaction logs, e.g. {@code fGE('foo')} or {@code lLT('foo')+2}.
     */
    public String describe() {
        String prefix;
        int remainder;
        if (offset() > 0) {
            prefix = orEqual() ? "fGT" : "fGE";
            remainder = offset() - 1;
        } else {
            prefix = orEqual() ? "lLE" : "lLT";
            remainder = offset();
        }
        String base = prefix + "(" + KeyBytes.prettyPrint(key()) + ")";
        if (remainder == 0) {
            return base;
        }
        return base + (remainder > 0 ? "+" : "") + remainder;
    }
}
