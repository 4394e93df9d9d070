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

import static org.assertj.core.api.Assertions.assertThat;

import com.palantir.txlog.encoding.KeyBytes;
import org.junit.jupiter.api.Test;

public class KeySelectorTest {
    private static final byte[] KEY = KeyBytes.toBytes("k");

    @Test
    public void describesStandardSelectors() {
        assertThat(KeySelector.firstGreaterOrEqual(KEY).describe()).isEqualTo("fGE('k')");
        assertThat(KeySelector.firstGreaterThan(KEY).describe()).isEqualTo("fGT('k')");
        assertThat(KeySelector.lastLessThan(KEY).describe()).isEqualTo("lLT('k')");
        assertThat(KeySelector.lastLessOrEqual(KEY).describe()).isEqualTo("lLE('k')");
    }

    @Test
    public void describesExtraOffsets() {
        assertThat(KeySelector.of(KEY, false, 3).describe()).isEqualTo("fGE('k')+2");
        assertThat(KeySelector.of(KEY, true, -2).describe()).isEqualTo("lLE('k')-2");
        assertThat(KeySelector.of(KEY, false, -1).describe()).isEqualTo("lLT('k')-1");
    }

    @Test
    public void equalityUsesKeyContents() {
        assertThat(KeySelector.firstGreaterThan(KeyBytes.toBytes("k")))
                .isEqualTo(KeySelector.firstGreaterThan(KeyBytes.toBytes("k")))
                .isNotEqualTo(KeySelector.firstGreaterOrEqual(KeyBytes.toBytes("k")));
    }
}
