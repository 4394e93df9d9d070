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

import static com.palantir.logsafe.testing.Assertions.assertThatLoggableExceptionThrownBy;
import static org.assertj.core.api.Assertions.assertThat;

import com.palantir.logsafe.SafeArg;
import org.junit.jupiter.api.Test;

public class TransactionConflictExceptionTest {
    @Test
    public void conflictsCanBeRetried() {
        assertThat(new TransactionConflictException(1).canTransactionBeRetried()).isTrue();
        assertThat(new TransactionFailedNonRetriableException("broken").canTransactionBeRetried())
                .isFalse();
    }

    @Test
    public void conflictsCarryTheirTransactionIdAsSafeArg() {
        assertThatLoggableExceptionThrownBy(() -> {
                    throw new TransactionConflictException(12);
                })
                .hasLogMessage("Transaction was not committed because it conflicts with another transaction")
                .hasExactlyArgs(SafeArg.of("transactionId", 12L));
    }
}
