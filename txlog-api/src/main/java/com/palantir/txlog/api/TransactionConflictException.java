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

import com.palantir.logsafe.Arg;
import com.palantir.logsafe.Safe;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.SafeLoggable;
import java.util.List;

/**
 * Thrown on commit when another transaction wrote to a key this transaction read.
 */
public class TransactionConflictException extends TransactionFailedRetriableException implements SafeLoggable {
    private static final long serialVersionUID = 1L;

    private static final String MESSAGE = "Transaction was not committed because it conflicts with another transaction";

    private final long transactionId;

    public TransactionConflictException(long transactionId) {
        super(MESSAGE);
        this.transactionId = transactionId;
    }

    public long getTransactionId() {
        return transactionId;
    }

    @Override
    @Safe
    public String getLogMessage() {
        return MESSAGE;
    }

    @Override
    public List<Arg<?>> getArgs() {
        return List.of(SafeArg.of("transactionId", transactionId));
    }
}
