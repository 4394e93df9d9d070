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

public class TransactionFailedRetriableException extends TransactionFailedException {
    private static final long serialVersionUID = 1L;

    public TransactionFailedRetriableException(String message) {
        super(message);
    }

    public TransactionFailedRetriableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public final boolean canTransactionBeRetried() {
        return true;
    }
}
