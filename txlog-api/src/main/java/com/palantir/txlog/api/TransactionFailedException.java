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

/**
 * Base class of all failures raised by a {@link Transaction}.
 */
public abstract class TransactionFailedException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    protected TransactionFailedException(String message) {
        super(message);
    }

    protected TransactionFailedException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether running the transaction again may succeed.
     */
    public abstract boolean canTransactionBeRetried();
}
