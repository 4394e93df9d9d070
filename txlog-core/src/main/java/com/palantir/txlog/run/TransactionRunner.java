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

package com.palantir.txlog.run;

import com.google.common.annotations.VisibleForTesting;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import com.palantir.txlog.api.KeyValueStore;
import com.palantir.txlog.api.Transaction;
import com.palantir.txlog.api.TransactionFailedRetriableException;
import com.palantir.txlog.api.TransactionTask;
import com.palantir.txlog.config.TransactionLoggingConfig;
import com.palantir.txlog.log.TransactionLog;
import com.palantir.txlog.logging.LoggingTransaction;
import com.palantir.txlog.logging.SlowTransactionLogger;
import com.palantir.txlog.logging.TransactionLogSink;
import com.palantir.txlog.logging.TransactionOutcome;
import java.util.function.Supplier;

/**
 * Runs transaction tasks against a {@link KeyValueStore}, retrying them on retriable failures.
 * <p>
 * When logging is enabled, each task gets one {@link TransactionLog} covering all of its attempts. The log is
 * stopped and handed to the {@link TransactionLogSink} once the task commits or is abandoned.
 */
public final class TransactionRunner {
    private static final SafeLogger log = SafeLoggerFactory.get(TransactionRunner.class);

    private final KeyValueStore store;
    private final TransactionLoggingConfig config;
    private final TransactionLogSink sink;
    private final Supplier<TransactionLog> logFactory;

    @VisibleForTesting
    TransactionRunner(
            KeyValueStore store,
            TransactionLoggingConfig config,
            TransactionLogSink sink,
            Supplier<TransactionLog> logFactory) {
        this.store = store;
        this.config = config;
        this.sink = sink;
        this.logFactory = logFactory;
    }

    public static TransactionRunner create(KeyValueStore store, TransactionLoggingConfig config) {
        return create(store, config, SlowTransactionLogger.create(config));
    }

    public static TransactionRunner create(
            KeyValueStore store, TransactionLoggingConfig config, TransactionLogSink sink) {
        return new TransactionRunner(store, config, sink, TransactionLog::create);
    }

    public <T, E extends Exception> T runTaskWithRetry(TransactionTask<T, E> task) throws E {
        try (Transaction transaction = store.beginTransaction()) {
            if (!config.enabled()) {
                return runAttempts(transaction, task);
            }

            TransactionLog txLog = logFactory.get();
            LoggingTransaction loggingTransaction = LoggingTransaction.wrapAndStart(transaction, txLog);
            TransactionOutcome outcome = TransactionOutcome.FAILED;
            try {
                T result = runAttempts(loggingTransaction, task);
                outcome = TransactionOutcome.COMMITTED;
                return result;
            } finally {
                txLog.stop();
                publish(txLog, outcome);
            }
        }
    }

    private <T, E extends Exception> T runAttempts(Transaction transaction, TransactionTask<T, E> task) throws E {
        int failedAttempts = 0;
        while (true) {
            try {
                T result = task.execute(transaction);
                transaction.commit();
                return result;
            } catch (TransactionFailedRetriableException e) {
                failedAttempts++;
                if (config.retryLimit() > 0 && failedAttempts > config.retryLimit()) {
                    log.warn(
                            "Giving up on transaction {} after {} failed attempts",
                            SafeArg.of("transactionId", transaction.getId()),
                            SafeArg.of("failedAttempts", failedAttempts),
                            SafeArg.of("retryLimit", config.retryLimit()),
                            e);
                    throw e;
                }
                log.info(
                        "Retrying transaction {} after a retriable failure",
                        SafeArg.of("transactionId", transaction.getId()),
                        SafeArg.of("failedAttempts", failedAttempts),
                        e);
                transaction.onError(e);
            }
        }
    }

    private void publish(TransactionLog txLog, TransactionOutcome outcome) {
        try {
            sink.transactionFinished(txLog, outcome);
        } catch (RuntimeException e) {
            log.warn(
                    "Transaction log sink failed; the transaction outcome is unaffected",
                    SafeArg.of("transactionId", txLog.getTransactionId()),
                    SafeArg.of("outcome", outcome),
                    e);
        }
    }
}
