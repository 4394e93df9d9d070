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

package com.palantir.txlog.logging;

import com.google.common.annotations.VisibleForTesting;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.UnsafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import com.palantir.txlog.config.TransactionLoggingConfig;
import com.palantir.txlog.log.TransactionLog;
import java.time.Duration;

/**
 * Logs the timing report of transactions that were slow, needed more than one attempt, or failed. Every other
 * transaction only gets a one-line summary at DEBUG.
 * <p>
 * Reports are always logged as unsafe, since command descriptions contain keys and values.
 */
public final class SlowTransactionLogger implements TransactionLogSink {
    private static final SafeLogger log = SafeLoggerFactory.get(SlowTransactionLogger.class);

    private final SafeLogger logger;
    private final Duration slowThreshold;
    private final boolean showCommands;

    @VisibleForTesting
    SlowTransactionLogger(SafeLogger logger, Duration slowThreshold, boolean showCommands) {
        this.logger = logger;
        this.slowThreshold = slowThreshold;
        this.showCommands = showCommands;
    }

    public static SlowTransactionLogger create(TransactionLoggingConfig config) {
        return new SlowTransactionLogger(log, config.slowTransactionThreshold(), config.showCommands());
    }

    @Override
    public void transactionFinished(TransactionLog txLog, TransactionOutcome outcome) {
        Duration duration = txLog.getTotalDuration();
        if (outcome == TransactionOutcome.FAILED) {
            logger.warn(
                    "Transaction {} failed after {} commit attempt(s) and {}",
                    SafeArg.of("transactionId", txLog.getTransactionId()),
                    SafeArg.of("attempts", txLog.getAttempts()),
                    SafeArg.of("duration", duration),
                    UnsafeArg.of("timings", txLog.getTimingsReport(showCommands)));
        } else if (duration.compareTo(slowThreshold) >= 0 || txLog.getAttempts() > 1 || txLog.getRetries() > 0) {
            logger.info(
                    "Transaction {} committed after {} commit attempt(s) and {}, which is slower than expected",
                    SafeArg.of("transactionId", txLog.getTransactionId()),
                    SafeArg.of("attempts", txLog.getAttempts()),
                    SafeArg.of("duration", duration),
                    UnsafeArg.of("timings", txLog.getTimingsReport(showCommands)));
        } else if (logger.isDebugEnabled()) {
            logger.debug(
                    "Transaction {} committed in {}",
                    SafeArg.of("transactionId", txLog.getTransactionId()),
                    SafeArg.of("duration", duration),
                    SafeArg.of("operations", txLog.getOperations()),
                    SafeArg.of("commitSize", txLog.getCommitSize()));
        }
    }
}
