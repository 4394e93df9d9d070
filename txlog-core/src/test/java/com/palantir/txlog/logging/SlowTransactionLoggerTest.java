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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

import com.google.common.testing.FakeTicker;
import com.palantir.logsafe.Arg;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.UnsafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.txlog.api.TransactionConflictException;
import com.palantir.txlog.config.TransactionLoggingConfig;
import com.palantir.txlog.encoding.KeyBytes;
import com.palantir.txlog.log.Commands;
import com.palantir.txlog.log.OpenCommand;
import com.palantir.txlog.log.TransactionLog;
import com.palantir.txlog.timing.TickClock;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
public class SlowTransactionLoggerTest {
    private static final Duration SLOW_THRESHOLD = Duration.ofMillis(10);

    @Mock
    private SafeLogger logger;

    @Captor
    private ArgumentCaptor<Arg<?>> timingsCaptor;

    private final FakeTicker ticker = new FakeTicker();
    private TransactionLog log;
    private SlowTransactionLogger slowTransactionLogger;

    @BeforeEach
    public void setUp() {
        log = TransactionLog.create(TickClock.create(ticker, Clock.systemUTC()));
        log.start(5);
        slowTransactionLogger = new SlowTransactionLogger(logger, SLOW_THRESHOLD, true);
    }

    @Test
    public void fastTransactionsOnlyGetADebugSummary() {
        when(logger.isDebugEnabled()).thenReturn(true);
        runCommit(1);

        slowTransactionLogger.transactionFinished(log, TransactionOutcome.COMMITTED);

        verify(logger).isDebugEnabled();
        verify(logger)
                .debug(
                        eq("Transaction {} committed in {}"),
                        eq(SafeArg.of("transactionId", 5L)),
                        eq(SafeArg.of("duration", Duration.ofMillis(1))),
                        eq(SafeArg.of("operations", 1)),
                        eq(SafeArg.of("commitSize", 0L)));
        verifyNoMoreInteractions(logger);
    }

    @Test
    public void fastTransactionsAreSilentWithoutDebug() {
        when(logger.isDebugEnabled()).thenReturn(false);
        runCommit(1);

        slowTransactionLogger.transactionFinished(log, TransactionOutcome.COMMITTED);

        verify(logger).isDebugEnabled();
        verifyNoMoreInteractions(logger);
    }

    @Test
    public void slowTransactionsLogTheirTimings() {
        runCommit(25);

        slowTransactionLogger.transactionFinished(log, TransactionOutcome.COMMITTED);

        verify(logger)
                .info(
                        eq("Transaction {} committed after {} commit attempt(s) and {}, which is slower than expected"),
                        eq(SafeArg.of("transactionId", 5L)),
                        eq(SafeArg.of("attempts", 1)),
                        eq(SafeArg.of("duration", Duration.ofMillis(25))),
                        timingsCaptor.capture());
        assertTimingsAreUnsafeReport();
    }

    @Test
    public void retriedTransactionsLogTheirTimingsEvenWhenFast() {
        log.recordCommitAttempt(0);
        runCommit(1);

        slowTransactionLogger.transactionFinished(log, TransactionOutcome.COMMITTED);

        verify(logger)
                .info(
                        any(String.class),
                        eq(SafeArg.of("transactionId", 5L)),
                        eq(SafeArg.of("attempts", 2)),
                        any(Arg.class),
                        timingsCaptor.capture());
        assertTimingsAreUnsafeReport();
    }

    @Test
    public void transactionsRetriedBeforeCommittingLogTheirTimings() {
        OpenCommand read = log.begin(Commands.get(KeyBytes.toBytes("key")));
        log.end(read, new TransactionConflictException(5));
        OpenCommand onError = log.begin(Commands.onError(new TransactionConflictException(5)));
        log.end(onError);
        runCommit(1);

        slowTransactionLogger.transactionFinished(log, TransactionOutcome.COMMITTED);

        verify(logger)
                .info(
                        any(String.class),
                        eq(SafeArg.of("transactionId", 5L)),
                        eq(SafeArg.of("attempts", 1)),
                        any(Arg.class),
                        timingsCaptor.capture());
        assertThat((String) timingsCaptor.getValue().getValue()).contains("== Attempt #2 ==");
        verifyNoMoreInteractions(logger);
    }

    @Test
    public void failedTransactionsAreWarnedAbout() {
        runCommit(1);

        slowTransactionLogger.transactionFinished(log, TransactionOutcome.FAILED);

        verify(logger)
                .warn(
                        eq("Transaction {} failed after {} commit attempt(s) and {}"),
                        eq(SafeArg.of("transactionId", 5L)),
                        eq(SafeArg.of("attempts", 1)),
                        eq(SafeArg.of("duration", Duration.ofMillis(1))),
                        timingsCaptor.capture());
        assertTimingsAreUnsafeReport();
    }

    @Test
    public void createdFromConfig() {
        SlowTransactionLogger fromConfig = SlowTransactionLogger.create(TransactionLoggingConfig.defaultConfig());
        runCommit(1);

        assertThatCode(() -> fromConfig.transactionFinished(log, TransactionOutcome.FAILED))
                .doesNotThrowAnyException();
    }

    private void runCommit(long millis) {
        OpenCommand commit = log.begin(Commands.commit());
        ticker.advance(millis, TimeUnit.MILLISECONDS);
        log.recordCommitAttempt(0);
        log.end(commit);
        log.stop();
    }

    private void assertTimingsAreUnsafeReport() {
        Arg<?> timings = timingsCaptor.getValue();
        assertThat(timings).isInstanceOf(UnsafeArg.class);
        assertThat(timings.getName()).isEqualTo("timings");
        assertThat((String) timings.getValue()).startsWith("Transaction #5").contains("Commit()");
    }
}
