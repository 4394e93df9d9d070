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

package com.palantir.txlog.log;

import com.google.common.collect.ImmutableList;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.logger.SafeLogger;
import com.palantir.logsafe.logger.SafeLoggerFactory;
import com.palantir.txlog.report.CommandListRenderer;
import com.palantir.txlog.report.TimelineRenderer;
import com.palantir.txlog.timing.TickClock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Records every command executed by one logical transaction, across all of its attempts.
 * <p>
 * Commands may be recorded concurrently from any number of threads. The step counter only moves when a command
 * ends, so commands that begin while others are still open share their step and show up as concurrent in reports,
 * while each completion produces a new step that is never reused.
 * <p>
 * Nothing in this class throws because of what the recorded operations did: failures are attached to the command
 * passed to {@link #end(OpenCommand, Throwable)}.
 */
@ThreadSafe
public final class TransactionLog {
    private static final SafeLogger log = SafeLoggerFactory.get(TransactionLog.class);

    private final TickClock clock;
    private final Queue<Command> commands = new ConcurrentLinkedQueue<>();

    private final AtomicInteger step = new AtomicInteger();
    private final AtomicInteger operations = new AtomicInteger();
    private final AtomicLong readSize = new AtomicLong();
    private final AtomicLong writeSize = new AtomicLong();
    private final AtomicLong commitSize = new AtomicLong();
    private final AtomicLong totalCommitSize = new AtomicLong();
    private final AtomicInteger attempts = new AtomicInteger();
    private final AtomicInteger retries = new AtomicInteger();

    private final AtomicReference<Timestamp> stopped = new AtomicReference<>();

    private volatile long transactionId;
    private volatile Timestamp started;

    private TransactionLog(TickClock clock) {
        this.clock = clock;
        this.started = Timestamp.now(clock);
    }

    public static TransactionLog create() {
        return create(TickClock.system());
    }

    public static TransactionLog create(TickClock clock) {
        return new TransactionLog(clock);
    }

    /**
     * Marks the start of the transaction. Offsets of every command are measured from this point.
     */
    public void start(long newTransactionId) {
        this.transactionId = newTransactionId;
        this.started = Timestamp.now(clock);
    }

    /**
     * Marks the end of the transaction. Only the first call has an effect.
     */
    public void stop() {
        Timestamp now = Timestamp.now(clock);
        if (!stopped.compareAndSet(null, now)) {
            log.debug("Transaction log was already stopped", SafeArg.of("transactionId", transactionId));
        }
    }

    /**
     * Records a command that completes instantly, such as an annotation or a read served from a local cache. Does not
     * move the step counter.
     */
    public void record(Command command) {
        record(command, true);
    }

    public void record(Command command, boolean countAsOperation) {
        Duration offset = currentOffset();
        command.stampInstant(offset, step.get(), Thread.currentThread().getId());
        if (countAsOperation) {
            operations.incrementAndGet();
        }
        countRetry(command);
        commands.add(command);
    }

    /**
     * Records the start of a command. The returned handle must be given back to {@link #end(OpenCommand)} by the
     * same operation once it completes.
     */
    public OpenCommand begin(Command command) {
        Duration offset = currentOffset();
        command.stampBegin(offset, step.get(), Thread.currentThread().getId());
        command.argumentBytes().ifPresent(writeSize::addAndGet);
        operations.incrementAndGet();
        countRetry(command);
        commands.add(command);
        return new OpenCommand(this, command);
    }

    public void end(OpenCommand handle) {
        end(handle, null);
    }

    /**
     * Records the completion of a command, successful if {@code error} is null.
     */
    public void end(OpenCommand handle, @Nullable Throwable error) {
        if (!handle.isOwnedBy(this)) {
            log.warn(
                    "Ignoring the end of a command that was begun by another transaction log",
                    SafeArg.of("transactionId", transactionId),
                    SafeArg.of("kind", handle.command().kind()));
            return;
        }
        if (!handle.markEnded()) {
            log.warn(
                    "Ignoring a command that was already ended",
                    SafeArg.of("transactionId", transactionId),
                    SafeArg.of("kind", handle.command().kind()));
            return;
        }
        Duration offset = currentOffset();
        int newStep = step.incrementAndGet();
        Command command = handle.command();
        command.stampEnd(offset, newStep, error);
        command.resultBytes().ifPresent(readSize::addAndGet);
    }

    /**
     * Called by the commit path after every commit attempt, whether or not it succeeded.
     *
     * @param attemptCommitSize bytes written by the attempt that was just committed
     */
    public void recordCommitAttempt(long attemptCommitSize) {
        commitSize.set(attemptCommitSize);
        totalCommitSize.addAndGet(attemptCommitSize);
        attempts.incrementAndGet();
    }

    public TransactionLogSnapshot snapshot() {
        Timestamp start = started;
        Optional<Timestamp> stop = Optional.ofNullable(stopped.get());
        Duration total = stop.map(timestamp -> clock.toDuration(timestamp.tick - start.tick))
                .orElseGet(() -> clock.elapsedSince(start.tick));
        return ImmutableTransactionLogSnapshot.builder()
                .transactionId(transactionId)
                .commands(ImmutableList.copyOf(commands))
                .startedAt(start.wallTime)
                .stoppedAt(stop.map(timestamp -> timestamp.wallTime))
                .totalDuration(total)
                .operations(operations.get())
                .readSize(readSize.get())
                .writeSize(writeSize.get())
                .commitSize(commitSize.get())
                .totalCommitSize(totalCommitSize.get())
                .attempts(attempts.get())
                .retries(retries.get())
                .build();
    }

    /**
     * Flat list of every command, followed by read/write statistics.
     */
    public String getCommandsReport() {
        return CommandListRenderer.render(snapshot());
    }

    /**
     * Waterfall chart of every command, scaled to the duration of the transaction.
     */
    public String getTimingsReport(boolean showCommands) {
        return TimelineRenderer.render(snapshot(), showCommands);
    }

    public long getTransactionId() {
        return transactionId;
    }

    public int getOperations() {
        return operations.get();
    }

    public int getStep() {
        return step.get();
    }

    public long getReadSize() {
        return readSize.get();
    }

    public long getWriteSize() {
        return writeSize.get();
    }

    /**
     * Bytes committed by the last commit attempt.
     */
    public long getCommitSize() {
        return commitSize.get();
    }

    /**
     * Bytes committed over every commit attempt, including the ones that were retried.
     */
    public long getTotalCommitSize() {
        return totalCommitSize.get();
    }

    public int getAttempts() {
        return attempts.get();
    }

    /**
     * Number of times the transaction was sent back to be retried, whether the failure came from the commit or from
     * a read or write before it. Every {@link CommandKind#ON_ERROR} command counts once.
     */
    public int getRetries() {
        return retries.get();
    }

    public boolean isCompleted() {
        return stopped.get() != null;
    }

    public Instant getStartedAt() {
        return started.wallTime;
    }

    public Optional<Instant> getStoppedAt() {
        return Optional.ofNullable(stopped.get()).map(timestamp -> timestamp.wallTime);
    }

    public Duration getTotalDuration() {
        Timestamp start = started;
        Timestamp stop = stopped.get();
        return stop == null ? clock.elapsedSince(start.tick) : clock.toDuration(stop.tick - start.tick);
    }

    private void countRetry(Command command) {
        if (command.kind() == CommandKind.ON_ERROR) {
            retries.incrementAndGet();
        }
    }

    private Duration currentOffset() {
        return clock.elapsedSince(started.tick);
    }

    private static final class Timestamp {
        private final long tick;
        private final Instant wallTime;

        private Timestamp(long tick, Instant wallTime) {
            this.tick = tick;
            this.wallTime = wallTime;
        }

        static Timestamp now(TickClock clock) {
            return new Timestamp(clock.now(), clock.wallTime());
        }
    }
}
