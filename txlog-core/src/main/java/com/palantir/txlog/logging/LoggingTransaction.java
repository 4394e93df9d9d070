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

import com.google.common.util.concurrent.ListenableFuture;
import com.palantir.txlog.api.ConflictRangeType;
import com.palantir.txlog.api.KeyRange;
import com.palantir.txlog.api.KeySelector;
import com.palantir.txlog.api.KeyValue;
import com.palantir.txlog.api.MutationType;
import com.palantir.txlog.api.Transaction;
import com.palantir.txlog.api.TransactionFailedException;
import com.palantir.txlog.encoding.KeyBytes;
import com.palantir.txlog.log.Command;
import com.palantir.txlog.log.Commands;
import com.palantir.txlog.log.OpenCommand;
import com.palantir.txlog.log.TransactionLog;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiConsumer;
import java.util.function.Supplier;

/**
 * Records every call made on a {@link Transaction} into a {@link TransactionLog}. Failures of the delegate are
 * attached to the recorded command and rethrown unchanged.
 * <p>
 * The same log is shared by every attempt of the transaction: {@link #onError(TransactionFailedException)} and
 * {@link #reset()} mark the start of a new attempt, and {@link #commit()} reports the bytes written by the current
 * attempt to the log, whether or not the commit succeeds.
 */
public final class LoggingTransaction implements Transaction {
    private final Transaction delegate;
    private final TransactionLog log;
    private final AtomicLong attemptWriteSize = new AtomicLong();

    private LoggingTransaction(Transaction delegate, TransactionLog log) {
        this.delegate = delegate;
        this.log = log;
    }

    /**
     * Wraps {@code delegate} and starts {@code log} with the delegate's id.
     */
    public static LoggingTransaction wrapAndStart(Transaction delegate, TransactionLog log) {
        log.start(delegate.getId());
        return new LoggingTransaction(delegate, log);
    }

    public TransactionLog getLog() {
        return log;
    }

    /**
     * Adds a free-form note to the log. Notes do not count as operations.
     */
    public void annotate(String message) {
        log.record(Commands.log(message), false);
    }

    @Override
    public long getId() {
        return delegate.getId();
    }

    @Override
    public Optional<byte[]> get(byte[] key) {
        return runLogged(Commands.get(key), () -> delegate.get(key), (handle, value) ->
                handle.setResult(Commands.describeValue(value), value.map(v -> v.length).orElse(0)));
    }

    @Override
    public byte[] getKey(KeySelector selector) {
        return runLogged(Commands.getKey(selector), () -> delegate.getKey(selector), (handle, key) ->
                handle.setResult(KeyBytes.prettyPrint(key), key.length));
    }

    @Override
    public List<Optional<byte[]>> getValues(List<byte[]> keys) {
        return runLogged(Commands.getValues(keys), () -> delegate.getValues(keys), (handle, values) ->
                handle.setResult(
                        Commands.describeList(values, Commands::describeValue),
                        values.stream()
                                .mapToInt(value -> value.map(v -> v.length).orElse(0))
                                .sum()));
    }

    @Override
    public List<byte[]> getKeys(List<KeySelector> selectors) {
        return runLogged(Commands.getKeys(selectors), () -> delegate.getKeys(selectors), (handle, keys) ->
                handle.setResult(
                        Commands.describeList(keys, KeyBytes::prettyPrint),
                        keys.stream().mapToInt(key -> key.length).sum()));
    }

    @Override
    public List<KeyValue> getRange(KeyRange range, int limit, boolean reverse) {
        return runLogged(
                Commands.getRange(range, limit, reverse),
                () -> delegate.getRange(range, limit, reverse),
                (handle, results) -> handle.setResult(
                        results.size() + " result(s)",
                        results.stream().mapToInt(KeyValue::sizeInBytes).sum()));
    }

    @Override
    public void set(byte[] key, byte[] value) {
        runLoggedWrite(Commands.set(key, value), () -> delegate.set(key, value));
    }

    @Override
    public void clear(byte[] key) {
        runLoggedWrite(Commands.clear(key), () -> delegate.clear(key));
    }

    @Override
    public void clearRange(KeyRange range) {
        runLoggedWrite(Commands.clearRange(range), () -> delegate.clearRange(range));
    }

    @Override
    public void atomic(byte[] key, byte[] param, MutationType mutation) {
        runLoggedWrite(Commands.atomic(key, param, mutation), () -> delegate.atomic(key, param, mutation));
    }

    @Override
    public void addConflictRange(KeyRange range, ConflictRangeType type) {
        runLogged(Commands.addConflictRange(range, type), () -> delegate.addConflictRange(range, type));
    }

    /**
     * Watches outlive the transaction that created them, so only their creation is recorded.
     */
    @Override
    public ListenableFuture<Void> watch(byte[] key) {
        log.record(Commands.watch(key));
        return delegate.watch(key);
    }

    @Override
    public long getReadVersion() {
        return runLogged(Commands.getReadVersion(), delegate::getReadVersion, (handle, version) ->
                handle.setResult(String.valueOf(version)));
    }

    @Override
    public void commit() {
        OpenCommand handle = log.begin(Commands.commit());
        try {
            delegate.commit();
        } catch (RuntimeException | Error e) {
            log.recordCommitAttempt(attemptWriteSize.get());
            log.end(handle, e);
            throw e;
        }
        log.recordCommitAttempt(attemptWriteSize.get());
        log.end(handle);
    }

    @Override
    public void onError(TransactionFailedException error) {
        runLogged(Commands.onError(error), () -> delegate.onError(error));
        attemptWriteSize.set(0);
    }

    @Override
    public void cancel() {
        runLogged(Commands.cancel(), delegate::cancel);
    }

    @Override
    public void reset() {
        runLogged(Commands.reset(), delegate::reset);
        attemptWriteSize.set(0);
    }

    @Override
    public void close() {
        delegate.close();
    }

    private void runLoggedWrite(Command command, Runnable action) {
        runLogged(command, action);
        command.argumentBytes().ifPresent(attemptWriteSize::addAndGet);
    }

    private void runLogged(Command command, Runnable action) {
        runLogged(
                command,
                () -> {
                    action.run();
                    return null;
                },
                (handle, result) -> {});
    }

    private <T> T runLogged(Command command, Supplier<T> action, BiConsumer<OpenCommand, T> resultRecorder) {
        OpenCommand handle = log.begin(command);
        T result;
        try {
            result = action.get();
        } catch (RuntimeException | Error e) {
            log.end(handle, e);
            throw e;
        }
        resultRecorder.accept(handle, result);
        log.end(handle);
        return result;
    }
}
