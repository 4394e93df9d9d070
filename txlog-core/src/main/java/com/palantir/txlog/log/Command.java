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

import java.time.Duration;
import java.util.Optional;
import java.util.OptionalInt;
import javax.annotation.Nullable;

/**
 * One operation performed against a transaction. Created by {@link Commands}, then stamped with its step and time
 * offsets by the {@link TransactionLog} it is added to.
 * <p>
 * Fields stamped by the log are written by the thread that owns the command (the one that began it) and published
 * through volatile writes, so reports built on other threads see either the old or the new value of each field.
 */
public final class Command {
    private static final int NO_STEP = -1;

    private final CommandKind kind;
    private final String arguments;
    private final OptionalInt argumentBytes;

    private volatile int step = NO_STEP;
    private volatile int endStep = NO_STEP;
    private volatile Duration startOffset = Duration.ZERO;

    @Nullable
    private volatile Duration endOffset;

    private volatile long threadId;

    @Nullable
    private volatile Throwable error;

    @Nullable
    private volatile String result;

    private volatile OptionalInt resultBytes = OptionalInt.empty();

    Command(CommandKind kind, String arguments, OptionalInt argumentBytes) {
        this.kind = kind;
        this.arguments = arguments;
        this.argumentBytes = argumentBytes;
    }

    public CommandKind kind() {
        return kind;
    }

    public CommandMode mode() {
        return kind.mode();
    }

    public String shortName() {
        return kind.shortName();
    }

    public String arguments() {
        return arguments;
    }

    /**
     * Bytes sent to the store by this command, for writes.
     */
    public OptionalInt argumentBytes() {
        return argumentBytes;
    }

    /**
     * Bytes returned by the store to this command, for reads.
     */
    public OptionalInt resultBytes() {
        return resultBytes;
    }

    public Optional<String> result() {
        return Optional.ofNullable(result);
    }

    /**
     * Value of the log's step counter when this command began. Commands sharing a step ran concurrently.
     */
    public int step() {
        return step;
    }

    /**
     * Value the step counter took when this command ended; empty for single-shot commands and open ones.
     */
    public OptionalInt endStep() {
        int value = endStep;
        return value == NO_STEP ? OptionalInt.empty() : OptionalInt.of(value);
    }

    public Duration startOffset() {
        return startOffset;
    }

    public Optional<Duration> endOffset() {
        return Optional.ofNullable(endOffset);
    }

    /**
     * Time between begin and end, or zero while the command is still open.
     */
    public Duration duration() {
        Duration end = endOffset;
        return end == null ? Duration.ZERO : end.minus(startOffset);
    }

    public boolean isOpen() {
        return endOffset == null;
    }

    /**
     * Identifier of the thread that began this command. Diagnostic only.
     */
    public long threadId() {
        return threadId;
    }

    public Optional<Throwable> error() {
        return Optional.ofNullable(error);
    }

    void setResult(@Nullable String description, OptionalInt bytes) {
        this.result = description;
        this.resultBytes = bytes;
    }

    void stampBegin(Duration offset, int currentStep, long currentThreadId) {
        this.startOffset = offset;
        this.step = currentStep;
        this.threadId = currentThreadId;
    }

    void stampInstant(Duration offset, int currentStep, long currentThreadId) {
        stampBegin(offset, currentStep, currentThreadId);
        this.endOffset = offset;
    }

    void stampEnd(Duration offset, int newStep, @Nullable Throwable failure) {
        this.error = failure;
        this.endStep = newStep;
        this.endOffset = offset;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (kind == CommandKind.LOG) {
            sb.append("// ").append(arguments);
        } else {
            sb.append(kind.displayName()).append('(').append(arguments).append(')');
        }
        String currentResult = result;
        if (currentResult != null) {
            sb.append(" => ").append(currentResult);
        }
        Throwable failure = error;
        if (failure != null) {
            sb.append(" !! ").append(failure.getClass().getSimpleName());
            if (failure.getMessage() != null) {
                sb.append(": ").append(failure.getMessage());
            }
        }
        return sb.toString();
    }
}
