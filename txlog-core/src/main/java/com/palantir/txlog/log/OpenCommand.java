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

import java.util.OptionalInt;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle returned by {@link TransactionLog#begin(Command)}. Only the log that issued it can end it, and only once.
 * <p>
 * The handle belongs to the operation that began it: it may be passed along that operation's continuation, but two
 * unrelated threads must never stamp results on the same handle.
 */
public final class OpenCommand {
    private final TransactionLog owner;
    private final Command command;
    private final AtomicBoolean ended = new AtomicBoolean(false);

    OpenCommand(TransactionLog owner, Command command) {
        this.owner = owner;
        this.command = command;
    }

    public Command command() {
        return command;
    }

    /**
     * Describes what the operation returned; {@code resultBytes} is added to the log's read size on end.
     */
    public OpenCommand setResult(String description, int resultBytes) {
        command.setResult(description, OptionalInt.of(resultBytes));
        return this;
    }

    public OpenCommand setResult(String description) {
        command.setResult(description, OptionalInt.empty());
        return this;
    }

    public boolean isEnded() {
        return ended.get();
    }

    boolean isOwnedBy(TransactionLog log) {
        return owner == log;
    }

    boolean markEnded() {
        return ended.compareAndSet(false, true);
    }
}
