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

import com.palantir.txlog.api.ConflictRangeType;
import com.palantir.txlog.api.KeyRange;
import com.palantir.txlog.api.KeySelector;
import com.palantir.txlog.api.MutationType;
import com.palantir.txlog.encoding.KeyBytes;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Factories for the commands recorded against a transaction, one per {@link CommandKind}.
 */
public final class Commands {
    static final int MAX_LISTED_ITEMS = 5;

    private Commands() {
        // factory
    }

    public static Command set(byte[] key, byte[] value) {
        return create(
                CommandKind.SET,
                KeyBytes.prettyPrint(key) + " = " + KeyBytes.prettyPrint(value),
                key.length + value.length);
    }

    public static Command clear(byte[] key) {
        return create(CommandKind.CLEAR, KeyBytes.prettyPrint(key), key.length);
    }

    public static Command clearRange(KeyRange range) {
        return create(CommandKind.CLEAR_RANGE, range.describe(), range.sizeInBytes());
    }

    public static Command atomic(byte[] key, byte[] param, MutationType mutation) {
        return create(
                CommandKind.ATOMIC,
                KeyBytes.prettyPrint(key) + ", " + mutation + ", " + KeyBytes.prettyPrint(param),
                key.length + param.length);
    }

    public static Command addConflictRange(KeyRange range, ConflictRangeType type) {
        return create(CommandKind.ADD_CONFLICT_RANGE, type + ", " + range.describe());
    }

    public static Command get(byte[] key) {
        return create(CommandKind.GET, KeyBytes.prettyPrint(key));
    }

    public static Command getKey(KeySelector selector) {
        return create(CommandKind.GET_KEY, selector.describe());
    }

    public static Command getValues(List<byte[]> keys) {
        return create(CommandKind.GET_VALUES, describeList(keys, KeyBytes::prettyPrint));
    }

    public static Command getKeys(List<KeySelector> selectors) {
        return create(CommandKind.GET_KEYS, describeList(selectors, KeySelector::describe));
    }

    public static Command getRange(KeyRange range, int limit, boolean reverse) {
        StringBuilder sb = new StringBuilder(range.describe());
        if (limit > 0) {
            sb.append(", limit=").append(limit);
        }
        if (reverse) {
            sb.append(", reverse");
        }
        return create(CommandKind.GET_RANGE, sb.toString());
    }

    public static Command watch(byte[] key) {
        return create(CommandKind.WATCH, KeyBytes.prettyPrint(key));
    }

    public static Command getReadVersion() {
        return create(CommandKind.GET_READ_VERSION, "");
    }

    public static Command commit() {
        return create(CommandKind.COMMIT, "");
    }

    public static Command cancel() {
        return create(CommandKind.CANCEL, "");
    }

    public static Command reset() {
        return create(CommandKind.RESET, "");
    }

    /**
     * Marks the boundary between two attempts of the same transaction; {@code error} is what caused the retry.
     */
    public static Command onError(Throwable error) {
        String message = error.getMessage();
        return create(
                CommandKind.ON_ERROR,
                message == null ? error.getClass().getSimpleName() : error.getClass().getSimpleName() + ": " + message);
    }

    /**
     * Free-form annotation, shown inline in reports.
     */
    public static Command log(String message) {
        return create(CommandKind.LOG, message);
    }

    public static String describeValue(Optional<byte[]> value) {
        return value.map(KeyBytes::prettyPrint).orElse("<not found>");
    }

    public static <T> String describeList(List<T> items, Function<T, String> describer) {
        String listed = items.stream()
                .limit(MAX_LISTED_ITEMS)
                .map(describer)
                .collect(Collectors.joining(", "));
        if (items.size() > MAX_LISTED_ITEMS) {
            listed += ", ...";
        }
        return items.size() + ": [" + listed + "]";
    }

    private static Command create(CommandKind kind, String arguments) {
        return new Command(kind, arguments, OptionalInt.empty());
    }

    private static Command create(CommandKind kind, String arguments, int argumentBytes) {
        return new Command(kind, arguments, OptionalInt.of(argumentBytes));
    }
}
