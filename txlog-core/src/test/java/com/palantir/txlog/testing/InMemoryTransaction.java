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

package com.palantir.txlog.testing;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import com.palantir.txlog.api.ConflictRangeType;
import com.palantir.txlog.api.KeyRange;
import com.palantir.txlog.api.KeySelector;
import com.palantir.txlog.api.KeyValue;
import com.palantir.txlog.api.MutationType;
import com.palantir.txlog.api.Transaction;
import com.palantir.txlog.api.TransactionConflictException;
import com.palantir.txlog.api.TransactionFailedException;
import com.palantir.txlog.api.TransactionFailedNonRetriableException;
import com.palantir.txlog.encoding.KeyBytes;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

final class InMemoryTransaction implements Transaction {
    private static final byte[] END_OF_KEYSPACE = {(byte) 0xFF};

    private final InMemoryKeyValueStore store;
    private final long id;

    private final NavigableMap<byte[], Optional<byte[]>> writes = new TreeMap<>(KeyBytes.BYTES_COMPARATOR);
    private final List<byte[]> watchedKeys = new ArrayList<>();
    private final List<SettableFuture<Void>> watchFutures = new ArrayList<>();
    private long readVersion;
    private boolean cancelled;

    InMemoryTransaction(InMemoryKeyValueStore store, long id) {
        this.store = store;
        this.id = id;
        this.readVersion = store.currentVersion();
    }

    @Override
    public long getId() {
        return id;
    }

    @Override
    public synchronized Optional<byte[]> get(byte[] key) {
        checkNotCancelled();
        return Optional.ofNullable(view().get(key));
    }

    @Override
    public synchronized byte[] getKey(KeySelector selector) {
        checkNotCancelled();
        List<byte[]> keys = new ArrayList<>(view().keySet());
        int index = -1;
        for (int i = 0; i < keys.size(); i++) {
            int cmp = KeyBytes.BYTES_COMPARATOR.compare(keys.get(i), selector.key());
            if (cmp < 0 || (cmp == 0 && selector.orEqual())) {
                index = i;
            }
        }
        index += selector.offset();
        if (index < 0) {
            return KeyBytes.EMPTY_BYTE_ARRAY;
        }
        if (index >= keys.size()) {
            return END_OF_KEYSPACE.clone();
        }
        return keys.get(index);
    }

    @Override
    public List<Optional<byte[]>> getValues(List<byte[]> keys) {
        return keys.stream().map(this::get).collect(Collectors.toList());
    }

    @Override
    public List<byte[]> getKeys(List<KeySelector> selectors) {
        return selectors.stream().map(this::getKey).collect(Collectors.toList());
    }

    @Override
    public synchronized List<KeyValue> getRange(KeyRange range, int limit, boolean reverse) {
        checkNotCancelled();
        NavigableMap<byte[], byte[]> slice = view().subMap(range.begin(), true, range.end(), false);
        if (reverse) {
            slice = slice.descendingMap();
        }
        ImmutableList.Builder<KeyValue> results = ImmutableList.builder();
        int count = 0;
        for (Map.Entry<byte[], byte[]> entry : slice.entrySet()) {
            if (limit > 0 && count >= limit) {
                break;
            }
            results.add(KeyValue.of(entry.getKey(), entry.getValue()));
            count++;
        }
        return results.build();
    }

    @Override
    public synchronized void set(byte[] key, byte[] value) {
        checkNotCancelled();
        writes.put(key.clone(), Optional.of(value.clone()));
    }

    @Override
    public synchronized void clear(byte[] key) {
        checkNotCancelled();
        writes.put(key.clone(), Optional.empty());
    }

    @Override
    public synchronized void clearRange(KeyRange range) {
        checkNotCancelled();
        for (byte[] key : view().subMap(range.begin(), true, range.end(), false).keySet()) {
            writes.put(key, Optional.empty());
        }
    }

    @Override
    public synchronized void atomic(byte[] key, byte[] param, MutationType mutation) {
        checkNotCancelled();
        byte[] current = Optional.ofNullable(view().get(key)).orElse(KeyBytes.EMPTY_BYTE_ARRAY);
        writes.put(key.clone(), Optional.of(Mutations.apply(mutation, current, param)));
    }

    @Override
    public void addConflictRange(KeyRange range, ConflictRangeType type) {
        checkNotCancelled();
    }

    @Override
    public synchronized ListenableFuture<Void> watch(byte[] key) {
        checkNotCancelled();
        SettableFuture<Void> future = SettableFuture.create();
        watchedKeys.add(key.clone());
        watchFutures.add(future);
        return future;
    }

    @Override
    public synchronized long getReadVersion() {
        checkNotCancelled();
        return readVersion;
    }

    @Override
    public synchronized void commit() {
        checkNotCancelled();
        if (store.shouldFailCommit()) {
            throw new TransactionConflictException(id);
        }
        store.apply(writes);
        for (int i = 0; i < watchedKeys.size(); i++) {
            store.addWatch(watchedKeys.get(i), watchFutures.get(i));
        }
        watchedKeys.clear();
        watchFutures.clear();
    }

    @Override
    public void onError(TransactionFailedException error) {
        if (!error.canTransactionBeRetried()) {
            throw error;
        }
        reset();
    }

    @Override
    public synchronized void cancel() {
        cancelled = true;
        watchFutures.forEach(future -> future.cancel(false));
    }

    @Override
    public synchronized void reset() {
        writes.clear();
        watchedKeys.clear();
        watchFutures.clear();
        cancelled = false;
        readVersion = store.currentVersion();
    }

    @Override
    public void close() {
        cancel();
    }

    private NavigableMap<byte[], byte[]> view() {
        NavigableMap<byte[], byte[]> merged = store.copyOfData();
        for (Map.Entry<byte[], Optional<byte[]>> write : writes.entrySet()) {
            if (write.getValue().isPresent()) {
                merged.put(write.getKey(), write.getValue().get());
            } else {
                merged.remove(write.getKey());
            }
        }
        return merged;
    }

    private void checkNotCancelled() {
        if (cancelled) {
            throw new TransactionFailedNonRetriableException("Transaction was cancelled");
        }
    }

    private static final class Mutations {
        private Mutations() {}

        static byte[] apply(MutationType mutation, byte[] current, byte[] param) {
            byte[] existing = Arrays.copyOf(current, param.length);
            byte[] result = new byte[param.length];
            switch (mutation) {
                case ADD:
                    int carry = 0;
                    for (int i = 0; i < param.length; i++) {
                        int sum = (existing[i] & 0xFF) + (param[i] & 0xFF) + carry;
                        result[i] = (byte) sum;
                        carry = sum >>> 8;
                    }
                    return result;
                case BIT_AND:
                    for (int i = 0; i < param.length; i++) {
                        result[i] = (byte) (existing[i] & param[i]);
                    }
                    return result;
                case BIT_OR:
                    for (int i = 0; i < param.length; i++) {
                        result[i] = (byte) (existing[i] | param[i]);
                    }
                    return result;
                case BIT_XOR:
                    for (int i = 0; i < param.length; i++) {
                        result[i] = (byte) (existing[i] ^ param[i]);
                    }
                    return result;
                case MAX:
                    return compareLittleEndian(existing, param) >= 0 ? existing : param.clone();
                case MIN:
                    return compareLittleEndian(existing, param) <= 0 ? existing : param.clone();
                default:
                    throw new IllegalArgumentException("Unknown mutation " + mutation);
            }
        }

        private static int compareLittleEndian(byte[] left, byte[] right) {
            for (int i = left.length - 1; i >= 0; i--) {
                int cmp = Integer.compare(left[i] & 0xFF, right[i] & 0xFF);
                if (cmp != 0) {
                    return cmp;
                }
            }
            return 0;
        }
    }
}
