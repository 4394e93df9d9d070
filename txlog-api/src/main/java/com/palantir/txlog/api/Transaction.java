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

import com.google.common.util.concurrent.ListenableFuture;
import java.util.List;
import java.util.Optional;

/**
 * A transaction against an ordered key-value store. Reads see a consistent snapshot taken at the read version;
 * writes are buffered and only become visible to other transactions once {@link #commit()} succeeds.
 * <p>
 * Implementations must allow concurrent calls from several threads, as a single transaction body may fan out reads.
 */
public interface Transaction extends AutoCloseable {
    /**
     * Process-unique identifier of this transaction. Stable across retries of the same transaction.
     */
    long getId();

    Optional<byte[]> get(byte[] key);

    /**
     * Resolves a key selector to an existing key, or to the empty key/0xFF boundaries if it falls off the database.
     */
    byte[] getKey(KeySelector selector);

    List<Optional<byte[]>> getValues(List<byte[]> keys);

    List<byte[]> getKeys(List<KeySelector> selectors);

    /**
     * Returns at most {@code limit} key/value pairs inside {@code range}, in key order or reversed. A limit of zero
     * means no limit.
     */
    List<KeyValue> getRange(KeyRange range, int limit, boolean reverse);

    void set(byte[] key, byte[] value);

    void clear(byte[] key);

    void clearRange(KeyRange range);

    void atomic(byte[] key, byte[] param, MutationType mutation);

    void addConflictRange(KeyRange range, ConflictRangeType type);

    /**
     * Returns a future that completes once the value of {@code key} changes after this transaction commits.
     */
    ListenableFuture<Void> watch(byte[] key);

    long getReadVersion();

    /**
     * @throws TransactionConflictException if a key read by this transaction has since been written
     */
    void commit();

    /**
     * Prepares the transaction to be retried after {@code error}. If the error can be retried the transaction is
     * reset (possibly after a backoff) and this method returns normally; otherwise {@code error} is rethrown.
     */
    void onError(TransactionFailedException error);

    void cancel();

    /**
     * Discards every read and write done so far, as if the transaction had just been created.
     */
    void reset();

    @Override
    void close();
}
