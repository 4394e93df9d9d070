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
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Copy of a {@link TransactionLog} taken at one point in time. Reports are rendered from snapshots so that they never
 * race with operations still being recorded.
 */
@Value.Immutable
public interface TransactionLogSnapshot {
    long transactionId();

    /**
     * Commands in arrival order.
     */
    List<Command> commands();

    Instant startedAt();

    Optional<Instant> stoppedAt();

    /**
     * Time from start to stop, or from start to the moment of the snapshot if the log was not stopped.
     */
    Duration totalDuration();

    @Value.Derived
    default boolean completed() {
        return stoppedAt().isPresent();
    }

    int operations();

    long readSize();

    long writeSize();

    long commitSize();

    long totalCommitSize();

    int attempts();

    /**
     * Number of {@link CommandKind#ON_ERROR} commands, each of which ends an attempt.
     */
    int retries();
}
