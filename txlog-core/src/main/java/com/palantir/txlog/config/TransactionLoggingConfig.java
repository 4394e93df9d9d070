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

package com.palantir.txlog.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import java.time.Duration;
import org.immutables.value.Value;

@JsonDeserialize(as = ImmutableTransactionLoggingConfig.class)
@JsonSerialize(as = ImmutableTransactionLoggingConfig.class)
@Value.Immutable
public abstract class TransactionLoggingConfig {
    public static final long DEFAULT_SLOW_TRANSACTION_THRESHOLD_MILLIS = 1000;
    public static final int DEFAULT_RETRY_LIMIT = 10;

    /**
     * If false, transactions run without being recorded and no report is ever produced.
     */
    @Value.Default
    public boolean enabled() {
        return true;
    }

    /**
     * If true, timing reports include the description of every command, which may contain keys and values.
     */
    @Value.Default
    public boolean showCommands() {
        return false;
    }

    /**
     * Transactions taking at least this long have their timing report logged at INFO.
     */
    @Value.Default
    public long slowTransactionThresholdMillis() {
        return DEFAULT_SLOW_TRANSACTION_THRESHOLD_MILLIS;
    }

    /**
     * Maximum number of times a transaction is retried after a retriable failure. Zero means no limit.
     */
    @Value.Default
    public int retryLimit() {
        return DEFAULT_RETRY_LIMIT;
    }

    public Duration slowTransactionThreshold() {
        return Duration.ofMillis(slowTransactionThresholdMillis());
    }

    @Value.Check
    protected void check() {
        Preconditions.checkArgument(
                slowTransactionThresholdMillis() >= 0,
                "Slow transaction threshold must not be negative",
                SafeArg.of("slowTransactionThresholdMillis", slowTransactionThresholdMillis()));
        Preconditions.checkArgument(
                retryLimit() >= 0,
                "Retry limit must not be negative; use 0 for no limit",
                SafeArg.of("retryLimit", retryLimit()));
    }

    public static TransactionLoggingConfig defaultConfig() {
        return ImmutableTransactionLoggingConfig.builder().build();
    }

    public static TransactionLoggingConfig disabled() {
        return ImmutableTransactionLoggingConfig.builder().enabled(false).build();
    }
}
