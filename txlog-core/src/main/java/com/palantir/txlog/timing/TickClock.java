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

package com.palantir.txlog.timing;

import com.google.common.base.Ticker;
import com.google.common.math.DoubleMath;
import com.palantir.logsafe.Preconditions;
import com.palantir.logsafe.SafeArg;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Converts a monotonic tick counter into elapsed durations. The ticks-per-second ratio is cached at construction and
 * every conversion rounds half away from zero, so that repeated conversions do not drift in one direction.
 * <p>
 * The wall clock is only used to label reports and never to measure durations.
 */
@ThreadSafe
public final class TickClock {
    private static final long NANOS_PER_SECOND = TimeUnit.SECONDS.toNanos(1);

    private static final TickClock SYSTEM = new TickClock(Ticker.systemTicker(), NANOS_PER_SECOND, Clock.systemUTC());

    private final Ticker ticker;
    private final long ticksPerSecond;
    private final double nanosPerTick;
    private final Clock wallClock;

    private TickClock(Ticker ticker, long ticksPerSecond, Clock wallClock) {
        this.ticker = ticker;
        this.ticksPerSecond = ticksPerSecond;
        this.nanosPerTick = (double) NANOS_PER_SECOND / ticksPerSecond;
        this.wallClock = wallClock;
    }

    public static TickClock system() {
        return SYSTEM;
    }

    /**
     * Ticker reporting nanoseconds, like {@link Ticker#systemTicker()} or Guava's {@code FakeTicker}.
     */
    public static TickClock create(Ticker ticker, Clock wallClock) {
        return create(ticker, NANOS_PER_SECOND, wallClock);
    }

    public static TickClock create(Ticker ticker, long ticksPerSecond, Clock wallClock) {
        Preconditions.checkArgument(
                ticksPerSecond > 0, "ticksPerSecond must be positive", SafeArg.of("ticksPerSecond", ticksPerSecond));
        return new TickClock(ticker, ticksPerSecond, wallClock);
    }

    public long now() {
        return ticker.read();
    }

    public Duration elapsedSince(long startTick) {
        return toDuration(now() - startTick);
    }

    public Duration toDuration(long ticks) {
        return Duration.ofNanos(DoubleMath.roundToLong(ticks * nanosPerTick, RoundingMode.HALF_UP));
    }

    public long ticksPerSecond() {
        return ticksPerSecond;
    }

    public Instant wallTime() {
        return wallClock.instant();
    }
}
