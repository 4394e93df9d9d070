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

package com.palantir.txlog.report;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.palantir.txlog.log.Command;
import com.palantir.txlog.log.CommandKind;
import com.palantir.txlog.log.TransactionLogSnapshot;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.OptionalInt;

/**
 * Renders a transaction as a waterfall chart: one row per command, with a bar showing when the command ran relative
 * to the whole transaction.
 * <p>
 * The horizontal scale is picked so that the chart is at most {@link #MAX_WIDTH} characters wide, starting from
 * 0.5 ms per character and growing by alternating factors of 2 and 5 (0.5, 1, 5, 10, 50, ... ms). Each character
 * covers an equal slice of the transaction and is drawn with a glyph whose density is proportional to how much of
 * that slice the command covers.
 * <p>
 * Every {@link CommandKind#ON_ERROR} command ends an attempt: a separator is drawn after it, and the part of the
 * chart that belongs to earlier attempts is drawn with {@link #PREVIOUS_ATTEMPT} in the following rows.
 */
public final class TimelineRenderer {
    @VisibleForTesting
    static final int MAX_WIDTH = 80;

    @VisibleForTesting
    static final long MIN_NANOS_PER_CHAR = 500_000;

    @VisibleForTesting
    static final String DENSITY_RAMP = "`.:;+=xX$&#";

    @VisibleForTesting
    static final char BEFORE_START = '_';

    @VisibleForTesting
    static final char PREVIOUS_ATTEMPT = '°';

    @VisibleForTesting
    static final char AFTER_END = ' ';

    private static final long NANOS_PER_MILLI = 1_000_000L;
    private static final Duration SLOW_COMMAND = Duration.ofMillis(10);
    private static final Duration NOTABLE_COMMAND = Duration.ofMillis(1);

    private static final String TIMINGS_HEADER = "──── start ──── end ── duration ──";
    private static final String BYTES_HEADER = "─ sent  recv ";
    private static final String TIMINGS_RULE = Strings.repeat("─", TIMINGS_HEADER.length());
    private static final String BYTES_RULE = Strings.repeat("─", BYTES_HEADER.length());

    private static final DateTimeFormatter TIME_OF_DAY =
            DateTimeFormatter.ofPattern("HH:mm:ss.SSSSSS", Locale.ROOT).withZone(ZoneOffset.UTC);

    private TimelineRenderer() {
        // utility
    }

    public static String render(TransactionLogSnapshot snapshot, boolean showCommands) {
        long totalNanos = snapshot.totalDuration().toNanos();
        double nanosPerChar = nanosPerChar(totalNanos);
        int width = (int) (totalNanos / nanosPerChar);

        StringBuilder sb = new StringBuilder();
        appendHeader(sb, snapshot, nanosPerChar);
        sb.append("┌  oper. ┬")
                .append(Strings.repeat("─", width + 2))
                .append('┬')
                .append(TIMINGS_HEADER)
                .append('┬')
                .append(BYTES_HEADER)
                .append('┐')
                .append('\n');

        int previousStep = -1;
        boolean previousWasOnError = false;
        int attempts = 1;
        int charsToSkip = 0;
        for (Command command : snapshot.commands()) {
            if (previousWasOnError) {
                attempts++;
                sb.append("├────────┼")
                        .append(Strings.repeat("─", width + 2))
                        .append('┼')
                        .append(TIMINGS_RULE)
                        .append('┼')
                        .append(BYTES_RULE)
                        .append("┤ == Attempt #")
                        .append(attempts)
                        .append(" ==")
                        .append('\n');
            }

            int step = command.step();
            long startNanos = command.startOffset().toNanos();
            long endNanos = command.endOffset().map(Duration::toNanos).orElse(Math.max(totalNanos, startNanos));
            long durationNanos = endNanos - startNanos;

            sb.append(String.format(
                            Locale.ROOT,
                            "│%s%-3d%s%2s%s│ %s │ T+%7.3f ~ %7.3f (%,7.0f µs) │ %5s %5s │%s",
                            step == previousStep ? ":" : " ",
                            step,
                            command.error().isPresent() ? "!" : " ",
                            command.shortName(),
                            durationMarker(durationNanos),
                            renderBar(width, startNanos, endNanos, totalNanos, charsToSkip),
                            (double) startNanos / NANOS_PER_MILLI,
                            (double) endNanos / NANOS_PER_MILLI,
                            durationNanos / 1000.0,
                            formatBytes(command.argumentBytes()),
                            formatBytes(command.resultBytes()),
                            showCommands ? " " + command : ""))
                    .append('\n');

            previousWasOnError = command.kind() == CommandKind.ON_ERROR;
            if (previousWasOnError && totalNanos > 0) {
                charsToSkip = (int) Math.floor((double) width * endNanos / totalNanos);
            }
            previousStep = step;
        }

        sb.append("└────────┴")
                .append(Strings.repeat("─", width + 2))
                .append('┴')
                .append(TIMINGS_RULE)
                .append('┴')
                .append(BYTES_RULE)
                .append('┘')
                .append('\n');

        appendFooter(sb, snapshot, attempts);
        return sb.toString();
    }

    /**
     * Time represented by one character of the chart.
     */
    @VisibleForTesting
    static double nanosPerChar(long totalNanos) {
        double scale = MIN_NANOS_PER_CHAR;
        boolean timesFive = false;
        while (totalNanos / scale > MAX_WIDTH) {
            scale *= timesFive ? 5 : 2;
            timesFive = !timesFive;
        }
        return scale;
    }

    @VisibleForTesting
    static String renderBar(int width, long startNanos, long endNanos, long totalNanos, int charsToSkip) {
        if (totalNanos <= 0) {
            return Strings.repeat(String.valueOf(AFTER_END), width);
        }
        double begin = (double) startNanos / totalNanos;
        double end = (double) endNanos / totalNanos;

        char[] cells = new char[width];
        for (int i = 0; i < width; i++) {
            cells[i] = cell(i, width, begin, end, i < charsToSkip);
        }
        return new String(cells);
    }

    private static char cell(int position, int width, double begin, double end, boolean previousAttempt) {
        double cellBegin = (double) position / width;
        double cellEnd = (double) (position + 1) / width;

        // instant commands still get a mark in the cell they fall in
        boolean instant = begin == end;
        if (instant ? cellBegin > end : cellBegin >= end) {
            return AFTER_END;
        }
        if (cellEnd <= begin) {
            return previousAttempt ? PREVIOUS_ATTEMPT : BEFORE_START;
        }

        double covered = width * (Math.min(cellEnd, end) - Math.max(cellBegin, begin));
        covered = Math.max(0, Math.min(1, covered));
        return DENSITY_RAMP.charAt((int) Math.round(covered * (DENSITY_RAMP.length() - 1)));
    }

    private static void appendHeader(StringBuilder sb, TransactionLogSnapshot snapshot, double nanosPerChar) {
        sb.append(String.format(
                Locale.ROOT,
                "Transaction #%d (%d operations, '#' = %,.1f ms, started %sZ",
                snapshot.transactionId(),
                snapshot.commands().size(),
                nanosPerChar / NANOS_PER_MILLI,
                TIME_OF_DAY.format(snapshot.startedAt())));
        if (snapshot.stoppedAt().isPresent()) {
            sb.append(", ended ").append(TIME_OF_DAY.format(snapshot.stoppedAt().get())).append("Z)");
        } else {
            sb.append(", did not finish)");
        }
        sb.append('\n');
    }

    private static void appendFooter(StringBuilder sb, TransactionLogSnapshot snapshot, int attempts) {
        double totalMillis = (double) snapshot.totalDuration().toNanos() / NANOS_PER_MILLI;
        if (!snapshot.completed()) {
            sb.append(String.format(
                    Locale.ROOT, "Did not finish after %,.3f ms (%d attempt(s) so far)", totalMillis, attempts));
            sb.append('\n');
            return;
        }

        boolean described = false;
        if (snapshot.readSize() > 0) {
            sb.append(String.format(Locale.ROOT, "Read %,d bytes", snapshot.readSize()));
            described = true;
        }
        if (snapshot.commitSize() > 0) {
            if (described) {
                sb.append(" and ");
            }
            sb.append(String.format(Locale.ROOT, "Committed %,d bytes", snapshot.commitSize()));
            described = true;
        }
        if (!described) {
            sb.append("Completed");
        }
        sb.append(String.format(Locale.ROOT, " in %,.3f ms and %d attempt(s)", totalMillis, attempts));
        sb.append('\n');
    }

    private static String durationMarker(long durationNanos) {
        if (durationNanos >= SLOW_COMMAND.toNanos()) {
            return "*";
        }
        if (durationNanos >= NOTABLE_COMMAND.toNanos()) {
            return "°";
        }
        return " ";
    }

    private static String formatBytes(OptionalInt bytes) {
        return bytes.isPresent() ? String.valueOf(bytes.getAsInt()) : "";
    }
}
