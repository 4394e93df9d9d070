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

import com.palantir.txlog.log.Command;
import com.palantir.txlog.log.TransactionLogSnapshot;
import java.util.List;
import java.util.Locale;

/**
 * Renders every command of a transaction on its own line, in arrival order, followed by statistics.
 */
public final class CommandListRenderer {
    private CommandListRenderer() {
        // utility
    }

    public static String render(TransactionLogSnapshot snapshot) {
        StringBuilder sb = new StringBuilder();
        sb.append("Transaction #").append(snapshot.transactionId()).append(" command log:").append('\n');

        List<Command> commands = snapshot.commands();
        int reads = 0;
        int writes = 0;
        for (int i = 0; i < commands.size(); i++) {
            Command command = commands.get(i);
            sb.append(String.format(Locale.ROOT, "%3d/%3d : %s", i + 1, commands.size(), command))
                    .append('\n');
            switch (command.mode()) {
                case READ:
                    reads++;
                    break;
                case WRITE:
                    writes++;
                    break;
                default:
                    break;
            }
        }

        sb.append("Stats: ")
                .append(snapshot.operations())
                .append(" operations (")
                .append(reads)
                .append(" reads, ")
                .append(writes)
                .append(" writes), ")
                .append(snapshot.commitSize())
                .append(" committed bytes")
                .append('\n');
        return sb.toString();
    }
}
