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

public enum CommandKind {
    SET("Set", "s", CommandMode.WRITE),
    CLEAR("Clear", "c", CommandMode.WRITE),
    CLEAR_RANGE("ClearRange", "cr", CommandMode.WRITE),
    ATOMIC("Atomic", "a", CommandMode.WRITE),
    ADD_CONFLICT_RANGE("AddConflictRange", "rc", CommandMode.META),
    GET("Get", "G", CommandMode.READ),
    GET_KEY("GetKey", "GK", CommandMode.READ),
    GET_VALUES("GetValues", "Gv", CommandMode.READ),
    GET_KEYS("GetKeys", "Gk", CommandMode.READ),
    GET_RANGE("GetRange", "GR", CommandMode.READ),
    WATCH("Watch", "W", CommandMode.WATCH),
    GET_READ_VERSION("GetReadVersion", "rv", CommandMode.META),
    COMMIT("Commit", "Co", CommandMode.WRITE),
    CANCEL("Cancel", "X", CommandMode.META),
    RESET("Reset", "R", CommandMode.META),
    ON_ERROR("OnError", "Er", CommandMode.META),
    LOG("Log", "//", CommandMode.ANNOTATION);

    private final String displayName;
    private final String shortName;
    private final CommandMode mode;

    CommandKind(String displayName, String shortName, CommandMode mode) {
        this.displayName = displayName;
        this.shortName = shortName;
        this.mode = mode;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * One or two characters, shown in the timeline.
     */
    public String shortName() {
        return shortName;
    }

    public CommandMode mode() {
        return mode;
    }
}
