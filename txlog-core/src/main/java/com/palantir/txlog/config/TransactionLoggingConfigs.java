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

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.google.common.base.Strings;
import com.palantir.logsafe.SafeArg;
import com.palantir.logsafe.exceptions.SafeIllegalArgumentException;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import javax.annotation.Nullable;

public final class TransactionLoggingConfigs {
    public static final String TXLOG_CONFIG_OBJECT_PATH = "/txlog";

    public static final ObjectMapper OBJECT_MAPPER = new ObjectMapper(new YAMLFactory()
                    .disable(YAMLGenerator.Feature.USE_NATIVE_TYPE_ID)
                    .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER))
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .registerModule(new GuavaModule())
            .registerModule(new Jdk8Module());

    private TransactionLoggingConfigs() {
        // uninstantiable
    }

    public static TransactionLoggingConfig load(File configFile) throws IOException {
        return fromTree(OBJECT_MAPPER.readTree(configFile), TXLOG_CONFIG_OBJECT_PATH);
    }

    public static TransactionLoggingConfig load(InputStream configStream) throws IOException {
        return fromTree(OBJECT_MAPPER.readTree(configStream), TXLOG_CONFIG_OBJECT_PATH);
    }

    /**
     * Reads the config found under {@code configRoot}, a JSON pointer such as {@code /txlog}. A null or empty root
     * reads the whole document.
     */
    public static TransactionLoggingConfig loadFromString(String yaml, @Nullable String configRoot)
            throws IOException {
        return fromTree(OBJECT_MAPPER.readTree(yaml), configRoot);
    }

    private static TransactionLoggingConfig fromTree(@Nullable JsonNode document, @Nullable String configRoot)
            throws IOException {
        JsonNode configNode = document;
        if (configNode != null && !Strings.isNullOrEmpty(configRoot)) {
            configNode = configNode.at(JsonPointer.compile(configRoot));
        }
        if (configNode == null || configNode.isMissingNode()) {
            throw new SafeIllegalArgumentException(
                    "Could not find config root in input", SafeArg.of("configRoot", configRoot));
        }
        return OBJECT_MAPPER.treeToValue(configNode, TransactionLoggingConfig.class);
    }
}
