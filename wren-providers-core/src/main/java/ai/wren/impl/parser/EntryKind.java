/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ai.wren.impl.parser;

import ai.wren.api.provider.ProviderKind;
import java.util.Arrays;
import java.util.Optional;
import lombok.Getter;

/** Value of the {@code type} field of a configuration entry. */
@Getter
public enum EntryKind {
    LLM("llm", ProviderKind.LLM),
    EMBEDDER("embedder", ProviderKind.EMBEDDER),
    DOCUMENT_STORE("document_store", ProviderKind.DOCUMENT_STORE),
    ENGINE("engine", ProviderKind.ENGINE),
    PIPELINE("pipeline", null);

    private final String type;
    // null for PIPELINE
    private final ProviderKind providerKind;

    EntryKind(String type, ProviderKind providerKind) {
        this.type = type;
        this.providerKind = providerKind;
    }

    public static Optional<EntryKind> fromType(String type) {
        return Arrays.stream(values()).filter(k -> k.type.equals(type)).findFirst();
    }
}
