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
package ai.wren.api.provider;

import lombok.Getter;

/** The four kinds of runtime component a pipeline can be wired with. */
@Getter
public enum ProviderKind {
    LLM("llm", LLMProvider.class),
    EMBEDDER("embedder", EmbedderProvider.class),
    DOCUMENT_STORE("document_store", DocumentStoreProvider.class),
    ENGINE("engine", Engine.class);

    private final String type;
    private final Class<?> contract;

    ProviderKind(String type, Class<?> contract) {
        this.type = type;
        this.contract = contract;
    }

    @Override
    public String toString() {
        return type;
    }
}
