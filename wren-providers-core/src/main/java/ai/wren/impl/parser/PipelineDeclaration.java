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

/** The provider identifiers a pipeline asks for; every role is optional. */
public record PipelineDeclaration(
        String llm, String embedder, String documentStore, String engine) {

    public String reference(ProviderKind kind) {
        return switch (kind) {
            case LLM -> llm;
            case EMBEDDER -> embedder;
            case DOCUMENT_STORE -> documentStore;
            case ENGINE -> engine;
        };
    }
}
