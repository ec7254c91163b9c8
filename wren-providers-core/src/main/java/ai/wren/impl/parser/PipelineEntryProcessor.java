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

import static ai.wren.api.util.ConfigurationUtils.getString;
import static ai.wren.api.util.ConfigurationUtils.requiredListOfMaps;
import static ai.wren.api.util.ConfigurationUtils.requiredNonEmptyField;

import ai.wren.api.provider.ProviderKind;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Normalizes {@code pipeline} entries.
 *
 * <pre>
 * type: pipeline
 * pipes:
 *   - name: indexing
 *     embedder: openai_embedder.text-embedding-3-large
 *     document_store: qdrant
 * </pre>
 */
public class PipelineEntryProcessor implements EntryProcessor<PipelineDeclaration> {

    @Override
    public Map<String, PipelineDeclaration> process(Map<String, Object> entry) {
        Map<String, PipelineDeclaration> result = new LinkedHashMap<>();
        for (Map<String, Object> pipe :
                requiredListOfMaps(entry, "pipes", () -> "pipeline entry " + entry)) {
            String name = requiredNonEmptyField(pipe, "name", () -> "pipe " + pipe);
            result.put(
                    name,
                    new PipelineDeclaration(
                            role(ProviderKind.LLM, pipe),
                            role(ProviderKind.EMBEDDER, pipe),
                            role(ProviderKind.DOCUMENT_STORE, pipe),
                            role(ProviderKind.ENGINE, pipe)));
        }
        return result;
    }

    private static String role(ProviderKind kind, Map<String, Object> pipe) {
        return getString(kind.getType(), null, pipe);
    }
}
