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

import static ai.wren.api.util.ConfigurationUtils.requiredField;

import ai.wren.api.model.MalformedEntryException;
import ai.wren.api.provider.ProviderKind;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns the raw entries of the configuration file into a {@link Configuration}. Entries are
 * processed in order; an identifier declared twice within a kind keeps the last declaration.
 */
@Slf4j
public class ConfigurationTransformer {

    private static final EntryProcessor<Map<String, Object>> LLM_PROCESSOR =
            new LLMEntryProcessor();
    private static final EntryProcessor<Map<String, Object>> EMBEDDER_PROCESSOR =
            new EmbedderEntryProcessor();
    private static final EntryProcessor<Map<String, Object>> DOCUMENT_STORE_PROCESSOR =
            new SingleProviderEntryProcessor(EntryKind.DOCUMENT_STORE);
    private static final EntryProcessor<Map<String, Object>> ENGINE_PROCESSOR =
            new SingleProviderEntryProcessor(EntryKind.ENGINE);
    private static final EntryProcessor<PipelineDeclaration> PIPELINE_PROCESSOR =
            new PipelineEntryProcessor();

    private ConfigurationTransformer() {}

    /**
     * @param entries the raw entries
     * @return the normalized configuration
     * @throws UnknownEntryKindException if an entry has an unsupported type, nothing is returned
     * @throws MalformedEntryException if an entry misses a required field
     */
    public static Configuration transform(List<Map<String, Object>> entries) {
        Map<ProviderKind, Map<String, Map<String, Object>>> providers =
                new EnumMap<>(ProviderKind.class);
        for (ProviderKind kind : ProviderKind.values()) {
            providers.put(kind, new LinkedHashMap<>());
        }
        Map<String, PipelineDeclaration> pipelines = new LinkedHashMap<>();

        for (Map<String, Object> entry : entries) {
            if (entry == null) {
                throw new MalformedEntryException("Configuration entries cannot be null");
            }
            Object type = requiredField(entry, "type", () -> "entry " + entry);
            EntryKind kind =
                    EntryKind.fromType(type.toString())
                            .orElseThrow(
                                    () -> {
                                        log.error("Unknown type: {}", type);
                                        return new UnknownEntryKindException(type.toString());
                                    });
            switch (kind) {
                case LLM -> providers
                        .get(kind.getProviderKind())
                        .putAll(LLM_PROCESSOR.process(entry));
                case EMBEDDER -> providers
                        .get(kind.getProviderKind())
                        .putAll(EMBEDDER_PROCESSOR.process(entry));
                case DOCUMENT_STORE -> providers
                        .get(kind.getProviderKind())
                        .putAll(DOCUMENT_STORE_PROCESSOR.process(entry));
                case ENGINE -> providers
                        .get(kind.getProviderKind())
                        .putAll(ENGINE_PROCESSOR.process(entry));
                case PIPELINE -> pipelines.putAll(PIPELINE_PROCESSOR.process(entry));
            }
        }

        providers.replaceAll((kind, table) -> Collections.unmodifiableMap(table));
        return new Configuration(
                Collections.unmodifiableMap(providers), Collections.unmodifiableMap(pipelines));
    }
}
