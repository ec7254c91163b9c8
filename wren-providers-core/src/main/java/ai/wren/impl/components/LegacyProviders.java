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
package ai.wren.impl.components;

import ai.wren.api.model.PipelineComponent;
import ai.wren.api.provider.DocumentStoreProvider;
import ai.wren.api.provider.EmbedderProvider;
import ai.wren.api.provider.Engine;
import ai.wren.api.provider.LLMProvider;
import ai.wren.api.provider.ProviderKind;
import java.util.Map;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Builds the providers from environment variables, the way the service was configured before
 * the configuration file existed. Each provider reads the rest of its settings from the
 * environment.
 */
@Slf4j
public class LegacyProviders {

    public static final String LLM_PROVIDER = "LLM_PROVIDER";
    public static final String EMBEDDER_PROVIDER = "EMBEDDER_PROVIDER";
    public static final String DOCUMENT_STORE_PROVIDER = "DOCUMENT_STORE_PROVIDER";
    public static final String ENGINE = "ENGINE";

    static final String DEFAULT_LLM_PROVIDER = "openai_llm";
    static final String DEFAULT_EMBEDDER_PROVIDER = "openai_embedder";
    static final String DEFAULT_DOCUMENT_STORE_PROVIDER = "qdrant";
    static final String DEFAULT_ENGINE = "wren_ui";

    private final ProviderFactory factory;
    private final Function<String, String> environment;

    public LegacyProviders(ProviderFactory factory, Function<String, String> environment) {
        this.factory = factory;
        this.environment = environment;
    }

    public EngineConfig engineConfig() {
        return new EngineConfig(env(ENGINE, DEFAULT_ENGINE));
    }

    /** Create one provider of each kind and bundle them. */
    public PipelineComponent initProviders(EngineConfig engineConfig) {
        log.info("Initializing providers...");
        LLMProvider llmProvider =
                factory.create(ProviderKind.LLM, named(env(LLM_PROVIDER, DEFAULT_LLM_PROVIDER)));
        EmbedderProvider embedderProvider =
                factory.create(
                        ProviderKind.EMBEDDER,
                        named(env(EMBEDDER_PROVIDER, DEFAULT_EMBEDDER_PROVIDER)));
        DocumentStoreProvider documentStoreProvider =
                factory.create(
                        ProviderKind.DOCUMENT_STORE,
                        named(env(DOCUMENT_STORE_PROVIDER, DEFAULT_DOCUMENT_STORE_PROVIDER)));
        Engine engine = factory.create(ProviderKind.ENGINE, engineConfig.toConfiguration());
        return new PipelineComponent(embedderProvider, llmProvider, documentStoreProvider, engine);
    }

    private String env(String name, String defaultValue) {
        return StringUtils.defaultIfBlank(environment.apply(name), defaultValue);
    }

    private static Map<String, Object> named(String provider) {
        return Map.of("provider", provider);
    }
}
