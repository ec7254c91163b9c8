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
import ai.wren.api.model.PipelineComponents;
import ai.wren.api.provider.ProviderKind;
import ai.wren.api.provider.ProviderRegistry;
import ai.wren.impl.parser.Configuration;
import ai.wren.impl.parser.ConfigurationTransformer;
import ai.wren.impl.parser.PipelineDeclaration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;

/**
 * Wires the providers every pipeline needs.
 *
 * <p>The configuration entries are first normalized, then every declared provider is created,
 * and only then are the pipelines resolved against the live providers. An identifier that
 * matches no provider leaves the role empty, unless strict references are enabled. With no
 * entries at all the legacy environment variables are used and every pipeline gets the same
 * bundle.
 */
@Slf4j
public class PipelineComponentsGenerator {

    private final ProviderRegistry registry;
    private final ProviderFactory factory;
    private final Function<String, String> environment;
    private final boolean strictReferences;

    public PipelineComponentsGenerator(ProviderRegistry registry) {
        this(registry, System::getenv, false);
    }

    public PipelineComponentsGenerator(
            ProviderRegistry registry,
            Function<String, String> environment,
            boolean strictReferences) {
        this.registry = registry;
        this.factory = new ProviderFactory(registry);
        this.environment = environment;
        this.strictReferences = strictReferences;
    }

    public PipelineComponents generateComponents(List<Map<String, Object>> entries) {
        registry.discover();

        // TODO: remove the environment variables fallback once deployments ship a config.yaml
        if (entries == null || entries.isEmpty()) {
            log.warn(
                    "No configuration provided. Falling back to environment variables for settings."
                            + " This is a legacy approach and will be removed, please migrate to"
                            + " the configuration file format.");
            LegacyProviders legacyProviders = new LegacyProviders(factory, environment);
            return new SharedPipelineComponents(
                    legacyProviders.initProviders(legacyProviders.engineConfig()));
        }

        Configuration configuration = ConfigurationTransformer.transform(entries);
        InstantiatedProviders instances = factory.instantiateAll(configuration);

        Map<String, PipelineComponent> components = new LinkedHashMap<>();
        configuration
                .pipelines()
                .forEach(
                        (name, declaration) ->
                                components.put(name, componentize(name, declaration, instances)));
        return new DeclaredPipelineComponents(components);
    }

    PipelineComponent componentize(
            String pipeline, PipelineDeclaration declaration, InstantiatedProviders instances) {
        return new PipelineComponent(
                resolve(pipeline, ProviderKind.EMBEDDER, declaration, instances),
                resolve(pipeline, ProviderKind.LLM, declaration, instances),
                resolve(pipeline, ProviderKind.DOCUMENT_STORE, declaration, instances),
                resolve(pipeline, ProviderKind.ENGINE, declaration, instances));
    }

    private <T> T resolve(
            String pipeline,
            ProviderKind kind,
            PipelineDeclaration declaration,
            InstantiatedProviders instances) {
        String identifier = declaration.reference(kind);
        if (identifier == null) {
            return null;
        }
        T instance = instances.get(kind, identifier);
        if (instance == null) {
            if (strictReferences) {
                throw new UnresolvedReferenceException(pipeline, kind, identifier);
            }
            log.warn(
                    "Pipeline {} references unknown {} provider {}, the role is left empty",
                    pipeline,
                    kind,
                    identifier);
        }
        return instance;
    }
}
