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

import static ai.wren.api.util.ConfigurationUtils.requiredNonEmptyField;

import ai.wren.api.model.ProviderConfigurationException;
import ai.wren.api.provider.ProviderConstructor;
import ai.wren.api.provider.ProviderKind;
import ai.wren.api.provider.ProviderRegistry;
import ai.wren.impl.parser.Configuration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/** Creates live providers from normalized configurations. */
@Slf4j
public class ProviderFactory {

    private final ProviderRegistry registry;

    public ProviderFactory(ProviderRegistry registry) {
        this.registry = registry;
    }

    /**
     * Create one provider.
     *
     * @param kind the table the configuration comes from
     * @param configuration the normalized configuration, the {@code provider} field selects the
     *     constructor
     * @return the instance, implementing the contract of the kind
     * @throws ai.wren.api.provider.UnknownProviderException if no constructor is registered
     */
    public <T> T create(ProviderKind kind, Map<String, Object> configuration) {
        String name =
                requiredNonEmptyField(
                        configuration, "provider", () -> kind + " configuration " + configuration);
        log.info("initializing provider: {}", name);
        ProviderConstructor constructor = registry.resolve(kind, name);
        Object instance = constructor.createImplementation(new LinkedHashMap<>(configuration));
        if (!kind.getContract().isInstance(instance)) {
            throw new ProviderConfigurationException(
                    "Provider "
                            + name
                            + " created "
                            + (instance == null ? "null" : instance.getClass().getName())
                            + ", expected a "
                            + kind.getContract().getSimpleName());
        }
        return (T) instance;
    }

    /** Instantiate every provider of the configuration, all of them or none. */
    public InstantiatedProviders instantiateAll(Configuration configuration) {
        Map<ProviderKind, Map<String, Object>> instances = new EnumMap<>(ProviderKind.class);
        for (ProviderKind kind : ProviderKind.values()) {
            Map<String, Object> table = new LinkedHashMap<>();
            configuration
                    .providers(kind)
                    .forEach((identifier, config) -> table.put(identifier, create(kind, config)));
            instances.put(kind, table);
        }
        return new InstantiatedProviders(instances);
    }
}
