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

import ai.wren.api.provider.ProviderKind;
import java.util.Map;

/** Live providers keyed by kind and identifier. Not modified once built. */
public class InstantiatedProviders {

    private final Map<ProviderKind, Map<String, Object>> instances;

    InstantiatedProviders(Map<ProviderKind, Map<String, Object>> instances) {
        this.instances = instances;
    }

    /**
     * @return the provider, or null if the identifier is null or unknown
     */
    public <T> T get(ProviderKind kind, String identifier) {
        if (identifier == null) {
            return null;
        }
        return (T) instances.getOrDefault(kind, Map.of()).get(identifier);
    }
}
