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
import java.util.Map;

/**
 * Normalized configuration.
 *
 * @param providers for each kind, the provider configurations keyed by identifier
 * @param pipelines the declared pipelines keyed by name
 */
public record Configuration(
        Map<ProviderKind, Map<String, Map<String, Object>>> providers,
        Map<String, PipelineDeclaration> pipelines) {

    public Map<String, Map<String, Object>> providers(ProviderKind kind) {
        return providers.getOrDefault(kind, Map.of());
    }
}
