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

import java.util.Map;

/**
 * Builds provider instances of one {@link ProviderKind} from a configuration map. Implementations
 * are discovered with {@link java.util.ServiceLoader} or registered explicitly on a {@link
 * ProviderRegistry}.
 */
public interface ProviderConstructor {

    ProviderKind getKind();

    /** The name used in the {@code provider} field of the configuration, e.g. "openai_llm". */
    String getName();

    /**
     * Create a new provider. Secrets such as API keys are not part of the configuration, the
     * implementation reads them from its own environment.
     *
     * @param configuration the normalized configuration, always containing {@code provider}
     * @return a live instance implementing {@link ProviderKind#getContract()}
     */
    Object createImplementation(Map<String, Object> configuration);
}
