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
package ai.wren.api.model;

import ai.wren.api.provider.DocumentStoreProvider;
import ai.wren.api.provider.EmbedderProvider;
import ai.wren.api.provider.Engine;
import ai.wren.api.provider.LLMProvider;

/**
 * The providers a pipeline runs with. Any role may be {@code null} when the pipeline does not
 * declare it or when the declared identifier matched no provider. The same provider instance can
 * be shared by several bundles.
 */
public record PipelineComponent(
        EmbedderProvider embedderProvider,
        LLMProvider llmProvider,
        DocumentStoreProvider documentStoreProvider,
        Engine engine) {}
