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

import static ai.wren.api.util.ConfigurationUtils.getMap;

import java.util.Map;

/**
 * Normalizes {@code llm} entries. The {@code kwargs} of the model are copied verbatim; a model
 * without {@code kwargs} inherits the ones of the entry, or an empty map.
 *
 * <pre>
 * type: llm
 * provider: openai_llm
 * api_base: https://api.openai.com/v1
 * models:
 *   - model: gpt-4o-mini
 *     kwargs:
 *       temperature: 0
 * </pre>
 *
 * becomes {@code openai_llm.gpt-4o-mini -> {provider, model, kwargs, api_base}}.
 */
public class LLMEntryProcessor extends ModelEntryProcessor {

    @Override
    protected EntryKind getKind() {
        return EntryKind.LLM;
    }

    @Override
    protected Map<String, Object> overrides(Map<String, Object> entry, Map<String, Object> model) {
        Map<String, Object> kwargs = getMap(KWARGS, null, model);
        if (kwargs == null) {
            kwargs = getMap(KWARGS, Map.of(), entry);
        }
        return Map.of(KWARGS, kwargs);
    }
}
