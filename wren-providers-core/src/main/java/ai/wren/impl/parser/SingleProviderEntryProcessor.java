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

import static ai.wren.api.util.ConfigurationUtils.requiredNonEmptyField;
import static ai.wren.api.util.ConfigurationUtils.without;

import java.util.Map;
import java.util.Set;

/**
 * Normalizes {@code document_store} and {@code engine} entries: the entry without its {@code
 * type}, identified by its {@code provider}.
 */
public class SingleProviderEntryProcessor implements EntryProcessor<Map<String, Object>> {

    private final EntryKind kind;

    public SingleProviderEntryProcessor(EntryKind kind) {
        this.kind = kind;
    }

    @Override
    public Map<String, Map<String, Object>> process(Map<String, Object> entry) {
        String provider =
                requiredNonEmptyField(
                        entry, "provider", () -> kind.getType() + " entry " + entry);
        return Map.of(provider, without(entry, Set.of("type")));
    }
}
