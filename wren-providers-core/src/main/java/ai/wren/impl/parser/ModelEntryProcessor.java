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

import static ai.wren.api.util.ConfigurationUtils.requiredListOfMaps;
import static ai.wren.api.util.ConfigurationUtils.requiredNonEmptyField;
import static ai.wren.api.util.ConfigurationUtils.without;

import ai.wren.api.model.MalformedEntryException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Base processor for the entries that declare several models of one provider ({@code llm} and
 * {@code embedder}). Every model becomes one normalized entry identified by {@code
 * provider.model}.
 *
 * <p>The normalized entry is built by {@link #merge(List)} from these layers, later layers
 * overriding earlier ones:
 *
 * <ol>
 *   <li>the entry fields, except {@code type}, {@code provider} and {@code models}
 *   <li>the reserved fields of the kind ({@code provider}, {@code model}, ...)
 *   <li>the model fields, except the reserved ones and {@code kwargs}; a model may repeat the
 *       {@code provider} of the entry but not change it
 *   <li>the overrides of the kind, see {@link #overrides(Map, Map)}
 * </ol>
 *
 * API keys are never read here, each provider loads its own secrets.
 */
public abstract class ModelEntryProcessor implements EntryProcessor<Map<String, Object>> {

    protected static final String PROVIDER = "provider";
    protected static final String MODELS = "models";
    protected static final String MODEL = "model";
    protected static final String KWARGS = "kwargs";

    private static final Set<String> ENTRY_RESERVED_KEYS = Set.of("type", PROVIDER, MODELS);

    @Override
    public Map<String, Map<String, Object>> process(Map<String, Object> entry) {
        Supplier<String> entryDefinition = () -> getKind().getType() + " entry " + entry;
        String provider = requiredNonEmptyField(entry, PROVIDER, entryDefinition);
        List<Map<String, Object>> models = requiredListOfMaps(entry, MODELS, entryDefinition);
        Map<String, Object> entryFields = without(entry, ENTRY_RESERVED_KEYS);

        Map<String, Map<String, Object>> result = new LinkedHashMap<>();
        for (Map<String, Object> model : models) {
            Supplier<String> modelDefinition =
                    () -> "model " + model + " of " + getKind().getType() + " provider " + provider;
            String modelName = requiredNonEmptyField(model, MODEL, modelDefinition);
            Object modelProvider = model.get(PROVIDER);
            if (modelProvider != null && !provider.equals(modelProvider.toString())) {
                throw new MalformedEntryException(
                        "Field 'provider' of a model cannot differ from the provider of the"
                                + " entry, got '"
                                + modelProvider
                                + "' in "
                                + modelDefinition.get());
            }
            Map<String, Object> reserved = new LinkedHashMap<>();
            reserved.put(PROVIDER, provider);
            reserved.put(MODEL, modelName);
            reserved.putAll(reservedModelFields(model, modelDefinition));

            Map<String, Object> modelFields = without(model, modelReservedKeys());
            result.put(
                    provider + "." + modelName,
                    merge(
                            List.of(
                                    entryFields,
                                    reserved,
                                    modelFields,
                                    overrides(entry, model))));
        }
        return result;
    }

    /** Merge the layers in order, a key of a later layer replaces the same key of earlier ones. */
    static Map<String, Object> merge(List<Map<String, Object>> layers) {
        Map<String, Object> merged = new LinkedHashMap<>();
        layers.forEach(merged::putAll);
        return merged;
    }

    protected abstract EntryKind getKind();

    /** Kind-specific reserved fields, validated and read from the model. */
    protected Map<String, Object> reservedModelFields(
            Map<String, Object> model, Supplier<String> modelDefinition) {
        return Map.of();
    }

    /** Model keys that never pass through as extra fields. */
    protected Set<String> modelReservedKeys() {
        return Set.of(MODEL, KWARGS);
    }

    protected Map<String, Object> overrides(Map<String, Object> entry, Map<String, Object> model) {
        return Map.of();
    }
}
