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

import static ai.wren.api.util.ConfigurationUtils.requiredField;

import ai.wren.api.model.MalformedEntryException;
import java.math.BigDecimal;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Normalizes {@code embedder} entries. Every model must declare the {@code dimension} of the
 * vectors it produces.
 */
public class EmbedderEntryProcessor extends ModelEntryProcessor {

    static final String DIMENSION = "dimension";

    @Override
    protected EntryKind getKind() {
        return EntryKind.EMBEDDER;
    }

    @Override
    protected Map<String, Object> reservedModelFields(
            Map<String, Object> model, Supplier<String> modelDefinition) {
        Object value = requiredField(model, DIMENSION, modelDefinition);
        int dimension;
        try {
            if (value instanceof Number n) {
                // rejects fractional values and values outside of the int range
                dimension = new BigDecimal(n.toString()).intValueExact();
            } else {
                dimension = Integer.parseInt(value.toString().trim());
            }
        } catch (ArithmeticException | NumberFormatException e) {
            throw invalidDimension(value, modelDefinition, e);
        }
        if (dimension <= 0) {
            throw invalidDimension(value, modelDefinition, null);
        }
        return Map.of(DIMENSION, dimension);
    }

    private static MalformedEntryException invalidDimension(
            Object value, Supplier<String> modelDefinition, Exception cause) {
        return new MalformedEntryException(
                "Field 'dimension' must be a positive integer, got '"
                        + value
                        + "' in "
                        + modelDefinition.get(),
                cause);
    }

    @Override
    protected Set<String> modelReservedKeys() {
        return Set.of(MODEL, KWARGS, DIMENSION);
    }
}
