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
package ai.wren.api.util;

import ai.wren.api.model.MalformedEntryException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Utility class for reading raw configuration maps. The messages produced here end up in the
 * startup failure of the service, so they always name the field and the entry.
 */
public class ConfigurationUtils {

    private ConfigurationUtils() {}

    public static String getString(
            String key, String defaultValue, Map<String, Object> configuration) {
        Object value = configuration.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof String n) {
            return n;
        } else {
            return value.toString();
        }
    }

    public static Map<String, Object> getMap(
            String key, Map<String, Object> defaultValue, Map<String, Object> configuration) {
        Object value = configuration.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Map map) {
            return (Map<String, Object>) Collections.unmodifiableMap(map);
        }
        throw new MalformedEntryException(
                "Unsupported type for "
                        + key
                        + ", expecting a Map, got a "
                        + value.getClass().getName());
    }

    public static <T> T requiredField(
            Map<String, Object> configuration, String name, Supplier<String> definition) {
        Object value = configuration.get(name);
        if (value == null) {
            throw new MalformedEntryException(
                    "Missing required field '" + name + "' in " + definition.get());
        }
        return (T) value;
    }

    public static String requiredNonEmptyField(
            Map<String, Object> configuration, String name, Supplier<String> definition) {
        Object value = configuration.get(name);
        if (value == null || value.toString().isEmpty()) {
            throw new MalformedEntryException(
                    "Missing required field '" + name + "' in " + definition.get());
        }
        return value.toString();
    }

    /**
     * Decode a required list of maps, e.g. the {@code models} of an LLM entry.
     *
     * @param configuration the entry
     * @param name the field
     * @param definition describes the entry in error messages
     * @return the items, in declaration order
     */
    public static List<Map<String, Object>> requiredListOfMaps(
            Map<String, Object> configuration, String name, Supplier<String> definition) {
        Object value = requiredField(configuration, name, definition);
        if (!(value instanceof Collection<?> collection)) {
            throw new MalformedEntryException(
                    "Field '" + name + "' must be a list in " + definition.get());
        }
        List<Map<String, Object>> result = new ArrayList<>(collection.size());
        for (Object item : collection) {
            if (!(item instanceof Map)) {
                throw new MalformedEntryException(
                        "Items of '" + name + "' must be maps, got " + item + " in "
                                + definition.get());
            }
            result.add((Map<String, Object>) item);
        }
        return result;
    }

    /** Copy of the configuration without the given keys, keeping the original order. */
    public static Map<String, Object> without(
            Map<String, Object> configuration, Set<String> excludedKeys) {
        Map<String, Object> result = new LinkedHashMap<>();
        configuration.forEach(
                (k, v) -> {
                    if (!excludedKeys.contains(k)) {
                        result.put(k, v);
                    }
                });
        return result;
    }
}
