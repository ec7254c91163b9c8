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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.wren.api.model.MalformedEntryException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ConfigurationUtilsTest {

    @Test
    void testRequiredField() {
        MalformedEntryException error =
                assertThrows(
                        MalformedEntryException.class,
                        () ->
                                ConfigurationUtils.requiredField(
                                        Map.of(), "models", () -> "llm entry"));
        assertEquals("Missing required field 'models' in llm entry", error.getMessage());
        assertEquals(
                "x", ConfigurationUtils.requiredNonEmptyField(Map.of("a", "x"), "a", () -> "e"));
        assertThrows(
                MalformedEntryException.class,
                () -> ConfigurationUtils.requiredNonEmptyField(Map.of("a", ""), "a", () -> "e"));
    }

    @Test
    void testRequiredListOfMaps() {
        List<Map<String, Object>> models =
                ConfigurationUtils.requiredListOfMaps(
                        Map.of("models", List.of(Map.of("model", "a"), Map.of("model", "b"))),
                        "models",
                        () -> "e");
        assertEquals(2, models.size());
        assertEquals("b", models.get(1).get("model"));

        assertThrows(
                MalformedEntryException.class,
                () ->
                        ConfigurationUtils.requiredListOfMaps(
                                Map.of("models", "gpt-4o"), "models", () -> "e"));
        assertThrows(
                MalformedEntryException.class,
                () ->
                        ConfigurationUtils.requiredListOfMaps(
                                Map.of("models", List.of("gpt-4o")), "models", () -> "e"));
    }

    @Test
    void testGetMap() {
        assertEquals(
                Map.of("n", 1),
                ConfigurationUtils.getMap("kwargs", null, Map.of("kwargs", Map.of("n", 1))));
        assertTrue(ConfigurationUtils.getMap("kwargs", Map.of(), Map.of()).isEmpty());
        Map<String, Object> kwargs = new LinkedHashMap<>();
        Map<String, Object> read =
                ConfigurationUtils.getMap("kwargs", null, Map.of("kwargs", kwargs));
        assertThrows(UnsupportedOperationException.class, () -> read.put("n", 2));
        assertTrue(kwargs.isEmpty());
        assertThrows(
                MalformedEntryException.class,
                () -> ConfigurationUtils.getMap("kwargs", null, Map.of("kwargs", "n=1")));
    }

    @Test
    void testWithout() {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("type", "llm");
        entry.put("provider", "openai_llm");
        entry.put("api_base", "http://localhost");
        Map<String, Object> result = ConfigurationUtils.without(entry, Set.of("type"));
        assertEquals(List.of("provider", "api_base"), List.copyOf(result.keySet()));
        assertEquals(3, entry.size());
    }
}
