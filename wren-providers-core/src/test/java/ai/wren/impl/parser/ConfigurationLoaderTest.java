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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.wren.api.model.MalformedEntryException;
import ai.wren.api.provider.ProviderKind;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ConfigurationLoaderTest {

    @Test
    void testLoadConfigFile() throws Exception {
        Path path = Paths.get(ConfigurationLoaderTest.class.getResource("/config.yaml").toURI());
        List<Map<String, Object>> entries = ConfigurationLoader.load(path);

        assertEquals(5, entries.size());
        assertEquals(
                List.of("llm", "embedder", "engine", "document_store", "pipeline"),
                entries.stream().map(e -> e.get("type")).toList());

        Configuration configuration = ConfigurationTransformer.transform(entries);
        Map<String, Object> gpt4oMini =
                configuration.providers(ProviderKind.LLM).get("openai_llm.gpt-4o-mini");
        assertEquals("https://api.openai.com/v1", gpt4oMini.get("api_base"));
        assertEquals(
                Map.of("type", "json_object"),
                ((Map<String, Object>) gpt4oMini.get("kwargs")).get("response_format"));
        assertEquals(
                3072,
                configuration
                        .providers(ProviderKind.EMBEDDER)
                        .get("openai_embedder.text-embedding-3-large")
                        .get("dimension"));
        assertEquals(5, configuration.pipelines().size());
    }

    @Test
    void testParseSkipsEmptyDocuments() {
        List<Map<String, Object>> entries =
                ConfigurationLoader.parse(
                        """
                        ---
                        type: engine
                        provider: wren_ui
                        ---
                        ---
                        type: document_store
                        provider: qdrant
                        """);
        assertEquals(2, entries.size());
        assertTrue(ConfigurationLoader.parse("   ").isEmpty());
    }

    @Test
    void testDocumentMustBeAMap() {
        assertThrows(
                MalformedEntryException.class,
                () -> ConfigurationLoader.parse("- type: llm\n- type: embedder\n"));
    }

    @Test
    void testInvalidYaml() {
        assertThrows(
                IllegalArgumentException.class,
                () -> ConfigurationLoader.parse("type: [llm, embedder\nprovider: openai_llm\n"));
    }

    @Test
    void testMissingFile() throws Exception {
        Path dir = Files.createTempDirectory("wren");
        assertThrows(
                IllegalArgumentException.class,
                () -> ConfigurationLoader.load(dir.resolve("config.yaml")));
    }
}
