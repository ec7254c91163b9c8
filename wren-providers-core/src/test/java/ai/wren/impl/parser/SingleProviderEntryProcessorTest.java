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

import ai.wren.api.model.MalformedEntryException;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SingleProviderEntryProcessorTest {

    @Test
    void testDocumentStore() {
        Map<String, Object> entry =
                Map.of(
                        "type",
                        "document_store",
                        "provider",
                        "qdrant",
                        "location",
                        "http://localhost:6333",
                        "embedding_model_dim",
                        3072,
                        "timeout",
                        120,
                        "recreate_index",
                        false);
        Map<String, Map<String, Object>> result =
                new SingleProviderEntryProcessor(EntryKind.DOCUMENT_STORE).process(entry);

        assertEquals(Set.of("qdrant"), result.keySet());
        Set<String> expectedKeys = new HashSet<>(entry.keySet());
        expectedKeys.remove("type");
        assertEquals(expectedKeys, result.get("qdrant").keySet());
        assertEquals(false, result.get("qdrant").get("recreate_index"));
    }

    @Test
    void testEngine() {
        Map<String, Map<String, Object>> result =
                new SingleProviderEntryProcessor(EntryKind.ENGINE)
                        .process(
                                Map.of(
                                        "type",
                                        "engine",
                                        "provider",
                                        "wren_ui",
                                        "kwargs",
                                        Map.of("host", "localhost", "port", 8000)));
        assertEquals(
                Map.of(
                        "wren_ui",
                        Map.of(
                                "provider",
                                "wren_ui",
                                "kwargs",
                                Map.of("host", "localhost", "port", 8000))),
                result);
    }

    @Test
    void testProviderIsRequired() {
        assertThrows(
                MalformedEntryException.class,
                () ->
                        new SingleProviderEntryProcessor(EntryKind.ENGINE)
                                .process(Map.of("type", "engine")));
    }
}
