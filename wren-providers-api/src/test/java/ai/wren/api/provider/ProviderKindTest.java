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

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class ProviderKindTest {

    @Test
    void testTypes() {
        assertEquals("llm", ProviderKind.LLM.getType());
        assertEquals("document_store", ProviderKind.DOCUMENT_STORE.toString());
    }

    @Test
    void testContracts() {
        assertEquals(LLMProvider.class, ProviderKind.LLM.getContract());
        assertEquals(EmbedderProvider.class, ProviderKind.EMBEDDER.getContract());
        assertEquals(DocumentStoreProvider.class, ProviderKind.DOCUMENT_STORE.getContract());
        assertEquals(Engine.class, ProviderKind.ENGINE.getContract());
    }
}
