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
package ai.wren.impl.components;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import ai.wren.api.model.MalformedEntryException;
import ai.wren.api.model.ProviderConfigurationException;
import ai.wren.api.provider.Engine;
import ai.wren.api.provider.LLMProvider;
import ai.wren.api.provider.ProviderConstructor;
import ai.wren.api.provider.ProviderKind;
import ai.wren.api.provider.ProviderRegistry;
import ai.wren.api.provider.UnknownProviderException;
import ai.wren.impl.parser.Configuration;
import ai.wren.impl.parser.ConfigurationTransformer;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ProviderFactoryTest {

    private static ProviderConstructor constructor(ProviderKind kind, String name) {
        ProviderConstructor constructor = mock(ProviderConstructor.class);
        when(constructor.getKind()).thenReturn(kind);
        when(constructor.getName()).thenReturn(name);
        return constructor;
    }

    @Test
    void testCreatePassesTheWholeConfiguration() {
        ProviderRegistry registry = new ProviderRegistry();
        ProviderConstructor constructor = constructor(ProviderKind.LLM, "openai_llm");
        LLMProvider llm = mock(LLMProvider.class);
        when(constructor.createImplementation(any())).thenReturn(llm);
        registry.register(constructor);

        Map<String, Object> configuration =
                Map.of(
                        "provider",
                        "openai_llm",
                        "model",
                        "gpt-4o-mini",
                        "kwargs",
                        Map.of("temperature", 0));
        LLMProvider created = new ProviderFactory(registry).create(ProviderKind.LLM, configuration);

        assertSame(llm, created);
        verify(constructor).createImplementation(eq(configuration));
    }

    @Test
    void testUnknownProvider() {
        ProviderFactory factory = new ProviderFactory(new ProviderRegistry());
        UnknownProviderException error =
                assertThrows(
                        UnknownProviderException.class,
                        () -> factory.create(ProviderKind.ENGINE, Map.of("provider", "wren_ibis")));
        assertEquals("wren_ibis", error.getName());
        assertThrows(
                MalformedEntryException.class,
                () -> factory.create(ProviderKind.ENGINE, Map.of("endpoint", "http://x")));
    }

    @Test
    void testInstanceMustImplementTheKindContract() {
        ProviderRegistry registry = new ProviderRegistry();
        ProviderConstructor constructor = constructor(ProviderKind.ENGINE, "wren_ui");
        when(constructor.createImplementation(any())).thenReturn(mock(LLMProvider.class));
        registry.register(constructor);

        assertThrows(
                ProviderConfigurationException.class,
                () ->
                        new ProviderFactory(registry)
                                .create(ProviderKind.ENGINE, Map.of("provider", "wren_ui")));
    }

    @Test
    void testInstantiateAllStopsAtTheFirstUnknownProvider() {
        ProviderRegistry registry = new ProviderRegistry();
        ProviderConstructor engine = constructor(ProviderKind.ENGINE, "wren_ui");
        when(engine.createImplementation(any())).thenReturn(mock(Engine.class));
        registry.register(engine);

        Configuration configuration =
                ConfigurationTransformer.transform(
                        List.of(
                                Map.of(
                                        "type",
                                        "llm",
                                        "provider",
                                        "litellm_llm",
                                        "models",
                                        List.of(Map.of("model", "gpt-4o"))),
                                Map.of("type", "engine", "provider", "wren_ui")));

        assertThrows(
                UnknownProviderException.class,
                () -> new ProviderFactory(registry).instantiateAll(configuration));
        verify(engine, never()).createImplementation(any());
    }

    @Test
    void testInstantiateAll() {
        ProviderRegistry registry = new ProviderRegistry();
        ProviderConstructor engine = constructor(ProviderKind.ENGINE, "wren_ui");
        Engine instance = mock(Engine.class);
        when(engine.createImplementation(any())).thenReturn(instance);
        registry.register(engine);

        InstantiatedProviders providers =
                new ProviderFactory(registry)
                        .instantiateAll(
                                ConfigurationTransformer.transform(
                                        List.of(Map.of("type", "engine", "provider", "wren_ui"))));

        assertSame(instance, providers.get(ProviderKind.ENGINE, "wren_ui"));
        assertNull(providers.get(ProviderKind.ENGINE, "wren_ibis"));
        assertNull(providers.get(ProviderKind.ENGINE, null));
    }
}
