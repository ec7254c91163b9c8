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

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Holds the {@link ProviderConstructor}s known to the service, keyed by kind and name.
 *
 * <p>Constructors are added either by {@link #discover()}, which scans the classpath with {@link
 * ServiceLoader}, or explicitly with {@link #register(ProviderConstructor)}. One registry is
 * created at startup and handed to whatever needs to build providers.
 */
@Slf4j
public class ProviderRegistry {

    private final Map<ProviderKind, Map<String, ProviderConstructor>> constructors =
            new EnumMap<>(ProviderKind.class);
    private final ClassLoader classLoader;
    private boolean discovered;

    public ProviderRegistry() {
        this(ProviderRegistry.class.getClassLoader());
    }

    public ProviderRegistry(ClassLoader classLoader) {
        this.classLoader = classLoader;
        for (ProviderKind kind : ProviderKind.values()) {
            constructors.put(kind, new LinkedHashMap<>());
        }
    }

    /** Load all the constructors available on the classpath. Only the first call has effect. */
    public synchronized void discover() {
        if (discovered) {
            return;
        }
        ServiceLoader<ProviderConstructor> loader =
                ServiceLoader.load(ProviderConstructor.class, classLoader);
        loader.stream().map(ServiceLoader.Provider::get).forEach(this::register);
        discovered = true;
        for (ProviderKind kind : ProviderKind.values()) {
            log.info("Available {} providers: {}", kind, constructors.get(kind).keySet());
        }
    }

    public synchronized void register(ProviderConstructor constructor) {
        Objects.requireNonNull(constructor, "constructor cannot be null");
        ProviderKind kind = Objects.requireNonNull(constructor.getKind(), "kind cannot be null");
        String name = Objects.requireNonNull(constructor.getName(), "name cannot be null");
        ProviderConstructor previous = constructors.get(kind).put(name, constructor);
        if (previous != null && previous != constructor) {
            log.warn(
                    "Replacing {} provider {} ({}) with {}",
                    kind,
                    name,
                    previous.getClass().getName(),
                    constructor.getClass().getName());
        }
    }

    public synchronized ProviderConstructor resolve(ProviderKind kind, String name) {
        Objects.requireNonNull(kind, "kind cannot be null");
        ProviderConstructor constructor = name == null ? null : constructors.get(kind).get(name);
        if (constructor == null) {
            throw new UnknownProviderException(kind, name, registeredNames(kind));
        }
        return constructor;
    }

    public synchronized Set<String> registeredNames(ProviderKind kind) {
        return Set.copyOf(constructors.get(kind).keySet());
    }

    public synchronized boolean isDiscovered() {
        return discovered;
    }
}
