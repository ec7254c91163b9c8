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

import java.util.Map;

/**
 * Normalizes one raw configuration entry. Implementations are stateless and never modify the
 * entry they receive.
 *
 * @param <T> the normalized value
 */
public interface EntryProcessor<T> {

    /**
     * @param entry the raw entry, including its {@code type}
     * @return the normalized values keyed by their identifier, in declaration order
     * @throws ai.wren.api.model.MalformedEntryException if a required field is missing
     */
    Map<String, T> process(Map<String, Object> entry);
}
