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

import ai.wren.api.model.ProviderConfigurationException;
import java.util.Collection;
import lombok.Getter;

@Getter
public class UnknownProviderException extends ProviderConfigurationException {

    private final ProviderKind kind;
    private final String name;

    public UnknownProviderException(ProviderKind kind, String name, Collection<String> available) {
        super(
                "No ProviderConstructor found for "
                        + kind
                        + " provider '"
                        + name
                        + "', available: "
                        + available);
        this.kind = kind;
        this.name = name;
    }
}
