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

import ai.wren.api.model.ProviderConfigurationException;
import ai.wren.api.provider.ProviderKind;
import lombok.Getter;

@Getter
public class UnresolvedReferenceException extends ProviderConfigurationException {

    private final String pipeline;
    private final ProviderKind kind;
    private final String identifier;

    public UnresolvedReferenceException(String pipeline, ProviderKind kind, String identifier) {
        super(
                "Pipeline "
                        + pipeline
                        + " references unknown "
                        + kind
                        + " provider '"
                        + identifier
                        + "'");
        this.pipeline = pipeline;
        this.kind = kind;
        this.identifier = identifier;
    }
}
