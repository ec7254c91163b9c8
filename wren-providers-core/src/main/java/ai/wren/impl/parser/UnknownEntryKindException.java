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

import ai.wren.api.model.ProviderConfigurationException;
import lombok.Getter;

@Getter
public class UnknownEntryKindException extends ProviderConfigurationException {

    private final String type;

    public UnknownEntryKindException(String type) {
        super("Unknown type: " + type);
        this.type = type;
    }
}
