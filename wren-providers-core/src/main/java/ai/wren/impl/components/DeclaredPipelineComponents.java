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

import ai.wren.api.model.PipelineComponent;
import ai.wren.api.model.PipelineComponents;
import java.util.Collections;
import java.util.Map;
import java.util.Set;

/** One bundle per pipeline declared in the configuration. */
public class DeclaredPipelineComponents implements PipelineComponents {

    private final Map<String, PipelineComponent> components;

    DeclaredPipelineComponents(Map<String, PipelineComponent> components) {
        this.components = Collections.unmodifiableMap(components);
    }

    @Override
    public PipelineComponent get(String pipelineName) {
        PipelineComponent component = components.get(pipelineName);
        if (component == null) {
            throw new IllegalArgumentException(
                    "Pipeline "
                            + pipelineName
                            + " is not declared in the configuration, declared: "
                            + components.keySet());
        }
        return component;
    }

    @Override
    public boolean contains(String pipelineName) {
        return components.containsKey(pipelineName);
    }

    @Override
    public Set<String> pipelineNames() {
        return components.keySet();
    }

    @Override
    public String toString() {
        return "DeclaredPipelineComponents" + components;
    }
}
