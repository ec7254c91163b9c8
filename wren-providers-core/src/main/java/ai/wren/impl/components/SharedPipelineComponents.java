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
import java.util.Objects;
import java.util.Set;

/** Hands out the same bundle whatever the pipeline name, used when no configuration is given. */
public class SharedPipelineComponents implements PipelineComponents {

    private final PipelineComponent component;

    SharedPipelineComponents(PipelineComponent component) {
        this.component = Objects.requireNonNull(component);
    }

    @Override
    public PipelineComponent get(String pipelineName) {
        return component;
    }

    @Override
    public boolean contains(String pipelineName) {
        return true;
    }

    @Override
    public Set<String> pipelineNames() {
        return Set.of();
    }

    @Override
    public String toString() {
        return "SharedPipelineComponents(" + component + ")";
    }
}
