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
package ai.wren.api.model;

import java.util.Set;

/** Lookup of the {@link PipelineComponent} to use for a named pipeline. */
public interface PipelineComponents {

    /**
     * @param pipelineName the pipeline name, e.g. "sql_generation"
     * @return the bundle for the pipeline
     * @throws IllegalArgumentException if the pipeline is not known
     */
    PipelineComponent get(String pipelineName);

    boolean contains(String pipelineName);

    /** The names declared in the configuration, empty when every name maps to a shared bundle. */
    Set<String> pipelineNames();
}
