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

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

public interface DocumentStoreProvider {

    CompletableFuture<Void> write(String dataset, List<Map<String, Object>> documents);

    /**
     * Find the documents closest to the given embedding.
     *
     * @param dataset the collection to search
     * @param embedding the query vector
     * @param topK maximum number of documents returned
     * @return the matching documents, best match first
     */
    CompletableFuture<List<Map<String, Object>>> query(
            String dataset, List<Double> embedding, int topK);
}
