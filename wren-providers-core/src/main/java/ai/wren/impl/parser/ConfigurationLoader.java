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

import ai.wren.api.model.MalformedEntryException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/** Reads the configuration file, a YAML stream with one entry per document. */
@Slf4j
public class ConfigurationLoader {

    static final ObjectMapper yamlParser = new ObjectMapper(new YAMLFactory());

    private ConfigurationLoader() {}

    public static List<Map<String, Object>> load(Path path) {
        log.info("Loading configuration from {}", path.toAbsolutePath());
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read the configuration file " + path, e);
        }
        return parse(content, path.toString());
    }

    public static List<Map<String, Object>> parse(String content) {
        return parse(content, "configuration");
    }

    private static List<Map<String, Object>> parse(String content, String source) {
        List<Map<String, Object>> entries = new ArrayList<>();
        if (StringUtils.isBlank(content)) {
            return entries;
        }
        try (MappingIterator<Object> documents =
                yamlParser.readerFor(Object.class).readValues(content)) {
            while (documents.hasNextValue()) {
                Object document = documents.nextValue();
                if (document == null) {
                    continue;
                }
                if (!(document instanceof Map)) {
                    throw new MalformedEntryException(
                            "Every document of the "
                                    + source
                                    + " must be a map, got: "
                                    + document);
                }
                entries.add((Map<String, Object>) document);
            }
        } catch (IOException e) {
            throw new IllegalArgumentException(
                    "The " + source + " is not valid YAML (" + e.getMessage() + ")", e);
        }
        log.debug("Parsed {} entries from the {}", entries.size(), source);
        return entries;
    }
}
