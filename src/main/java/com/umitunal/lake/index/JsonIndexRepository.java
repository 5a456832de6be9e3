/*
 * Copyright (c) 2023-2025 Umit Unal
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

package com.umitunal.lake.index;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stores the index as a JSON object of column to file path to entry ({@code indices.json}).
 */
public class JsonIndexRepository implements IndexRepository {
    private static final Logger logger = LoggerFactory.getLogger(JsonIndexRepository.class);

    private static final TypeReference<LinkedHashMap<String, LinkedHashMap<String, ColumnIndexEntry>>> INDEX_TYPE =
        new TypeReference<>() {
        };

    private final Path file;
    private final ObjectMapper objectMapper;

    public JsonIndexRepository(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
    }

    @Override
    public Map<String, Map<String, ColumnIndexEntry>> load() throws IOException {
        if (!Files.exists(file)) {
            return new LinkedHashMap<>();
        }
        Map<String, Map<String, ColumnIndexEntry>> index = new LinkedHashMap<>(objectMapper.readValue(file.toFile(), INDEX_TYPE));
        logger.info("Loaded index for " + index.size() + " columns from " + file);
        return index;
    }

    @Override
    public void save(Map<String, Map<String, ColumnIndexEntry>> index) throws IOException {
        Files.createDirectories(file.getParent());
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        objectMapper.writeValue(temp.toFile(), index);
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
