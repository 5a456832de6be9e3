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

package com.umitunal.lake.catalog;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stores the catalog as one JSON object keyed by file path.
 * Writes go to a temporary file that atomically replaces the previous version.
 */
public class JsonCatalogRepository implements CatalogRepository {
    private static final Logger logger = LoggerFactory.getLogger(JsonCatalogRepository.class);

    private static final TypeReference<LinkedHashMap<String, FileMetadata>> CATALOG_TYPE = new TypeReference<>() {
    };

    private final Path file;
    private final ObjectMapper objectMapper;

    public JsonCatalogRepository(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<FileMetadata> load() throws IOException {
        if (!Files.exists(file)) {
            return List.of();
        }
        Map<String, FileMetadata> stored = objectMapper.readValue(file.toFile(), CATALOG_TYPE);
        logger.info("Loaded " + stored.size() + " catalog entries from " + file);
        return new ArrayList<>(stored.values());
    }

    @Override
    public void save(Collection<FileMetadata> entries) throws IOException {
        Map<String, FileMetadata> byPath = new LinkedHashMap<>();
        for (FileMetadata entry : entries) {
            byPath.put(entry.path(), entry);
        }
        Files.createDirectories(file.getParent());
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        objectMapper.writeValue(temp.toFile(), byPath);
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
