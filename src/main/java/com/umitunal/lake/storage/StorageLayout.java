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

package com.umitunal.lake.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Directory layout of an engine's data directory.
 *
 * <pre>
 * root/
 *   hot/&lt;dataset&gt;/&lt;tenant&gt;/[&lt;col&gt;=&lt;value&gt;/...]&lt;file&gt;.col
 *   cold/...           same keys, archival tier
 *   backup/&lt;yyyyMMdd&gt;/...  inputs replaced by compaction
 *   wal/               write-ahead log segments
 *   checkpoints/       catalog checkpoints
 *   metadata/catalog.json
 *   index/indices.json
 * </pre>
 *
 * A file is identified everywhere by its key: the path relative to its tier root, with '/' separators.
 */
public final class StorageLayout {

    public static final String DATA_FILE_SUFFIX = ".col";

    private final Path root;

    public StorageLayout(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public void createDirectories() throws IOException {
        for (Path dir : List.of(hotRoot(), coldRoot(), backupRoot(), walDirectory(), checkpointDirectory(),
                catalogFile().getParent(), indexFile().getParent())) {
            Files.createDirectories(dir);
        }
    }

    public Path root() {
        return root;
    }

    public Path hotRoot() {
        return root.resolve("hot");
    }

    public Path coldRoot() {
        return root.resolve("cold");
    }

    public Path backupRoot() {
        return root.resolve("backup");
    }

    public Path walDirectory() {
        return root.resolve("wal");
    }

    public Path checkpointDirectory() {
        return root.resolve("checkpoints");
    }

    public Path catalogFile() {
        return root.resolve("metadata").resolve("catalog.json");
    }

    public Path indexFile() {
        return root.resolve("index").resolve("indices.json");
    }

    /**
     * @return the physical location of a key in the given tier
     */
    public Path resolve(String key, Tier tier) {
        Path tierRoot = tier == Tier.COLD ? coldRoot() : hotRoot();
        Path resolved = tierRoot.resolve(key).normalize();
        if (!resolved.startsWith(tierRoot)) {
            throw new IllegalArgumentException("Key escapes the tier root: " + key);
        }
        return resolved;
    }

    /**
     * @return the key of a file located under the given tier root
     */
    public String keyOf(Path file, Tier tier) {
        Path tierRoot = tier == Tier.COLD ? coldRoot() : hotRoot();
        return toKey(tierRoot.relativize(file.toAbsolutePath().normalize()));
    }

    public Path backupLocation(String dateFolder, String key) {
        return backupRoot().resolve(dateFolder).resolve(key).normalize();
    }

    /**
     * Builds the key of a new data file.
     *
     * @param sourceId the dataset
     * @param tenant the tenant
     * @param partitionSegments ordered {@code col=value} directory names
     * @param fileName the file name, including the suffix
     */
    public static String dataFileKey(String sourceId, String tenant, List<String> partitionSegments, String fileName) {
        List<String> parts = new ArrayList<>(partitionSegments.size() + 3);
        parts.add(sourceId);
        parts.add(tenant);
        parts.addAll(partitionSegments);
        parts.add(fileName);
        return String.join("/", parts);
    }

    /**
     * @return the dataset a key belongs to
     */
    public static String sourceOf(String key) {
        int slash = key.indexOf('/');
        return slash < 0 ? key : key.substring(0, slash);
    }

    /**
     * @return the tenant a key belongs to, or null if the key has no tenant segment
     */
    public static String tenantOf(String key) {
        String[] parts = key.split("/");
        return parts.length > 2 ? parts[1] : null;
    }

    /**
     * @return the key of the directory containing the file, e.g. {@code orders/acme/region=N}
     */
    public static String directoryOf(String key) {
        int slash = key.lastIndexOf('/');
        return slash < 0 ? "" : key.substring(0, slash);
    }

    /**
     * Escapes a partition value so it forms a single safe path segment.
     */
    public static String partitionSegment(String column, Object value) {
        String text = value == null ? "__null__" : value.toString();
        StringBuilder escaped = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            if (c == '/' || c == '\\' || c == '=' || c == '%' || Character.isISOControl(c)) {
                escaped.append('%').append(String.format("%02X", (int) c & 0xFF));
            } else {
                escaped.append(c);
            }
        }
        String segment = escaped.toString();
        if (segment.equals(".") || segment.equals("..")) {
            segment = segment.replace(".", "%2E");
        }
        return column + "=" + segment;
    }

    private static String toKey(Path relative) {
        List<String> parts = new ArrayList<>();
        for (Path part : relative) {
            parts.add(part.toString());
        }
        return String.join("/", parts);
    }
}
