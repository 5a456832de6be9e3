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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Groups files by the sorted set of their column names.
 * Not thread-safe; the owning catalog serializes access.
 */
class SchemaRegistry {

    private final Map<List<String>, Signature> signatures = new HashMap<>();
    private final Map<String, List<String>> signatureByPath = new HashMap<>();

    private static final class Signature {
        final long firstSeen;
        long lastUpdated;
        final Set<String> paths = new HashSet<>();

        Signature(long firstSeen) {
            this.firstSeen = firstSeen;
            this.lastUpdated = firstSeen;
        }
    }

    static List<String> signatureOf(Collection<String> columns) {
        return List.copyOf(new TreeSet<>(columns));
    }

    void register(FileMetadata metadata, long now) {
        unregister(metadata.path());
        List<String> signature = signatureOf(metadata.columns());
        Signature entry = signatures.computeIfAbsent(signature, k -> new Signature(now));
        entry.lastUpdated = Math.max(entry.lastUpdated, now);
        entry.paths.add(metadata.path());
        signatureByPath.put(metadata.path(), signature);
    }

    void unregister(String path) {
        List<String> signature = signatureByPath.remove(path);
        if (signature == null) {
            return;
        }
        Signature entry = signatures.get(signature);
        entry.paths.remove(path);
        if (entry.paths.isEmpty()) {
            signatures.remove(signature);
        }
    }

    void clear() {
        signatures.clear();
        signatureByPath.clear();
    }

    Optional<SchemaInfo> schemaFor(String path) {
        List<String> signature = signatureByPath.get(path);
        return signature == null ? Optional.empty() : Optional.of(toInfo(signature, signatures.get(signature)));
    }

    boolean satisfies(String path, Collection<String> requiredColumns) {
        List<String> signature = signatureByPath.get(path);
        return signature != null && signature.containsAll(requiredColumns);
    }

    List<SchemaInfo> schemas() {
        List<SchemaInfo> result = new ArrayList<>(signatures.size());
        signatures.forEach((signature, entry) -> result.add(toInfo(signature, entry)));
        result.sort(Comparator.comparingLong(SchemaInfo::firstSeen));
        return result;
    }

    int size() {
        return signatures.size();
    }

    private static SchemaInfo toInfo(List<String> signature, Signature entry) {
        return new SchemaInfo(signature, entry.firstSeen, entry.lastUpdated, entry.paths.size());
    }
}
