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

package com.umitunal.lake.core.source;

import com.umitunal.lake.api.CancellationToken;
import com.umitunal.lake.api.RecordBatch;
import com.umitunal.lake.api.RecordBatchIterator;
import com.umitunal.lake.catalog.FileMetadata;
import com.umitunal.lake.columnfile.ColumnFileData;
import com.umitunal.lake.columnfile.ColumnFileIO;
import com.umitunal.lake.query.QueryFilter;
import com.umitunal.lake.storage.StorageLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Reads candidate files one at a time and yields one batch per file with matching rows.
 * Offset and limit apply across files.
 */
class FileScanIterator implements RecordBatchIterator {
    private static final Logger logger = LoggerFactory.getLogger(FileScanIterator.class);

    private final String sourceId;
    private final List<FileMetadata> files;
    private final QueryFilter filter;
    private final Integer limit;
    private final CancellationToken token;
    private final StorageLayout layout;
    private final ColumnFileIO columnFileIO;

    private int fileIndex;
    private long toSkip;
    private long returned;
    private RecordBatch next;
    private boolean closed;

    FileScanIterator(String sourceId, List<FileMetadata> files, QueryFilter filter, Integer limit, int offset,
                     CancellationToken token, StorageLayout layout, ColumnFileIO columnFileIO) {
        this.sourceId = sourceId;
        this.files = files;
        this.filter = filter;
        this.limit = limit;
        this.toSkip = offset;
        this.token = token;
        this.layout = layout;
        this.columnFileIO = columnFileIO;
    }

    @Override
    public boolean hasNext() {
        if (next != null) {
            return true;
        }
        while (!closed && !limitReached() && fileIndex < files.size()) {
            token.throwIfCancelled();
            FileMetadata file = files.get(fileIndex++);
            List<Map<String, Object>> rows = readMatching(file);
            if (!rows.isEmpty()) {
                next = new RecordBatch(sourceId, file.path(), rows);
                returned += rows.size();
                return true;
            }
        }
        return false;
    }

    @Override
    public RecordBatch next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        RecordBatch batch = next;
        next = null;
        return batch;
    }

    @Override
    public long rowsReturned() {
        return returned;
    }

    @Override
    public void close() {
        closed = true;
        next = null;
    }

    private boolean limitReached() {
        return limit != null && returned >= limit;
    }

    private List<Map<String, Object>> readMatching(FileMetadata file) {
        ColumnFileData data;
        try {
            data = columnFileIO.read(layout.resolve(file.path(), file.tier()));
        } catch (IOException e) {
            logger.warn("Skipping unreadable file " + file.path() + ": " + e.getMessage());
            return List.of();
        }
        List<Map<String, Object>> matching = new ArrayList<>();
        for (Map<String, Object> row : data.rows()) {
            if (!filter.matches(row)) {
                continue;
            }
            if (toSkip > 0) {
                toSkip--;
                continue;
            }
            matching.add(row);
            if (limit != null && returned + matching.size() >= limit) {
                break;
            }
        }
        return matching;
    }
}
