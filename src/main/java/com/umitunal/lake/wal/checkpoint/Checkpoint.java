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

package com.umitunal.lake.wal.checkpoint;

import com.umitunal.lake.catalog.FileMetadata;

import java.util.List;

/**
 * A catalog snapshot plus the log segment replay resumes from.
 *
 * @param createdAt time the checkpoint was taken, in epoch millis
 * @param segment name of the segment that was active when the snapshot was taken
 * @param files the catalog entries at that moment
 */
public record Checkpoint(long createdAt, String segment, List<FileMetadata> files) {

    public Checkpoint {
        files = files == null ? List.of() : List.copyOf(files);
    }
}
