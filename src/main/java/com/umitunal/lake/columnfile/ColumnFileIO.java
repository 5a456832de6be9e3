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

package com.umitunal.lake.columnfile;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Interface for reading and writing column files.
 * A column file stores a batch of rows column by column with a self-describing header,
 * so row count, schema and time range can be recovered from the file alone.
 */
public interface ColumnFileIO {

    /**
     * Writes rows to a new column file. The file appears atomically at {@code path}.
     *
     * @param path destination
     * @param rows the rows; every row may carry a different subset of columns
     * @param writeId id of the producing write
     * @param createdAt creation time in epoch millis
     * @param compress whether to deflate column blocks
     * @return the header facts of the written file
     * @throws IOException if an I/O error occurs
     */
    ColumnFileInfo write(Path path, List<Map<String, Object>> rows, long writeId, long createdAt, boolean compress)
        throws IOException;

    /**
     * Reads and verifies a whole column file.
     *
     * @throws IOException if the file cannot be read or fails verification
     */
    ColumnFileData read(Path path) throws IOException;

    /**
     * Reads only the header of a column file.
     *
     * @throws IOException if the file cannot be read or is not a column file
     */
    ColumnFileInfo readInfo(Path path) throws IOException;
}
