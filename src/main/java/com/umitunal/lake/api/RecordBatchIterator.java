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

package com.umitunal.lake.api;

import java.util.Iterator;

/**
 * Lazy sequence of record batches. Files are read only as batches are requested;
 * closing the iterator stops further reads.
 */
public interface RecordBatchIterator extends Iterator<RecordBatch>, AutoCloseable {

    /**
     * @return number of rows returned so far
     */
    long rowsReturned();

    @Override
    void close();
}
