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

package com.umitunal.lake.wal;

/**
 * Outcome of a log replay.
 *
 * @param segmentsRead number of segments read
 * @param entriesApplied number of entries handed to the handler
 * @param entriesSkipped number of frames that could not be decoded
 * @param handlerErrors number of entries the handler rejected with an exception
 */
public record ReplayResult(int segmentsRead, long entriesApplied, long entriesSkipped, long handlerErrors) {
}
