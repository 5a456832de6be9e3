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

package com.umitunal.lake.wal.record;

import java.util.Map;

/**
 * One record of the write-ahead log.
 * An operation is logged as PENDING before it is applied; its outcome is appended later as a
 * second record with the same operation id. Records are never rewritten.
 *
 * @param operationId id shared by every record of one operation
 * @param kind the mutation being guarded
 * @param payload operation details, e.g. the files written
 * @param timestamp time the record was created, in epoch millis
 * @param status state of the operation as of this record
 * @param error failure message for FAILED records, otherwise null
 */
public record WalEntry(
    String operationId,
    OperationKind kind,
    Map<String, Object> payload,
    long timestamp,
    OperationStatus status,
    String error
) {

    public WalEntry {
        if (operationId == null || operationId.isBlank()) {
            throw new IllegalArgumentException("operationId must not be blank");
        }
        if (kind == null || status == null) {
            throw new IllegalArgumentException("kind and status must not be null");
        }
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public static WalEntry pending(String operationId, OperationKind kind, Map<String, Object> payload, long timestamp) {
        return new WalEntry(operationId, kind, payload, timestamp, OperationStatus.PENDING, null);
    }

    public static WalEntry completed(String operationId, OperationKind kind, Map<String, Object> payload, long timestamp) {
        return new WalEntry(operationId, kind, payload, timestamp, OperationStatus.COMPLETED, null);
    }

    public static WalEntry failed(String operationId, OperationKind kind, String error, long timestamp) {
        return new WalEntry(operationId, kind, Map.of(), timestamp, OperationStatus.FAILED,
            error == null ? "unknown error" : error);
    }
}
