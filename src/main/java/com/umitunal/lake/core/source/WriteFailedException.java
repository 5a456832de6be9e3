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

import java.io.IOException;

/**
 * Thrown when a write fails after its log entry was recorded. The entry is marked failed;
 * files already written are not rolled back.
 */
public class WriteFailedException extends IOException {

    private final String operationId;

    public WriteFailedException(String operationId, String message, Throwable cause) {
        super("Write " + operationId + " failed: " + message, cause);
        this.operationId = operationId;
    }

    public String getOperationId() {
        return operationId;
    }
}
