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

/**
 * Lets a caller abandon a running scan. Scans check the token between file reads.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken();

    private volatile boolean cancelled;
    private volatile String reason;

    /**
     * @return a shared token that is never cancelled
     */
    public static CancellationToken none() {
        return NONE;
    }

    public void cancel(String reason) {
        if (this == NONE) {
            throw new UnsupportedOperationException("The shared token cannot be cancelled");
        }
        this.reason = reason;
        this.cancelled = true;
    }

    public void cancel() {
        cancel("cancelled by caller");
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * @throws QueryCancelledException if the token has been cancelled
     */
    public void throwIfCancelled() {
        if (cancelled) {
            throw new QueryCancelledException(reason);
        }
    }
}
