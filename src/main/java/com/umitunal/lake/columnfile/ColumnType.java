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

import java.util.Collection;

/**
 * Physical type of a column in a column file.
 */
public enum ColumnType {
    LONG((byte) 1),
    DOUBLE((byte) 2),
    STRING((byte) 3),
    BOOLEAN((byte) 4);

    private final byte code;

    ColumnType(byte code) {
        this.code = code;
    }

    public byte code() {
        return code;
    }

    public static ColumnType fromCode(byte code) {
        for (ColumnType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown column type code: " + code);
    }

    /**
     * Infers the narrowest type able to hold every non-null value.
     * Integral numbers widen to DOUBLE when mixed with fractional ones; any other mix is STRING.
     */
    public static ColumnType infer(Collection<?> values) {
        boolean sawLong = false;
        boolean sawDouble = false;
        boolean sawBoolean = false;
        boolean sawOther = false;
        for (Object value : values) {
            if (value == null) {
                continue;
            }
            if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
                sawLong = true;
            } else if (value instanceof Number) {
                sawDouble = true;
            } else if (value instanceof Boolean) {
                sawBoolean = true;
            } else {
                sawOther = true;
            }
        }
        if (sawOther || (sawBoolean && (sawLong || sawDouble))) {
            return STRING;
        }
        if (sawBoolean) {
            return BOOLEAN;
        }
        if (sawDouble) {
            return DOUBLE;
        }
        if (sawLong) {
            return LONG;
        }
        return STRING;
    }

    /**
     * Converts a value to this type's canonical Java representation.
     */
    public Object normalize(Object value) {
        if (value == null) {
            return null;
        }
        return switch (this) {
            case LONG -> ((Number) value).longValue();
            case DOUBLE -> ((Number) value).doubleValue();
            case BOOLEAN -> (Boolean) value;
            case STRING -> value.toString();
        };
    }
}
