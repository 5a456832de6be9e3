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

package com.umitunal.lake.query;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Compiles SQL LIKE patterns to regular expressions.
 */
public final class LikePattern {

    private static final int MAX_CACHED = 256;
    private static final Map<String, Pattern> CACHE = new ConcurrentHashMap<>();

    private LikePattern() {
    }

    public static boolean matches(String pattern, String value) {
        if (value == null) {
            return false;
        }
        if (pattern.indexOf('%') < 0 && pattern.indexOf('_') < 0) {
            return value.contains(pattern);
        }
        return compile(pattern).matcher(value).matches();
    }

    static Pattern compile(String pattern) {
        Pattern cached = CACHE.get(pattern);
        if (cached != null) {
            return cached;
        }
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : pattern.toCharArray()) {
            if (c == '%' || c == '_') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '%' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        Pattern compiled = Pattern.compile(regex.toString(), Pattern.DOTALL);
        if (CACHE.size() < MAX_CACHED) {
            CACHE.put(pattern, compiled);
        }
        return compiled;
    }
}
