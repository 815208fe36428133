/*
 * Copyright (c) 2023-2025 Burak Sezer
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

package com.multiquery.predicate;

import java.util.Map;

/**
 * Resolves dotted field paths such as {@code address.city} against nested documents.
 */
public final class FieldPath {

    private FieldPath() {
    }

    /**
     * @param document the document to read from
     * @param path     a field name or a dotted path
     * @return the value at the path, or null if any segment is missing or not a document
     */
    public static Object resolve(Map<String, ?> document, String path) {
        if (document.containsKey(path)) {
            return document.get(path);
        }
        Object current = document;
        int start = 0;
        while (start <= path.length()) {
            int dot = path.indexOf('.', start);
            String segment = dot < 0 ? path.substring(start) : path.substring(start, dot);
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(segment);
            if (dot < 0) {
                return current;
            }
            start = dot + 1;
        }
        return null;
    }
}
