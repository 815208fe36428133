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

package com.multiquery.query;

import com.multiquery.common.utils.Utils;

/**
 * A single query condition. The operator is kept exactly as the caller wrote it and is only
 * validated when the query runs.
 *
 * @param field    the document field, dotted paths address nested fields
 * @param operator the comparison operator symbol
 * @param value    a string or a number
 */
public record Filter(String field, String operator, Object value) {

    /**
     * Renders a filter value as a literal: strings are single-quoted, everything else is printed as is.
     */
    static String literal(Object value) {
        if (value instanceof CharSequence cs) {
            return Utils.quote(cs.toString());
        }
        return String.valueOf(value);
    }

    @Override
    public String toString() {
        return String.format("%s %s %s", field, operator, literal(value));
    }
}
