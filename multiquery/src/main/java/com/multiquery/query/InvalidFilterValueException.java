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

import com.multiquery.common.MultiQueryException;

/**
 * Raised at execution time when a filter value is neither text nor a number.
 */
public class InvalidFilterValueException extends MultiQueryException {

    public InvalidFilterValueException(String field, Object value) {
        super(String.format("Invalid value for field '%s': %s, expected a string or a number",
                field, value == null ? "null" : value.getClass().getSimpleName()));
    }
}
