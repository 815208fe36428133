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
 * Raised at execution time when a filter carries an operator outside {@code ==, >, >=, <, <=}.
 */
public class InvalidOperatorException extends MultiQueryException {
    private final String operator;

    public InvalidOperatorException(String operator) {
        super(String.format("Invalid operator %s", operator));
        this.operator = operator;
    }

    public String getOperator() {
        return operator;
    }
}
