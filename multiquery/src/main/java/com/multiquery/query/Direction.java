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

public enum Direction {
    ASC,
    DESC;

    /**
     * Parses a sort direction leniently: only the exact string {@code DESC} selects a descending
     * sort, everything else, null included, is ascending.
     *
     * @param value the direction given by the caller
     * @return the resolved direction
     */
    public static Direction of(String value) {
        return DESC.name().equals(value) ? DESC : ASC;
    }
}
