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

/**
 * The sort requested by {@link MultiIndexQuery#order(String, String)}.
 *
 * @param field     the field to sort by
 * @param direction the direction as given by the caller
 */
public record Order(String field, String direction) {

    public Direction sortDirection() {
        return Direction.of(direction);
    }
}
