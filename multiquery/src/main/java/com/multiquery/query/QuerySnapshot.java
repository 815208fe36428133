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

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Immutable copy of a {@link MultiIndexQuery}'s state. Execution reads only the snapshot, so the
 * builder may be modified or reset once {@code run} has returned.
 *
 * @param bucket  the target bucket
 * @param filters the filters in insertion order
 * @param order   the active order, or null
 * @param offset  the result offset
 * @param limit   the result limit, 0 means unbounded
 */
public record QuerySnapshot(String bucket, List<Filter> filters, Order order, int offset, int limit) {

    public QuerySnapshot {
        filters = ImmutableList.copyOf(filters);
    }

    public boolean hasOrder() {
        return order != null;
    }

    public boolean hasLimit() {
        return limit > 0;
    }
}
