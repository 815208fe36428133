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

package com.multiquery.job;

import com.google.common.base.Preconditions;

import java.util.List;

/**
 * Keeps the rows in {@code [start, end)}. Indices follow {@code Array.prototype.slice}: a negative
 * index counts from the end of the list and out-of-range indices are clamped.
 * <p>
 * The window is registered with the store as the phase argument, a two element list
 * {@code [start, end]}; the record components are used when the store passes no argument.
 *
 * @param start the first index, inclusive
 * @param end   the last index, exclusive
 */
public record SliceReduce(long start, long end) implements ReduceStage {

    /**
     * Builds the window for an offset/limit pair.
     *
     * @param offset the number of rows to skip
     * @param limit  the number of rows to keep, must be positive
     * @return the slice {@code [offset, offset + limit)}
     */
    public static SliceReduce window(int offset, int limit) {
        Preconditions.checkArgument(limit > 0, "limit must be positive");
        return new SliceReduce(offset, (long) offset + limit);
    }

    private static int normalize(long index, int size) {
        if (index < 0) {
            return (int) Math.max(size + index, 0);
        }
        return (int) Math.min(index, size);
    }

    @Override
    public String type() {
        return "slice";
    }

    @Override
    public Object argument() {
        return List.of(start, end);
    }

    @Override
    public List<QueryResult> reduce(List<QueryResult> values, Object argument) {
        long from = start;
        long to = end;
        if (argument instanceof List<?> window && window.size() == 2) {
            from = ((Number) window.get(0)).longValue();
            to = ((Number) window.get(1)).longValue();
        }
        int size = values.size();
        int fromIndex = normalize(from, size);
        int toIndex = normalize(to, size);
        if (fromIndex >= toIndex) {
            return List.of();
        }
        return List.copyOf(values.subList(fromIndex, toIndex));
    }
}
