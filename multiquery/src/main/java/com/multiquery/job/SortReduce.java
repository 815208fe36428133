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

import com.multiquery.common.utils.NumberUtils;
import com.multiquery.predicate.FieldPath;
import com.multiquery.query.Direction;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Sorts rows by a numeric field, ascending or descending.
 * <p>
 * Field values are coerced the way {@link NumberUtils#toDouble(Object)} does. Rows whose value
 * cannot be coerced, a missing field or plain text, come after every numeric row in both
 * directions and keep their input order, so sorting on text fields is not supported. The sort
 * is stable.
 *
 * @param field     the field, or dotted path, to sort by
 * @param direction the sort direction
 */
public record SortReduce(String field, Direction direction) implements ReduceStage {

    @Override
    public String type() {
        return "sort";
    }

    public Comparator<QueryResult> comparator() {
        return (a, b) -> {
            double left = NumberUtils.toDouble(FieldPath.resolve(a.document(), field));
            double right = NumberUtils.toDouble(FieldPath.resolve(b.document(), field));
            boolean leftNaN = Double.isNaN(left);
            boolean rightNaN = Double.isNaN(right);
            if (leftNaN || rightNaN) {
                return Boolean.compare(leftNaN, rightNaN);
            }
            return direction == Direction.DESC ? Double.compare(right, left) : Double.compare(left, right);
        };
    }

    @Override
    public List<QueryResult> reduce(List<QueryResult> values, Object argument) {
        List<QueryResult> sorted = new ArrayList<>(values);
        sorted.sort(comparator());
        return sorted;
    }
}
