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

package com.multiquery.planner;

import com.google.common.base.Preconditions;
import com.multiquery.query.Filter;
import com.multiquery.query.InvalidFilterValueException;
import com.multiquery.query.Operator;

/**
 * Translates a filter into a secondary index lookup.
 * <p>
 * Text values use the {@code <field>_bin} index with empty strings as open bounds; numbers use the
 * {@code <field>_int} index with {@code +bound}/{@code -bound} standing in for the open side,
 * because integer range lookups need concrete bounds. Strict and non-strict comparisons map to the
 * same inclusive range: the map stage of the job applies the exact operator afterwards.
 */
public class IndexLookupTranslator {
    private final long integerBound;

    public IndexLookupTranslator(long integerBound) {
        Preconditions.checkArgument(integerBound > 0, "integerBound must be positive");
        this.integerBound = integerBound;
    }

    public long integerBound() {
        return integerBound;
    }

    /**
     * Classifies a filter value.
     *
     * @param field the filtered field, used in the error message
     * @param value the filter value
     * @return {@link IndexKind#BIN} for text, {@link IndexKind#INT} for numbers
     * @throws InvalidFilterValueException for any other value, null included
     */
    public IndexKind classify(String field, Object value) {
        if (value instanceof CharSequence) {
            return IndexKind.BIN;
        }
        if (value instanceof Number) {
            return IndexKind.INT;
        }
        throw new InvalidFilterValueException(field, value);
    }

    /**
     * @param bucket the bucket to look up
     * @param filter the filter to translate
     * @return the lookup
     * @throws com.multiquery.query.InvalidOperatorException if the filter operator is not supported
     * @throws InvalidFilterValueException                    if the value is neither text nor a number
     */
    public IndexLookup translate(String bucket, Filter filter) {
        Operator operator = Operator.fromSymbol(filter.operator());
        IndexKind kind = classify(filter.field(), filter.value());
        String index = kind.indexName(filter.field());

        Object value = kind == IndexKind.BIN ? filter.value().toString() : filter.value();
        Object max = kind == IndexKind.BIN ? "" : integerBound;
        Object min = kind == IndexKind.BIN ? "" : -integerBound;

        return switch (operator) {
            case EQ -> new IndexLookup.Exact(bucket, index, kind, value);
            case GT, GTE -> new IndexLookup.Range(bucket, index, kind, value, max);
            case LT, LTE -> new IndexLookup.Range(bucket, index, kind, min, value);
        };
    }
}
