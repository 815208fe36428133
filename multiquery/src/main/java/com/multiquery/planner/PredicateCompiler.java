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

import com.multiquery.predicate.ComparisonPredicate;
import com.multiquery.predicate.ConjunctionPredicate;
import com.multiquery.predicate.DocumentPredicate;
import com.multiquery.predicate.Literal;
import com.multiquery.predicate.TruePredicate;
import com.multiquery.query.Filter;
import com.multiquery.query.InvalidFilterValueException;
import com.multiquery.query.Operator;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiles the filters of a query into the predicate evaluated by the map stage: the conjunction of
 * one comparison per filter, or {@link TruePredicate} when there are no filters.
 */
public class PredicateCompiler {

    public DocumentPredicate compile(List<Filter> filters) {
        if (filters.isEmpty()) {
            return TruePredicate.INSTANCE;
        }
        List<DocumentPredicate> comparisons = new ArrayList<>(filters.size());
        for (Filter filter : filters) {
            comparisons.add(compile(filter));
        }
        if (comparisons.size() == 1) {
            return comparisons.get(0);
        }
        return new ConjunctionPredicate(comparisons);
    }

    public ComparisonPredicate compile(Filter filter) {
        Operator operator = Operator.fromSymbol(filter.operator());
        Literal literal;
        try {
            literal = Literal.of(filter.value());
        } catch (IllegalArgumentException e) {
            InvalidFilterValueException error = new InvalidFilterValueException(filter.field(), filter.value());
            error.initCause(e);
            throw error;
        }
        return new ComparisonPredicate(filter.field(), operator, literal);
    }
}
