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

package com.multiquery.predicate;

import com.multiquery.query.Operator;
import org.bson.Document;

/**
 * {@code document.<field> <operator> <literal>}. Documents where the field is missing, null or not
 * comparable with the literal never match.
 *
 * @param field    the field, or dotted path, to read
 * @param operator the comparison operator
 * @param literal  the constant to compare with
 */
public record ComparisonPredicate(String field, Operator operator, Literal literal) implements DocumentPredicate {

    @Override
    public boolean test(Document document) {
        Object actual = FieldPath.resolve(document, field);
        if (actual == null) {
            return false;
        }
        Integer comparison = literal.compare(actual);
        if (comparison == null) {
            return false;
        }
        return operator.test(comparison);
    }

    @Override
    public String expression() {
        return String.format("data.%s %s %s", field, operator.symbol(), literal.render());
    }
}
