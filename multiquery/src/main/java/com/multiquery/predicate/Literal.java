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

import com.multiquery.common.utils.NumberUtils;
import com.multiquery.common.utils.Utils;

import java.math.BigDecimal;

/**
 * A typed constant on the right-hand side of a comparison.
 */
public sealed interface Literal permits Literal.Text, Literal.Numeric {

    /**
     * Creates a literal for a filter value.
     *
     * @param value a string or a number
     * @return the literal
     * @throws IllegalArgumentException if the value is neither text nor a number
     */
    static Literal of(Object value) {
        if (value instanceof CharSequence cs) {
            return new Text(cs.toString());
        }
        if (value instanceof Number number) {
            BigDecimal decimal = NumberUtils.toBigDecimal(number);
            if (decimal == null) {
                throw new IllegalArgumentException("Numeric literal must be finite: " + number);
            }
            return new Numeric(number, decimal);
        }
        throw new IllegalArgumentException("Unsupported literal: " + value);
    }

    Object value();

    /**
     * Compares a document value against this literal.
     *
     * @param actual the value read from the document, never null
     * @return the comparison result of {@code actual} against the literal, or null when the two
     * are not comparable
     */
    Integer compare(Object actual);

    String render();

    record Text(String value) implements Literal {

        @Override
        public Integer compare(Object actual) {
            if (actual instanceof CharSequence cs) {
                return Integer.signum(cs.toString().compareTo(value));
            }
            if (actual instanceof Number) {
                BigDecimal expected = NumberUtils.coerce(value);
                BigDecimal actualNumber = NumberUtils.toBigDecimal(actual);
                if (expected == null || actualNumber == null) {
                    return null;
                }
                return actualNumber.compareTo(expected);
            }
            return null;
        }

        @Override
        public String render() {
            return Utils.quote(value);
        }
    }

    record Numeric(Number value, BigDecimal decimal) implements Literal {

        @Override
        public Integer compare(Object actual) {
            BigDecimal actualNumber = NumberUtils.coerce(actual);
            if (actualNumber == null) {
                return null;
            }
            return actualNumber.compareTo(decimal);
        }

        @Override
        public String render() {
            return value.toString();
        }
    }
}
