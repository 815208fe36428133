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
 * Comparison operators accepted by {@link MultiIndexQuery#filter(String, String, Object)}.
 */
public enum Operator {
    EQ("=="),
    GT(">"),
    GTE(">="),
    LT("<"),
    LTE("<=");

    private final String symbol;

    Operator(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Resolves an operator from the symbol a caller passed to a filter.
     *
     * @param symbol the operator symbol, e.g. {@code ">="}
     * @return the matching operator
     * @throws InvalidOperatorException if the symbol is not a supported operator
     */
    public static Operator fromSymbol(String symbol) {
        if (symbol != null) {
            for (Operator operator : values()) {
                if (operator.symbol.equals(symbol)) {
                    return operator;
                }
            }
        }
        throw new InvalidOperatorException(symbol);
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Interprets the result of comparing an actual value with an expected one.
     *
     * @param comparison negative, zero or positive as in {@link Comparable#compareTo(Object)}
     * @return true if the comparison satisfies this operator
     */
    public boolean test(int comparison) {
        return switch (this) {
            case EQ -> comparison == 0;
            case GT -> comparison > 0;
            case GTE -> comparison >= 0;
            case LT -> comparison < 0;
            case LTE -> comparison <= 0;
        };
    }
}
