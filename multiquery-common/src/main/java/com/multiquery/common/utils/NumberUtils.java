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

package com.multiquery.common.utils;

import java.math.BigDecimal;

/**
 * Loose numeric coercion for values decoded from schemaless documents. Numbers are taken as-is and
 * strings are accepted when they hold a plain decimal number, see {@link Utils#isNumeric(CharSequence)}.
 */
public class NumberUtils {

    /**
     * Coerces a value into a {@link BigDecimal}.
     *
     * @param value a number, a numeric string or anything else
     * @return the exact decimal value, or null if the value is not numeric or not finite
     */
    public static BigDecimal toBigDecimal(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return null;
            }
            return BigDecimal.valueOf(d);
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        if (value instanceof CharSequence cs && Utils.isNumeric(cs)) {
            return new BigDecimal(cs.toString());
        }
        return null;
    }

    /**
     * Coerces a value into a {@link BigDecimal} the way a scripting runtime converts an operand to a
     * number: strings are trimmed first and a blank string is zero.
     *
     * @param value a number, a string or anything else
     * @return the decimal value, or null if the value is not numeric or not finite
     */
    public static BigDecimal coerce(Object value) {
        if (value instanceof CharSequence cs) {
            String trimmed = cs.toString().strip();
            if (trimmed.isEmpty()) {
                return BigDecimal.ZERO;
            }
            return toBigDecimal(trimmed);
        }
        return toBigDecimal(value);
    }

    /**
     * Coerces a value into a double before an arithmetic operation, see {@link #coerce(Object)}.
     * Values that cannot be coerced become {@link Double#NaN}.
     *
     * @param value a number, a string or anything else
     * @return the double value or NaN
     */
    public static double toDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        BigDecimal decimal = coerce(value);
        return decimal == null ? Double.NaN : decimal.doubleValue();
    }
}
