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

public class Utils {

    public static boolean isEmpty(final CharSequence cs) {
        // Source: https://commons.apache.org/proper/commons-lang/javadocs/api-release/src-html/org/apache/commons/lang3/StringUtils.html#line.3583
        return cs == null || cs.length() == 0;
    }

    /**
     * Checks whether the given sequence is a plain decimal number: an optional leading sign,
     * at least one ASCII digit and at most one decimal point. Exponents, hexadecimal notation,
     * non-ASCII digits, {@code NaN} and {@code Infinity} are rejected.
     *
     * @param cs the character sequence to check, may be null
     * @return true if the sequence can be parsed as a decimal number
     */
    public static boolean isNumeric(final CharSequence cs) {
        if (isEmpty(cs)) {
            return false;
        }
        final int sz = cs.length();
        int start = 0;
        char first = cs.charAt(0);
        if (first == '-' || first == '+') {
            start = 1;
        }
        boolean seenDigit = false;
        boolean seenPoint = false;
        for (int i = start; i < sz; i++) {
            char c = cs.charAt(i);
            if (c >= '0' && c <= '9') {
                seenDigit = true;
            } else if (c == '.' && !seenPoint) {
                seenPoint = true;
            } else {
                return false;
            }
        }
        return seenDigit;
    }

    /**
     * Quotes a string with single quotes, escaping backslashes and embedded single quotes.
     *
     * @param value the string to quote
     * @return the quoted representation
     */
    public static String quote(final String value) {
        StringBuilder builder = new StringBuilder(value.length() + 2);
        builder.append('\'');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\'' || c == '\\') {
                builder.append('\\');
            }
            builder.append(c);
        }
        builder.append('\'');
        return builder.toString();
    }
}
