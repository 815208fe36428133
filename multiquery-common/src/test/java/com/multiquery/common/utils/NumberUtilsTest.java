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

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class NumberUtilsTest {

    @Test
    void test_toBigDecimal() {
        assertEquals(new BigDecimal("25"), NumberUtils.toBigDecimal(25));
        assertEquals(new BigDecimal("99999999999999999"), NumberUtils.toBigDecimal(99999999999999999L));
        assertEquals(0, new BigDecimal("2.5").compareTo(NumberUtils.toBigDecimal(2.5d)));
        assertEquals(new BigDecimal("31"), NumberUtils.toBigDecimal("31"));
        assertEquals(new BigDecimal("-3.25"), NumberUtils.toBigDecimal("-3.25"));
    }

    @Test
    void test_toBigDecimal_non_numeric() {
        assertNull(NumberUtils.toBigDecimal(null));
        assertNull(NumberUtils.toBigDecimal("Vishnu"));
        assertNull(NumberUtils.toBigDecimal(true));
        assertNull(NumberUtils.toBigDecimal(Double.NaN));
        assertNull(NumberUtils.toBigDecimal(Double.POSITIVE_INFINITY));
    }

    @Test
    void test_toDouble() {
        assertEquals(25.0, NumberUtils.toDouble(25));
        assertEquals(31.0, NumberUtils.toDouble("31"));
        assertTrue(Double.isNaN(NumberUtils.toDouble("Vishnu")));
        assertTrue(Double.isNaN(NumberUtils.toDouble(null)));
        assertEquals(25.0, NumberUtils.toDouble(" 25 "));
        assertEquals(0.0, NumberUtils.toDouble(""));
    }

    @Test
    void test_non_ascii_digits_are_not_numbers() {
        assertNull(NumberUtils.toBigDecimal("\u0663"));
        assertNull(NumberUtils.coerce("\u0663"));
        assertTrue(Double.isNaN(NumberUtils.toDouble("\u0663")));
        assertTrue(Double.isNaN(NumberUtils.toDouble("1\u0665")));
    }

    @Test
    void test_coerce() {
        assertEquals(new BigDecimal("25"), NumberUtils.coerce(" 25 "));
        assertEquals(new BigDecimal("-1.5"), NumberUtils.coerce("\t-1.5\n"));
        assertEquals(BigDecimal.ZERO, NumberUtils.coerce(""));
        assertEquals(BigDecimal.ZERO, NumberUtils.coerce("   "));
        assertEquals(new BigDecimal("31"), NumberUtils.coerce(31));
        assertNull(NumberUtils.coerce("2 5"));
        assertNull(NumberUtils.coerce(null));
        assertNull(NumberUtils.coerce(true));
    }

    @Test
    void test_toBigDecimal_does_not_trim() {
        assertNull(NumberUtils.toBigDecimal(" 25 "));
        assertNull(NumberUtils.toBigDecimal(""));
    }
}
