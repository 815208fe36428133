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

import static org.junit.jupiter.api.Assertions.*;

class UtilsTest {

    @Test
    void test_isEmpty() {
        assertTrue(Utils.isEmpty(null));
        assertTrue(Utils.isEmpty(""));
        assertFalse(Utils.isEmpty(" "));
        assertFalse(Utils.isEmpty("age"));
    }

    @Test
    void test_isNumeric() {
        assertTrue(Utils.isNumeric("25"));
        assertTrue(Utils.isNumeric("-25"));
        assertTrue(Utils.isNumeric("+3.14"));
        assertTrue(Utils.isNumeric(".5"));

        assertFalse(Utils.isNumeric(null));
        assertFalse(Utils.isNumeric(""));
        assertFalse(Utils.isNumeric("-"));
        assertFalse(Utils.isNumeric("."));
        assertFalse(Utils.isNumeric("1.2.3"));
        assertFalse(Utils.isNumeric("1e10"));
        assertFalse(Utils.isNumeric("NaN"));
        assertFalse(Utils.isNumeric("Sreejith"));
        assertFalse(Utils.isNumeric("\u0663"));
        assertFalse(Utils.isNumeric("-\u0661\u0662"));
    }

    @Test
    void test_quote() {
        assertEquals("'Sreejith'", Utils.quote("Sreejith"));
        assertEquals("''", Utils.quote(""));
        assertEquals("'O\\'Brien'", Utils.quote("O'Brien"));
        assertEquals("'a\\\\b'", Utils.quote("a\\b"));
    }
}
