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

import com.multiquery.query.Filter;
import com.multiquery.query.InvalidFilterValueException;
import com.multiquery.query.InvalidOperatorException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class IndexLookupTranslatorTest {
    private static final long BOUND = 99999999999999999L;
    private final IndexLookupTranslator translator = new IndexLookupTranslator(BOUND);

    @Test
    void test_text_equality() {
        IndexLookup lookup = translator.translate("users", new Filter("name", "==", "Vishnu"));

        assertEquals(new IndexLookup.Exact("users", "name_bin", IndexKind.BIN, "Vishnu"), lookup);
    }

    @Test
    void test_number_equality() {
        IndexLookup lookup = translator.translate("users", new Filter("age", "==", 25));

        assertEquals(new IndexLookup.Exact("users", "age_int", IndexKind.INT, 25), lookup);
    }

    @ParameterizedTest
    @ValueSource(strings = {">", ">="})
    void test_lower_bounded_number(String operator) {
        IndexLookup lookup = translator.translate("users", new Filter("age", operator, 25));

        assertEquals(new IndexLookup.Range("users", "age_int", IndexKind.INT, 25, BOUND), lookup);
    }

    @ParameterizedTest
    @ValueSource(strings = {"<", "<="})
    void test_upper_bounded_number(String operator) {
        IndexLookup lookup = translator.translate("users", new Filter("age", operator, 50));

        assertEquals(new IndexLookup.Range("users", "age_int", IndexKind.INT, -BOUND, 50), lookup);
    }

    @ParameterizedTest
    @ValueSource(strings = {">", ">="})
    void test_lower_bounded_text(String operator) {
        IndexLookup lookup = translator.translate("users", new Filter("name", operator, "M"));

        assertEquals(new IndexLookup.Range("users", "name_bin", IndexKind.BIN, "M", ""), lookup);
    }

    @ParameterizedTest
    @ValueSource(strings = {"<", "<="})
    void test_upper_bounded_text(String operator) {
        IndexLookup lookup = translator.translate("users", new Filter("name", operator, "M"));

        assertEquals(new IndexLookup.Range("users", "name_bin", IndexKind.BIN, "", "M"), lookup);
    }

    @Test
    void test_decimal_value_uses_integer_index() {
        IndexLookup lookup = translator.translate("users", new Filter("score", ">", new BigDecimal("1.5")));

        assertEquals(IndexKind.INT, lookup.kind());
        assertEquals("score_int", lookup.index());
    }

    @Test
    void test_custom_bound() {
        IndexLookup lookup = new IndexLookupTranslator(1000).translate("users", new Filter("age", "<", 50));

        assertEquals(new IndexLookup.Range("users", "age_int", IndexKind.INT, -1000L, 50), lookup);
    }

    @Test
    void test_invalid_operator() {
        assertThrows(InvalidOperatorException.class, () -> translator.translate("users", new Filter("age", "<>", 50)));
    }

    @Test
    void test_invalid_value() {
        assertThrows(InvalidFilterValueException.class, () -> translator.translate("users", new Filter("active", "==", true)));
        assertThrows(InvalidFilterValueException.class, () -> translator.translate("users", new Filter("name", "==", null)));
    }

    @Test
    void test_bound_must_be_positive() {
        assertThrows(IllegalArgumentException.class, () -> new IndexLookupTranslator(0));
    }
}
