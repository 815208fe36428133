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

package com.multiquery.config;

import com.multiquery.codec.BsonDocumentCodec;
import com.multiquery.codec.JsonDocumentCodec;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class QueryConfigTest {

    private static QueryConfig parse(String hocon) {
        return new QueryConfig(ConfigFactory.parseString(hocon).withFallback(ConfigFactory.defaultReference()).resolve());
    }

    @Test
    void test_defaults() {
        QueryConfig config = QueryConfig.load();

        assertEquals(Duration.ofMillis(9000), config.defaultTimeout());
        assertEquals(99999999999999999L, config.integerBound());
        assertInstanceOf(JsonDocumentCodec.class, config.documentCodec());
    }

    @Test
    void test_overrides() {
        QueryConfig config = parse("""
                multiquery.job.default-timeout = 2s
                multiquery.index.integer-bound = 1000
                multiquery.document.codec = bson
                """);

        assertEquals(Duration.ofSeconds(2), config.defaultTimeout());
        assertEquals(1000, config.integerBound());
        assertInstanceOf(BsonDocumentCodec.class, config.documentCodec());
    }

    @Test
    void test_unknown_codec() {
        QueryConfig config = parse("multiquery.document.codec = xml");

        assertThrows(ConfigException.BadValue.class, config::documentCodec);
    }

    @Test
    void test_integer_bound_must_be_positive() {
        QueryConfig config = parse("multiquery.index.integer-bound = 0");

        assertThrows(ConfigException.BadValue.class, config::integerBound);
    }

    @Test
    void test_wrong_type_is_rejected() {
        assertThrows(ConfigException.class, () -> parse("multiquery.job.default-timeout = [1, 2]"));
    }
}
