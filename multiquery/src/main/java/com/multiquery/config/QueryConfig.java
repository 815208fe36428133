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
import com.multiquery.codec.DocumentCodec;
import com.multiquery.codec.JsonDocumentCodec;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

import java.time.Duration;

/**
 * Typed view over the {@code multiquery} configuration tree. Defaults live in the module's
 * {@code reference.conf}; applications override them with {@code application.conf} or system
 * properties.
 */
public class QueryConfig {
    public static final String DEFAULT_TIMEOUT = "multiquery.job.default-timeout";
    public static final String INTEGER_BOUND = "multiquery.index.integer-bound";
    public static final String DOCUMENT_CODEC = "multiquery.document.codec";

    private final Config config;

    public QueryConfig(Config config) {
        config.checkValid(ConfigFactory.defaultReference(), "multiquery");
        this.config = config;
    }

    /**
     * Loads the configuration with the standard Typesafe Config lookup order.
     *
     * @return the loaded configuration
     */
    public static QueryConfig load() {
        return new QueryConfig(ConfigFactory.load());
    }

    public Config getConfig() {
        return config;
    }

    /**
     * @return the timeout used by {@code run()} when the caller does not pass one
     */
    public Duration defaultTimeout() {
        return config.getDuration(DEFAULT_TIMEOUT);
    }

    /**
     * Integer index lookups need concrete bounds on both sides. Open-ended comparisons use this
     * value and its negation in place of the missing bound.
     *
     * @return the substitute bound for integer range lookups
     */
    public long integerBound() {
        long bound = config.getLong(INTEGER_BOUND);
        if (bound <= 0) {
            throw new ConfigException.BadValue(INTEGER_BOUND, "must be a positive integer");
        }
        return bound;
    }

    public DocumentCodec documentCodec() {
        String name = config.getString(DOCUMENT_CODEC);
        return switch (name) {
            case JsonDocumentCodec.NAME -> new JsonDocumentCodec();
            case BsonDocumentCodec.NAME -> new BsonDocumentCodec();
            default -> throw new ConfigException.BadValue(DOCUMENT_CODEC, "unknown document codec: " + name);
        };
    }
}
