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

package com.multiquery.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.multiquery.common.MultiQueryException;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;

/**
 * Reads and writes documents stored as JSON objects, using Jackson. Nested objects are decoded as
 * plain maps, integral numbers as {@link Integer} or {@link Long} and fractional numbers as
 * {@link Double}.
 */
public class JsonDocumentCodec implements DocumentCodec {
    public static final String NAME = "json";
    private static final Logger LOGGER = LoggerFactory.getLogger(JsonDocumentCodec.class);
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public JsonDocumentCodec() {
        this(new ObjectMapper());
    }

    public JsonDocumentCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Document decode(byte[] value) {
        try {
            LinkedHashMap<String, Object> fields = objectMapper.readValue(value, MAP_TYPE);
            if (fields == null) {
                throw new DocumentDecodeException("JSON value is null, expected an object", null);
            }
            return new Document(fields);
        } catch (IOException e) {
            throw new DocumentDecodeException("Failed to decode JSON document", e);
        }
    }

    @Override
    public byte[] encode(Document document) {
        try {
            return objectMapper.writeValueAsBytes(document);
        } catch (JsonProcessingException e) {
            LOGGER.error("Failed to serialize document to JSON", e);
            throw new MultiQueryException("JSON serialization failed", e);
        }
    }
}
