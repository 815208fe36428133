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

import org.bson.BSONException;
import org.bson.BsonBinaryReader;
import org.bson.BsonBinaryWriter;
import org.bson.Document;
import org.bson.codecs.Codec;
import org.bson.codecs.DecoderContext;
import org.bson.codecs.EncoderContext;
import org.bson.io.BasicOutputBuffer;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;

/**
 * Reads and writes documents stored in the BSON binary format.
 */
public class BsonDocumentCodec implements DocumentCodec {
    public static final String NAME = "bson";
    private static final Codec<Document> CODEC = new org.bson.codecs.DocumentCodec();

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Document decode(byte[] value) {
        try (BsonBinaryReader reader = new BsonBinaryReader(ByteBuffer.wrap(value))) {
            return CODEC.decode(reader, DecoderContext.builder().build());
        } catch (BSONException | BufferUnderflowException | IllegalStateException e) {
            throw new DocumentDecodeException("Failed to decode BSON document", e);
        }
    }

    @Override
    public byte[] encode(Document document) {
        try (BasicOutputBuffer buffer = new BasicOutputBuffer()) {
            BsonBinaryWriter writer = new BsonBinaryWriter(buffer);
            CODEC.encode(writer, document, EncoderContext.builder().isEncodingCollectibleDocument(true).build());
            return buffer.toByteArray();
        }
    }
}
