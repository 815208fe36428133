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

import org.bson.Document;

/**
 * Converts stored object bodies to and from {@link Document}s. The map stage of a query decodes
 * every candidate object with the configured codec before evaluating the predicate.
 */
public interface DocumentCodec {

    /**
     * @return the name the codec is selected by in the configuration
     */
    String name();

    /**
     * @param value the stored bytes
     * @return the decoded document
     * @throws DocumentDecodeException if the bytes are not a valid document in this format
     */
    Document decode(byte[] value);

    byte[] encode(Document document);
}
