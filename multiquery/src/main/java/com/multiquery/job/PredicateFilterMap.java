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

package com.multiquery.job;

import com.multiquery.codec.DocumentCodec;
import com.multiquery.predicate.DocumentPredicate;
import com.multiquery.store.MapPhase;
import com.multiquery.store.StoredObject;
import org.bson.Document;

import java.util.List;

/**
 * Map phase of every query job: decodes the object, evaluates the compiled predicate and emits
 * {@code (key, document)} when it holds.
 *
 * @param predicate the compiled query condition
 * @param codec     decoder for stored object bodies
 */
public record PredicateFilterMap(DocumentPredicate predicate, DocumentCodec codec) implements MapPhase {

    @Override
    public List<QueryResult> map(StoredObject object) {
        Document document = codec.decode(object.value());
        if (predicate.test(document)) {
            return List.of(new QueryResult(object.key(), document));
        }
        return List.of();
    }
}
