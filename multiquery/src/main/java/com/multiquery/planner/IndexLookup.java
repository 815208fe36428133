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

import com.multiquery.store.KeyReference;
import com.multiquery.store.StoreClient;

import java.util.List;

/**
 * A secondary index lookup translated from one filter. Lookups are plain values until
 * {@link #execute(StoreClient)} sends them to a store.
 */
public sealed interface IndexLookup permits IndexLookup.Exact, IndexLookup.Range {

    String bucket();

    String index();

    IndexKind kind();

    List<KeyReference> execute(StoreClient client);

    record Exact(String bucket, String index, IndexKind kind, Object value) implements IndexLookup {
        @Override
        public List<KeyReference> execute(StoreClient client) {
            return client.index(bucket, index, value).run();
        }
    }

    record Range(String bucket, String index, IndexKind kind, Object start, Object end) implements IndexLookup {
        @Override
        public List<KeyReference> execute(StoreClient client) {
            return client.index(bucket, index, start, end).run();
        }
    }
}
