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

package com.multiquery.store;

/**
 * The subset of a key-value store client that query execution depends on: secondary index lookups
 * over one bucket and map/reduce jobs.
 * <p>
 * Index names follow the {@code <field>_bin} (text) and {@code <field>_int} (integer) convention.
 */
public interface StoreClient {

    /**
     * Prepares an exact-match lookup.
     *
     * @param bucket    the bucket to query
     * @param indexName the secondary index name
     * @param value     the indexed value to match
     * @return the prepared lookup
     */
    IndexQuery index(String bucket, String indexName, Object value);

    /**
     * Prepares an inclusive range lookup.
     *
     * @param bucket    the bucket to query
     * @param indexName the secondary index name
     * @param start     the lower bound, inclusive
     * @param end       the upper bound, inclusive
     * @return the prepared lookup
     */
    IndexQuery index(String bucket, String indexName, Object start, Object end);

    MapReduceBuilder newMapReduce();
}
