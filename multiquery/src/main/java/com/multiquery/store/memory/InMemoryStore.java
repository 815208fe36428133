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

package com.multiquery.store.memory;

import com.google.common.base.Preconditions;
import com.multiquery.common.utils.Utils;
import com.multiquery.store.IndexQuery;
import com.multiquery.store.MapReduceBuilder;
import com.multiquery.store.StoreClient;
import com.multiquery.store.StoredObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * A {@link StoreClient} that keeps buckets in memory, with {@code _bin} and {@code _int} secondary
 * indexes and a local map/reduce engine.
 * <p>
 * Index lookups return keys ordered by indexed value, then by key. A text range whose upper bound
 * is the empty string has no upper bound. Buckets are created on first use.
 * <p>
 * The store is thread-safe. Closing it stops the job executor.
 */
public class InMemoryStore implements StoreClient, AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryStore.class);

    private final ConcurrentHashMap<String, InMemoryBucket> buckets = new ConcurrentHashMap<>();
    private final ExecutorService executor;

    public InMemoryStore() {
        this(JobExecutors.newBoundedExecutor());
    }

    public InMemoryStore(ExecutorService executor) {
        this.executor = executor;
    }

    public InMemoryBucket bucket(String name) {
        Preconditions.checkArgument(!Utils.isEmpty(name), "bucket name cannot be empty");
        return buckets.computeIfAbsent(name, InMemoryBucket::new);
    }

    public void put(String bucket, String key, byte[] value, Map<String, Object> indexes) {
        bucket(bucket).put(key, value, indexes);
    }

    public boolean delete(String bucket, String key) {
        return bucket(bucket).delete(key);
    }

    /**
     * @return the object, or null if the bucket has no object with this key
     */
    public StoredObject get(String bucket, String key) {
        return bucket(bucket).get(key);
    }

    @Override
    public IndexQuery index(String bucket, String indexName, Object value) {
        return () -> bucket(bucket).lookup(indexName, value);
    }

    @Override
    public IndexQuery index(String bucket, String indexName, Object start, Object end) {
        return () -> bucket(bucket).lookup(indexName, start, end);
    }

    @Override
    public MapReduceBuilder newMapReduce() {
        return new InMemoryMapReduce(this, executor);
    }

    @Override
    public void close() {
        executor.shutdownNow();
        LOGGER.debug("In-memory store closed, {} bucket(s) discarded", buckets.size());
    }
}
