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
import com.google.common.collect.ImmutableMap;
import com.multiquery.store.KeyReference;
import com.multiquery.store.StoredObject;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Objects of one bucket, kept in key order, with their secondary index entries. Every object has at
 * most one value per index.
 */
public class InMemoryBucket {
    private final String name;
    private final ConcurrentSkipListMap<String, Entry> objects = new ConcurrentSkipListMap<>();

    InMemoryBucket(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    /**
     * Stores an object, replacing any previous version and its index entries.
     *
     * @param key     the object key
     * @param value   the encoded document
     * @param indexes index name to indexed value, names must end with {@code _bin} or {@code _int}
     * @throws com.multiquery.store.StoreException if an index name or value is invalid
     */
    public void put(String key, byte[] value, Map<String, Object> indexes) {
        Preconditions.checkNotNull(key, "key");
        Preconditions.checkNotNull(value, "value");
        ImmutableMap.Builder<String, Object> normalized = ImmutableMap.builder();
        for (Map.Entry<String, Object> index : indexes.entrySet()) {
            IndexValueComparator comparator = IndexValueComparator.forIndex(index.getKey());
            normalized.put(index.getKey(), comparator.normalize(index.getKey(), index.getValue()));
        }
        objects.put(key, new Entry(value.clone(), normalized.build()));
    }

    public boolean delete(String key) {
        return objects.remove(key) != null;
    }

    public StoredObject get(String key) {
        Entry entry = objects.get(key);
        if (entry == null) {
            return null;
        }
        return new StoredObject(name, key, entry.value().clone());
    }

    public List<String> keys() {
        return new ArrayList<>(objects.keySet());
    }

    public int size() {
        return objects.size();
    }

    List<KeyReference> lookup(String index, Object value) {
        IndexValueComparator comparator = IndexValueComparator.forIndex(index);
        Object expected = comparator.normalize(index, value);
        List<Match> matches = new ArrayList<>();
        objects.forEach((key, entry) -> {
            Object indexed = entry.indexes().get(index);
            if (indexed != null && comparator.compare(indexed, expected) == 0) {
                matches.add(new Match(key, indexed));
            }
        });
        return toReferences(matches, comparator);
    }

    List<KeyReference> lookup(String index, Object start, Object end) {
        IndexValueComparator comparator = IndexValueComparator.forIndex(index);
        Object lower = comparator.normalize(index, start);
        boolean openUpper = comparator.isOpenUpperBound(end);
        Object upper = comparator.normalize(index, end);
        List<Match> matches = new ArrayList<>();
        objects.forEach((key, entry) -> {
            Object indexed = entry.indexes().get(index);
            if (indexed == null || comparator.compare(indexed, lower) < 0) {
                return;
            }
            if (openUpper || comparator.compare(indexed, upper) <= 0) {
                matches.add(new Match(key, indexed));
            }
        });
        return toReferences(matches, comparator);
    }

    private List<KeyReference> toReferences(List<Match> matches, IndexValueComparator comparator) {
        matches.sort(Comparator.comparing(Match::indexed, comparator).thenComparing(Match::key));
        List<KeyReference> references = new ArrayList<>(matches.size());
        for (Match match : matches) {
            references.add(new KeyReference(name, match.key()));
        }
        return references;
    }

    private record Entry(byte[] value, Map<String, Object> indexes) {
    }

    private record Match(String key, Object indexed) {
    }
}
