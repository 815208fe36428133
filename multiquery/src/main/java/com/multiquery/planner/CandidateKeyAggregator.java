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

import com.multiquery.job.JobInput;
import com.multiquery.query.Filter;
import com.multiquery.query.QuerySnapshot;
import com.multiquery.store.KeyReference;
import com.multiquery.store.StoreClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Narrows the key space of a query with the secondary indexes.
 * <p>
 * One lookup is issued per filter, sequentially, and the returned keys are unioned. The union may
 * contain keys that fail other filters; the map stage filters them out. When the union is empty,
 * because there are no filters or because nothing matched, the whole bucket becomes the job input.
 * A failing lookup aborts the aggregation and its exception propagates unchanged.
 */
public class CandidateKeyAggregator {
    private static final Logger LOGGER = LoggerFactory.getLogger(CandidateKeyAggregator.class);

    private final IndexLookupTranslator translator;

    public CandidateKeyAggregator(IndexLookupTranslator translator) {
        this.translator = translator;
    }

    /**
     * Collects the candidate keys of every filter.
     *
     * @param client   the store to run the lookups on
     * @param snapshot the query state
     * @return the union of the keys, in the order they were first returned
     */
    public Set<String> collect(StoreClient client, QuerySnapshot snapshot) {
        Set<String> keys = new LinkedHashSet<>();
        for (Filter filter : snapshot.filters()) {
            IndexLookup lookup = translator.translate(snapshot.bucket(), filter);
            List<KeyReference> references = lookup.execute(client);
            for (KeyReference reference : references) {
                keys.add(reference.key());
            }
            LOGGER.debug("Index lookup {} on bucket '{}' returned {} keys", lookup.index(), snapshot.bucket(), references.size());
        }
        return keys;
    }

    /**
     * Builds the job input for a query.
     *
     * @param client   the store to run the lookups on
     * @param snapshot the query state
     * @return the candidate keys, or the whole bucket when there are none
     */
    public JobInput aggregate(StoreClient client, QuerySnapshot snapshot) {
        Set<String> keys = collect(client, snapshot);
        if (keys.isEmpty()) {
            if (!snapshot.filters().isEmpty()) {
                LOGGER.debug("Index lookups on bucket '{}' found no candidates, scanning the whole bucket", snapshot.bucket());
            }
            return JobInput.wholeBucket(snapshot.bucket());
        }
        return JobInput.keys(snapshot.bucket(), keys);
    }
}
