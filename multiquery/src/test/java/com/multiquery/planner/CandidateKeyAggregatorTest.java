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

import com.multiquery.BaseStoreTest;
import com.multiquery.RecordingStoreClient;
import com.multiquery.job.JobInput;
import com.multiquery.query.Filter;
import com.multiquery.query.QuerySnapshot;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class CandidateKeyAggregatorTest extends BaseStoreTest {
    private final CandidateKeyAggregator aggregator = new CandidateKeyAggregator(new IndexLookupTranslator(99999999999999999L));

    private static QuerySnapshot snapshot(Filter... filters) {
        return new QuerySnapshot(TEST_BUCKET, List.of(filters), null, 0, 0);
    }

    @Test
    void test_no_filters_reads_whole_bucket() {
        insertPeople();
        RecordingStoreClient client = new RecordingStoreClient(store);

        JobInput input = aggregator.aggregate(client, snapshot());

        assertEquals(JobInput.wholeBucket(TEST_BUCKET), input);
        assertTrue(client.calls().isEmpty());
    }

    @Test
    void test_one_lookup_per_filter_in_order() {
        insertPeople();
        RecordingStoreClient client = new RecordingStoreClient(store);

        aggregator.aggregate(client, snapshot(new Filter("age", "<", 50), new Filter("name", "==", "Vishnu")));

        assertEquals(List.of(
                "index(" + TEST_BUCKET + ", age_int, -99999999999999999, 50)",
                "index(" + TEST_BUCKET + ", name_bin, Vishnu)"
        ), client.calls());
    }

    @Test
    void test_union_keeps_first_seen_order() {
        insertPeople();
        insert("arun", "{\"name\": \"Arun\", \"age\": 40}", Map.of("name_bin", "Arun", "age_int", 40));

        JobInput input = aggregator.aggregate(store, snapshot(
                new Filter("name", "==", "Vishnu"),
                new Filter("age", ">", 30)
        ));

        JobInput.Keys keys = assertInstanceOf(JobInput.Keys.class, input);
        assertThat(keys.keys()).containsExactly("vishnu", "arun");
    }

    @Test
    void test_empty_union_falls_back_to_whole_bucket() {
        insertPeople();

        JobInput input = aggregator.aggregate(store, snapshot(new Filter("name", "==", "Nobody")));

        assertEquals(JobInput.wholeBucket(TEST_BUCKET), input);
    }

    @Test
    void test_collect() {
        insertPeople();

        assertThat(aggregator.collect(store, snapshot(new Filter("age", ">=", 25)))).containsExactly("sree", "vishnu");
        assertThat(aggregator.collect(store, snapshot())).isEmpty();
    }
}
