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

import com.multiquery.BaseStoreTest;
import com.multiquery.job.QueryResult;
import com.multiquery.store.JobTimeoutException;
import com.multiquery.store.MapPhase;
import com.multiquery.store.StoreException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryMapReduceTest extends BaseStoreTest {

    private final MapPhase identity = object -> List.of(new QueryResult(object.key(), codec.decode(object.value())));

    private static List<String> drain(Iterator<QueryResult> iterator) {
        List<String> keys = new ArrayList<>();
        iterator.forEachRemaining(result -> keys.add(result.key()));
        return keys;
    }

    @Test
    void test_map_only_job_over_keys() {
        insertPeople();

        Iterator<QueryResult> results = store.newMapReduce()
                .add(TEST_BUCKET, "vishnu")
                .add(TEST_BUCKET, "sree")
                .map(identity)
                .run(Duration.ofSeconds(5));

        assertEquals(List.of("vishnu", "sree"), drain(results));
    }

    @Test
    void test_map_only_job_is_lazy() {
        insertPeople();
        AtomicInteger mapped = new AtomicInteger();

        Iterator<QueryResult> results = store.newMapReduce()
                .addBucket(TEST_BUCKET)
                .map(object -> {
                    mapped.incrementAndGet();
                    return identity.map(object);
                })
                .run(Duration.ofSeconds(5));

        assertEquals(0, mapped.get());
        assertEquals("sree", results.next().key());
        assertEquals(1, mapped.get());
    }

    @Test
    void test_missing_keys_are_skipped() {
        insertPeople();

        Iterator<QueryResult> results = store.newMapReduce()
                .add(TEST_BUCKET, "ghost")
                .add(TEST_BUCKET, "vishnu")
                .map(identity)
                .reduce((values, argument) -> values)
                .run(Duration.ofSeconds(5));

        assertEquals(List.of("vishnu"), drain(results));
    }

    @Test
    void test_reduce_phases_run_in_order_with_their_arguments() {
        insertPeople();
        List<Object> arguments = new ArrayList<>();

        Iterator<QueryResult> results = store.newMapReduce()
                .addBucket(TEST_BUCKET)
                .map(identity)
                .reduce((values, argument) -> {
                    arguments.add(argument);
                    List<QueryResult> reversed = new ArrayList<>(values);
                    Collections.reverse(reversed);
                    return reversed;
                }, "first")
                .reduce((values, argument) -> {
                    arguments.add(argument);
                    return values.subList(0, 1);
                }, "second")
                .run(Duration.ofSeconds(5));

        assertEquals(List.of("vishnu"), drain(results));
        assertEquals(List.of("first", "second"), arguments);
    }

    @Test
    void test_map_phase_is_required() {
        assertThrows(IllegalStateException.class, () -> store.newMapReduce().addBucket(TEST_BUCKET).run(Duration.ofSeconds(1)));
    }

    @Test
    void test_map_phase_can_only_be_set_once() {
        assertThrows(IllegalStateException.class, () -> store.newMapReduce().map(identity).map(identity));
    }

    @Test
    void test_slow_reduce_times_out() {
        insertPeople();

        JobTimeoutException exception = assertThrows(JobTimeoutException.class, () -> store.newMapReduce()
                .addBucket(TEST_BUCKET)
                .map(identity)
                .reduce((values, argument) -> {
                    try {
                        Thread.sleep(2000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return values;
                })
                .run(Duration.ofMillis(50)));
        assertEquals(Duration.ofMillis(50), exception.getTimeout());
    }

    @Test
    void test_streaming_timeout() {
        insertPeople();

        Iterator<QueryResult> results = store.newMapReduce()
                .addBucket(TEST_BUCKET)
                .map(identity)
                .run(Duration.ZERO);

        assertThrows(JobTimeoutException.class, results::hasNext);
    }

    @Test
    void test_job_failure_is_rethrown() {
        insertPeople();
        StoreException failure = new StoreException("reduce failed");

        StoreException exception = assertThrows(StoreException.class, () -> store.newMapReduce()
                .addBucket(TEST_BUCKET)
                .map(identity)
                .reduce((values, argument) -> {
                    throw failure;
                })
                .run(Duration.ofSeconds(5)));
        assertSame(failure, exception);
    }

    @Test
    void test_empty_bucket() {
        Iterator<QueryResult> results = store.newMapReduce()
                .addBucket(TEST_BUCKET)
                .map(identity)
                .run(Duration.ZERO);

        assertFalse(results.hasNext());
    }
}
