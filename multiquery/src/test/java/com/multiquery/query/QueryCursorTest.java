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

package com.multiquery.query;

import com.multiquery.job.QueryResult;
import org.bson.Document;
import org.junit.jupiter.api.Test;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class QueryCursorTest {

    private static QueryExecution streamingExecution() {
        QueryExecution execution = new QueryExecution(new QuerySnapshot("users", List.of(), null, 0, 0));
        execution.advance(ExecutionStage.STREAMING);
        return execution;
    }

    private static QueryResult result(String key) {
        return new QueryResult(key, new Document("key", key));
    }

    @Test
    void test_iterate_until_done() {
        QueryCursor cursor = new QueryCursor(List.of(result("a"), result("b")).iterator(), streamingExecution());

        assertTrue(cursor.hasNext());
        assertEquals("a", cursor.next().key());
        assertEquals("b", cursor.next().key());
        assertEquals(ExecutionStage.STREAMING, cursor.stage());

        assertFalse(cursor.hasNext());
        assertEquals(ExecutionStage.DONE, cursor.stage());
        assertThrows(NoSuchElementException.class, cursor::next);
    }

    @Test
    void test_stream() {
        QueryCursor cursor = new QueryCursor(List.of(result("a"), result("b")).iterator(), streamingExecution());

        assertThat(cursor.stream().map(QueryResult::key)).containsExactly("a", "b");
    }

    @Test
    void test_iterator_can_be_requested_once() {
        QueryCursor cursor = new QueryCursor(List.of(result("a")).iterator(), streamingExecution());

        assertSame(cursor, cursor.iterator());
        assertThrows(IllegalStateException.class, cursor::iterator);
    }

    @Test
    void test_source_failure_marks_execution_failed() {
        IllegalStateException failure = new IllegalStateException("stream broken");
        Iterator<QueryResult> source = new Iterator<>() {
            private int calls;

            @Override
            public boolean hasNext() {
                if (calls > 0) {
                    throw failure;
                }
                return true;
            }

            @Override
            public QueryResult next() {
                calls++;
                return result("a");
            }
        };
        QueryCursor cursor = new QueryCursor(source, streamingExecution());

        assertEquals("a", cursor.next().key());
        IllegalStateException exception = assertThrows(IllegalStateException.class, cursor::hasNext);
        assertSame(failure, exception);
        assertEquals(ExecutionStage.FAILED, cursor.stage());
        assertFalse(cursor.hasNext());
    }
}
