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

import com.google.common.collect.Streams;
import com.multiquery.job.QueryResult;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.stream.Stream;

/**
 * Lazy, single-pass view over the rows streamed back by a computation job.
 * <p>
 * Rows are pulled from the store as the caller iterates. The cursor can be iterated only once;
 * errors raised by the job while streaming surface from {@link #hasNext()} or {@link #next()} and
 * leave the rows already returned with the caller.
 */
public class QueryCursor implements Iterator<QueryResult>, Iterable<QueryResult> {
    private final Iterator<QueryResult> source;
    private final QueryExecution execution;
    private boolean iterated;

    public QueryCursor(Iterator<QueryResult> source, QueryExecution execution) {
        this.source = source;
        this.execution = execution;
    }

    public ExecutionStage stage() {
        return execution.stage();
    }

    @Override
    public boolean hasNext() {
        if (execution.stage().isTerminal()) {
            return false;
        }
        try {
            boolean hasNext = source.hasNext();
            if (!hasNext) {
                execution.advance(ExecutionStage.DONE);
            }
            return hasNext;
        } catch (RuntimeException e) {
            execution.fail(e);
            throw e;
        }
    }

    @Override
    public QueryResult next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        try {
            return source.next();
        } catch (RuntimeException e) {
            execution.fail(e);
            throw e;
        }
    }

    /**
     * Returns this cursor. A cursor is consumed once, so a second call fails.
     *
     * @throws IllegalStateException if the cursor was already handed out for iteration
     */
    @Override
    public Iterator<QueryResult> iterator() {
        if (iterated) {
            throw new IllegalStateException("QueryCursor can only be iterated once");
        }
        iterated = true;
        return this;
    }

    public Stream<QueryResult> stream() {
        return Streams.stream((Iterable<QueryResult>) this);
    }
}
