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
import com.google.common.collect.AbstractIterator;
import com.multiquery.job.QueryResult;
import com.multiquery.store.JobTimeoutException;
import com.multiquery.store.KeyReference;
import com.multiquery.store.MapPhase;
import com.multiquery.store.MapReduceBuilder;
import com.multiquery.store.ReducePhase;
import com.multiquery.store.StoreException;
import com.multiquery.store.StoredObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a map/reduce job against an {@link InMemoryStore}.
 * <p>
 * Map-only jobs are streamed: objects are loaded and mapped while the caller iterates, and the
 * deadline is checked before each object. Jobs with reduce phases run on the store's executor and
 * the caller waits for the whole result up to the timeout. Keys that no longer exist when the job
 * reaches them are skipped.
 */
class InMemoryMapReduce implements MapReduceBuilder {
    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryMapReduce.class);

    private final InMemoryStore store;
    private final ExecutorService executor;
    private final Set<KeyReference> inputs = new LinkedHashSet<>();
    private final Set<String> bucketInputs = new LinkedHashSet<>();
    private final List<ReduceStep> reduceSteps = new ArrayList<>();
    private MapPhase mapPhase;

    InMemoryMapReduce(InMemoryStore store, ExecutorService executor) {
        this.store = store;
        this.executor = executor;
    }

    @Override
    public MapReduceBuilder add(String bucket, String key) {
        inputs.add(new KeyReference(bucket, key));
        return this;
    }

    @Override
    public MapReduceBuilder addBucket(String bucket) {
        bucketInputs.add(bucket);
        return this;
    }

    @Override
    public MapReduceBuilder map(MapPhase phase) {
        Preconditions.checkState(mapPhase == null, "map phase has already been set");
        this.mapPhase = phase;
        return this;
    }

    @Override
    public MapReduceBuilder reduce(ReducePhase phase) {
        return reduce(phase, null);
    }

    @Override
    public MapReduceBuilder reduce(ReducePhase phase, Object argument) {
        reduceSteps.add(new ReduceStep(phase, argument));
        return this;
    }

    private List<KeyReference> resolveInputs() {
        Set<KeyReference> resolved = new LinkedHashSet<>();
        for (String bucket : bucketInputs) {
            for (String key : store.bucket(bucket).keys()) {
                resolved.add(new KeyReference(bucket, key));
            }
        }
        resolved.addAll(inputs);
        return new ArrayList<>(resolved);
    }

    private List<QueryResult> execute(List<KeyReference> references) {
        List<QueryResult> values = new ArrayList<>();
        for (KeyReference reference : references) {
            if (Thread.currentThread().isInterrupted()) {
                throw new StoreException("Computation job cancelled");
            }
            StoredObject object = store.get(reference.bucket(), reference.key());
            if (object != null) {
                values.addAll(mapPhase.map(object));
            }
        }
        for (ReduceStep step : reduceSteps) {
            values = step.phase().reduce(Collections.unmodifiableList(values), step.argument());
        }
        return values;
    }

    @Override
    public Iterator<QueryResult> run(Duration timeout) {
        Preconditions.checkState(mapPhase != null, "map phase is required");
        List<KeyReference> references = resolveInputs();
        LOGGER.debug("Running job over {} input(s) with {} reduce phase(s)", references.size(), reduceSteps.size());
        if (reduceSteps.isEmpty()) {
            return new StreamingResults(references.iterator(), timeout);
        }

        Future<List<QueryResult>> future = executor.submit(() -> execute(references));
        try {
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS).iterator();
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new JobTimeoutException(timeout);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new StoreException("Interrupted while waiting for the computation job", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new StoreException("Computation job failed", cause);
        }
    }

    private record ReduceStep(ReducePhase phase, Object argument) {
    }

    private class StreamingResults extends AbstractIterator<QueryResult> {
        private final Iterator<KeyReference> references;
        private final Duration timeout;
        private final long deadline;
        private Iterator<QueryResult> pending = Collections.emptyIterator();

        StreamingResults(Iterator<KeyReference> references, Duration timeout) {
            this.references = references;
            this.timeout = timeout;
            this.deadline = System.nanoTime() + timeout.toNanos();
        }

        @Override
        protected QueryResult computeNext() {
            while (true) {
                if (pending.hasNext()) {
                    return pending.next();
                }
                if (!references.hasNext()) {
                    return endOfData();
                }
                if (System.nanoTime() - deadline >= 0) {
                    throw new JobTimeoutException(timeout);
                }
                KeyReference reference = references.next();
                StoredObject object = store.get(reference.bucket(), reference.key());
                if (object != null) {
                    pending = mapPhase.map(object).iterator();
                }
            }
        }
    }
}
