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

import com.multiquery.job.QueryResult;

import java.time.Duration;
import java.util.Iterator;

/**
 * Builds and submits a computation job. Inputs are either single objects or whole buckets, exactly
 * one map phase is required and any number of reduce phases may follow it.
 */
public interface MapReduceBuilder {

    MapReduceBuilder add(String bucket, String key);

    MapReduceBuilder addBucket(String bucket);

    MapReduceBuilder map(MapPhase phase);

    MapReduceBuilder reduce(ReducePhase phase);

    MapReduceBuilder reduce(ReducePhase phase, Object argument);

    /**
     * Submits the job and streams its output back.
     * <p>
     * The returned iterator is single pass. Failures that happen while the job is running may be
     * raised either from this method or later, from the iterator.
     *
     * @param timeout the maximum time the job is allowed to run
     * @return the job output
     * @throws JobTimeoutException if the job does not finish in time
     * @throws StoreException      if the store fails to run the job
     */
    Iterator<QueryResult> run(Duration timeout);
}
