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

import com.multiquery.codec.DocumentCodec;
import com.multiquery.job.JobInput;
import com.multiquery.job.JobSpec;
import com.multiquery.job.PredicateFilterMap;
import com.multiquery.job.QueryResult;
import com.multiquery.job.ReduceStage;
import com.multiquery.job.SliceReduce;
import com.multiquery.job.SortReduce;
import com.multiquery.predicate.DocumentPredicate;
import com.multiquery.query.ExecutionStage;
import com.multiquery.query.QueryCursor;
import com.multiquery.query.QueryExecution;
import com.multiquery.query.QuerySnapshot;
import com.multiquery.store.MapReduceBuilder;
import com.multiquery.store.StoreClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Assembles the map/reduce job of a query and submits it.
 * <p>
 * The job always has the predicate filter as its map stage. A sort stage follows when the query
 * has an order, then a slice stage when it has a positive limit. An offset without a limit has
 * no effect.
 */
public class PipelineAssembler {
    private static final Logger LOGGER = LoggerFactory.getLogger(PipelineAssembler.class);

    private final DocumentCodec codec;

    public PipelineAssembler(DocumentCodec codec) {
        this.codec = codec;
    }

    /**
     * @param snapshot the query state
     * @return the reduce stages the query needs, in execution order
     */
    public List<ReduceStage> reduceStages(QuerySnapshot snapshot) {
        List<ReduceStage> stages = new ArrayList<>(2);
        if (snapshot.hasOrder()) {
            stages.add(new SortReduce(snapshot.order().field(), snapshot.order().sortDirection()));
        }
        if (snapshot.hasLimit()) {
            stages.add(SliceReduce.window(snapshot.offset(), snapshot.limit()));
        }
        return stages;
    }

    public JobSpec assemble(QuerySnapshot snapshot, JobInput input, DocumentPredicate predicate, Duration timeout) {
        JobSpec spec = new JobSpec(input, new PredicateFilterMap(predicate, codec), reduceStages(snapshot), timeout);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Assembled job on bucket '{}': predicate [{}], {} reduce stage(s)",
                    input.bucket(), predicate.expression(), spec.reduces().size());
        }
        return spec;
    }

    /**
     * Feeds a job spec into the store's job builder and submits it.
     *
     * @param client    the store that runs the job
     * @param spec      the job to run
     * @param execution the execution the cursor reports to
     * @return a cursor over the job output
     */
    public QueryCursor submit(StoreClient client, JobSpec spec, QueryExecution execution) {
        MapReduceBuilder builder = client.newMapReduce();
        JobInput input = spec.input();
        if (input instanceof JobInput.Keys keys) {
            for (String key : keys.keys()) {
                builder.add(keys.bucket(), key);
            }
        } else {
            builder.addBucket(input.bucket());
        }
        builder.map(spec.map());
        for (ReduceStage stage : spec.reduces()) {
            builder.reduce(stage, stage.argument());
        }

        Iterator<QueryResult> results = builder.run(spec.timeout());
        execution.advance(ExecutionStage.JOB_SUBMITTED);
        execution.advance(ExecutionStage.STREAMING);
        return new QueryCursor(results, execution);
    }
}
