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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.multiquery.common.utils.Utils;
import com.multiquery.config.QueryConfig;
import com.multiquery.job.JobInput;
import com.multiquery.job.JobSpec;
import com.multiquery.planner.CandidateKeyAggregator;
import com.multiquery.planner.IndexLookupTranslator;
import com.multiquery.planner.PipelineAssembler;
import com.multiquery.planner.PredicateCompiler;
import com.multiquery.planner.QueryExplainer;
import com.multiquery.predicate.DocumentPredicate;
import com.multiquery.store.StoreClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Multi-predicate, sortable, paginated queries over a store that only offers single-field secondary
 * index lookups.
 * <p>
 * A run first unions the keys returned by one index lookup per filter, then submits a map/reduce job
 * over those keys, or over the whole bucket if the lookups found nothing, that applies all filters
 * exactly, sorts and slices the result.
 *
 * <h2>Usage Example:</h2>
 * <pre>{@code
 * MultiIndexQuery query = new MultiIndexQuery(client, "users");
 * for (QueryResult result : query.filter("age", "<", 50).order("age", "ASC").limit(10).run()) {
 *     System.out.println(result.key() + " " + result.document());
 * }
 * query.reset();
 * }</pre>
 *
 * <h2>Thread Safety:</h2>
 * <p>Instances are not thread-safe. Builder calls, {@code run} and {@code reset} must not overlap.
 * {@code run} works on a snapshot of the state taken when it is called, so changing the query
 * while a previously returned cursor is being consumed does not affect that cursor.
 */
public class MultiIndexQuery {
    private final StoreClient client;
    private final String bucket;
    private final Duration defaultTimeout;
    private final CandidateKeyAggregator aggregator;
    private final PredicateCompiler compiler;
    private final PipelineAssembler assembler;
    private final QueryExplainer explainer;

    private final List<Filter> filters = new ArrayList<>();
    private Order order;
    private int offset;
    private int limit;

    public MultiIndexQuery(StoreClient client, String bucket) {
        this(client, bucket, QueryConfig.load());
    }

    public MultiIndexQuery(StoreClient client, String bucket, QueryConfig config) {
        Preconditions.checkNotNull(client, "client");
        Preconditions.checkArgument(!Utils.isEmpty(bucket), "bucket name cannot be empty");
        this.client = client;
        this.bucket = bucket;
        this.defaultTimeout = config.defaultTimeout();

        IndexLookupTranslator translator = new IndexLookupTranslator(config.integerBound());
        this.aggregator = new CandidateKeyAggregator(translator);
        this.compiler = new PredicateCompiler();
        this.assembler = new PipelineAssembler(config.documentCodec());
        this.explainer = new QueryExplainer(new ObjectMapper(), translator, compiler, assembler);
        reset();
    }

    public String bucket() {
        return bucket;
    }

    /**
     * Clears filters, order, offset and limit. Can be called at any time.
     *
     * @return this query
     */
    public MultiIndexQuery reset() {
        filters.clear();
        order = null;
        offset = 0;
        limit = 0;
        return this;
    }

    /**
     * Adds a condition, e.g. {@code filter("age", ">=", 25)}. Nothing is validated until the query runs.
     *
     * @param field    the document field
     * @param operator one of {@code ==, >, >=, <, <=}
     * @param value    a string or a number
     * @return this query
     */
    public MultiIndexQuery filter(String field, String operator, Object value) {
        filters.add(new Filter(field, operator, value));
        return this;
    }

    /**
     * Sets the number of results to skip. Only applied when a limit is set.
     *
     * @param offset the offset, not validated
     * @return this query
     */
    public MultiIndexQuery offset(int offset) {
        this.offset = offset;
        return this;
    }

    /**
     * Removes the limit, same as {@code limit(0)}.
     *
     * @return this query
     */
    public MultiIndexQuery limit() {
        return limit(0);
    }

    /**
     * Sets the maximum number of results. 0 returns all results.
     *
     * @param limit the limit
     * @return this query
     */
    public MultiIndexQuery limit(int limit) {
        this.limit = limit;
        return this;
    }

    public MultiIndexQuery order(String field) {
        return order(field, Direction.ASC.name());
    }

    /**
     * Sorts the results by a numeric field, replacing any previous order.
     *
     * @param field     the field to sort by
     * @param direction {@code DESC} for descending order, anything else sorts ascending
     * @return this query
     */
    public MultiIndexQuery order(String field, String direction) {
        this.order = new Order(field, direction);
        return this;
    }

    public MultiIndexQuery order(String field, Direction direction) {
        return order(field, direction.name());
    }

    public QuerySnapshot snapshot() {
        return new QuerySnapshot(bucket, filters, order, offset, limit);
    }

    /**
     * Runs the query with the configured default timeout.
     *
     * @return a single-pass cursor over the matching documents
     * @see #run(Duration)
     */
    public QueryCursor run() {
        return run(defaultTimeout);
    }

    /**
     * Runs the query: issues the index lookups, builds the computation job and submits it.
     *
     * @param timeout the job timeout
     * @return a single-pass cursor over the matching documents
     * @throws InvalidOperatorException                    if a filter has an unsupported operator
     * @throws InvalidFilterValueException                 if a filter value is neither text nor a number
     * @throws com.multiquery.store.StoreException if a lookup or the job submission fails
     */
    public QueryCursor run(Duration timeout) {
        QueryExecution execution = new QueryExecution(snapshot());
        QuerySnapshot snapshot = execution.snapshot();
        try {
            execution.advance(ExecutionStage.LOOKUPS_ISSUED);
            JobInput input = aggregator.aggregate(client, snapshot);
            execution.advance(ExecutionStage.CANDIDATES_AGGREGATED);

            DocumentPredicate predicate = compiler.compile(snapshot.filters());
            execution.advance(ExecutionStage.PREDICATE_COMPILED);

            JobSpec spec = assembler.assemble(snapshot, input, predicate, timeout);
            execution.advance(ExecutionStage.JOB_ASSEMBLED);

            return assembler.submit(client, spec, execution);
        } catch (RuntimeException e) {
            execution.fail(e);
            throw e;
        }
    }

    /**
     * Describes what {@link #run()} would do, as JSON, without touching the store.
     *
     * @return the plan
     * @throws InvalidOperatorException if a filter has an unsupported operator
     */
    public String explain() {
        return explainer.explain(snapshot(), defaultTimeout);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append("MultiIndexQuery(bucket=").append(bucket).append(")");
        if (!filters.isEmpty()) {
            builder.append('.').append(filters.stream()
                    .map(filter -> "filter(" + filter + ")")
                    .collect(Collectors.joining(".")));
        }
        if (order == null) {
            builder.append(".order(None, 'ASC')");
        } else {
            builder.append(".order(").append(order.field()).append(", ")
                    .append(Filter.literal(order.direction())).append(")");
        }
        builder.append(".offset(").append(offset).append(")");
        builder.append(".limit(").append(limit).append(")");
        return builder.toString();
    }
}
