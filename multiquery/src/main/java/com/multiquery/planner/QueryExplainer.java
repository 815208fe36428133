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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.multiquery.common.MultiQueryException;
import com.multiquery.job.ReduceStage;
import com.multiquery.job.SliceReduce;
import com.multiquery.job.SortReduce;
import com.multiquery.predicate.DocumentPredicate;
import com.multiquery.query.Filter;
import com.multiquery.query.QuerySnapshot;

import java.time.Duration;

/**
 * Describes the plan of a query as JSON without running anything against the store.
 * <p>
 * Example output for {@code filter("age", "<", 50).order("age", "ASC")}:
 * <pre>{@code
 * {
 *   "bucket" : "users",
 *   "input" : "index-candidates",
 *   "lookups" : [ {
 *     "index" : "age_int",
 *     "kind" : "int",
 *     "type" : "range",
 *     "start" : -99999999999999999,
 *     "end" : 50
 *   } ],
 *   "predicate" : "data.age < 50",
 *   "reduce" : [ { "type" : "sort", "field" : "age", "direction" : "ASC" } ],
 *   "timeout_ms" : 9000
 * }
 * }</pre>
 */
public class QueryExplainer {
    private final ObjectMapper objectMapper;
    private final IndexLookupTranslator translator;
    private final PredicateCompiler compiler;
    private final PipelineAssembler assembler;

    public QueryExplainer(ObjectMapper objectMapper, IndexLookupTranslator translator, PredicateCompiler compiler, PipelineAssembler assembler) {
        this.objectMapper = objectMapper;
        this.translator = translator;
        this.compiler = compiler;
        this.assembler = assembler;
    }

    public ObjectNode explainTree(QuerySnapshot snapshot, Duration timeout) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("bucket", snapshot.bucket());
        root.put("input", snapshot.filters().isEmpty() ? "bucket" : "index-candidates");

        ArrayNode lookups = root.putArray("lookups");
        for (Filter filter : snapshot.filters()) {
            IndexLookup lookup = translator.translate(snapshot.bucket(), filter);
            ObjectNode node = lookups.addObject();
            node.put("index", lookup.index());
            node.put("kind", lookup.kind().suffix());
            if (lookup instanceof IndexLookup.Exact exact) {
                node.put("type", "exact");
                node.putPOJO("value", exact.value());
            } else if (lookup instanceof IndexLookup.Range range) {
                node.put("type", "range");
                node.putPOJO("start", range.start());
                node.putPOJO("end", range.end());
            }
        }

        DocumentPredicate predicate = compiler.compile(snapshot.filters());
        root.put("predicate", predicate.expression());

        ArrayNode reduces = root.putArray("reduce");
        for (ReduceStage stage : assembler.reduceStages(snapshot)) {
            ObjectNode node = reduces.addObject();
            node.put("type", stage.type());
            if (stage instanceof SortReduce sort) {
                node.put("field", sort.field());
                node.put("direction", sort.direction().name());
            } else if (stage instanceof SliceReduce slice) {
                node.put("start", slice.start());
                node.put("end", slice.end());
            }
        }
        root.put("timeout_ms", timeout.toMillis());
        return root;
    }

    public String explain(QuerySnapshot snapshot, Duration timeout) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(explainTree(snapshot, timeout));
        } catch (JsonProcessingException e) {
            throw new MultiQueryException("Failed to render query plan", e);
        }
    }
}
