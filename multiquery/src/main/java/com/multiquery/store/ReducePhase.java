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

import java.util.List;

/**
 * Whole-list function of a computation job. Reduce phases run in the order they were added, each
 * one receiving the output of the previous phase.
 */
@FunctionalInterface
public interface ReducePhase {

    /**
     * @param values   rows produced by the previous phase
     * @param argument the static argument registered along with this phase, may be null
     * @return the rows passed to the next phase
     */
    List<QueryResult> reduce(List<QueryResult> values, Object argument);
}
