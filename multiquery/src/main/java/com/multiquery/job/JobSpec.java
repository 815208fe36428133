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

package com.multiquery.job;

import com.google.common.collect.ImmutableList;

import java.time.Duration;
import java.util.List;

/**
 * Complete description of the computation job behind one query run. Built fresh for every run.
 *
 * @param input   the objects the job reads
 * @param map     the predicate filter applied to every object
 * @param reduces the reduce stages in execution order: sort, then slice, each optional
 * @param timeout the submission timeout
 */
public record JobSpec(JobInput input, PredicateFilterMap map, List<ReduceStage> reduces, Duration timeout) {

    public JobSpec {
        reduces = ImmutableList.copyOf(reduces);
    }
}
