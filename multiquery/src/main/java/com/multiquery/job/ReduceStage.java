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

import com.multiquery.store.ReducePhase;

/**
 * A reduce phase the planner adds to a job, along with the static argument it is registered with.
 */
public interface ReduceStage extends ReducePhase {

    /**
     * @return a short name for diagnostics, e.g. {@code sort}
     */
    String type();

    /**
     * @return the argument passed to the store together with this phase, or null
     */
    default Object argument() {
        return null;
    }
}
