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

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks the stage of one {@code run} call. An execution is created per run and never reused.
 */
public class QueryExecution {
    private static final Logger LOGGER = LoggerFactory.getLogger(QueryExecution.class);

    private final QuerySnapshot snapshot;
    private volatile ExecutionStage stage = ExecutionStage.IDLE;

    public QueryExecution(QuerySnapshot snapshot) {
        this.snapshot = snapshot;
    }

    public QuerySnapshot snapshot() {
        return snapshot;
    }

    public ExecutionStage stage() {
        return stage;
    }

    /**
     * Moves the execution forward.
     *
     * @param next the new stage, must come after the current one
     * @throws IllegalStateException if the transition goes backwards or leaves a terminal stage
     */
    public void advance(ExecutionStage next) {
        ExecutionStage current = stage;
        Preconditions.checkState(!current.isTerminal(), "Execution already finished with %s", current);
        Preconditions.checkState(next.ordinal() > current.ordinal() && next != ExecutionStage.FAILED,
                "Illegal stage transition %s -> %s", current, next);
        stage = next;
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Query on bucket '{}': {} -> {}", snapshot.bucket(), current, next);
        }
    }

    /**
     * Marks the execution as failed. Calling this on an already finished execution has no effect.
     *
     * @param cause the failure, logged at debug level
     */
    public void fail(Throwable cause) {
        ExecutionStage current = stage;
        if (current.isTerminal()) {
            return;
        }
        stage = ExecutionStage.FAILED;
        LOGGER.debug("Query on bucket '{}' failed at {}", snapshot.bucket(), current, cause);
    }
}
