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

import com.google.common.collect.ImmutableSet;

import java.util.Set;

/**
 * What a computation job reads: either a known set of keys or every object in a bucket.
 */
public sealed interface JobInput permits JobInput.Keys, JobInput.WholeBucket {

    static JobInput keys(String bucket, Set<String> keys) {
        return new Keys(bucket, keys);
    }

    static JobInput wholeBucket(String bucket) {
        return new WholeBucket(bucket);
    }

    String bucket();

    /**
     * @param bucket the bucket the keys belong to
     * @param keys   the candidate keys in the order they were first found
     */
    record Keys(String bucket, Set<String> keys) implements JobInput {
        public Keys {
            keys = ImmutableSet.copyOf(keys);
        }
    }

    record WholeBucket(String bucket) implements JobInput {
    }
}
