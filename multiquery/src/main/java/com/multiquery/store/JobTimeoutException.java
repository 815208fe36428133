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

import java.time.Duration;

public class JobTimeoutException extends StoreException {
    private final Duration timeout;

    public JobTimeoutException(Duration timeout) {
        super(String.format("Computation job did not finish in %d ms", timeout.toMillis()));
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
