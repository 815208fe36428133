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

package com.multiquery.store.memory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Factory methods for the executors that run in-memory computation jobs.
 * <p>
 * The pools start a new thread per task up to a maximum number of threads, queue tasks without
 * bound once all threads are busy and let idle threads time out, so an idle pool holds no threads.
 */
public final class JobExecutors {

    private JobExecutors() {
    }

    /**
     * @param maxThreads    the maximum number of threads, must be greater than 0
     * @param keepAliveTime how long an idle thread is kept
     * @param timeUnit      the unit of {@code keepAliveTime}
     * @param factory       the thread factory
     * @return a new bounded executor
     * @throws IllegalArgumentException if {@code maxThreads} is less than or equal to 0
     */
    public static ExecutorService newBoundedExecutor(
            int maxThreads,
            long keepAliveTime,
            TimeUnit timeUnit,
            ThreadFactory factory
    ) {
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                maxThreads,
                maxThreads,
                keepAliveTime,
                timeUnit,
                new LinkedBlockingQueue<>(),
                factory
        );
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }

    /**
     * Creates an executor with one thread per available processor, a one minute keep-alive and daemon
     * threads named {@code multiquery-job-%d}.
     *
     * @return a new bounded executor
     */
    public static ExecutorService newBoundedExecutor() {
        int maxThreads = Runtime.getRuntime().availableProcessors();
        ThreadFactory factory = new ThreadFactoryBuilder()
                .setNameFormat("multiquery-job-%d")
                .setDaemon(true)
                .build();
        return newBoundedExecutor(maxThreads, 1L, TimeUnit.MINUTES, factory);
    }
}
