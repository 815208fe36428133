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
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class JobExecutorsTest {

    @Test
    void test_newBoundedExecutor_withDefaultConfiguration() throws Exception {
        ExecutorService executor = JobExecutors.newBoundedExecutor();
        assertNotNull(executor);

        try {
            AtomicReference<Thread> worker = new AtomicReference<>();
            Future<?> future = executor.submit(() -> worker.set(Thread.currentThread()));
            future.get(5, TimeUnit.SECONDS);

            assertTrue(future.isDone());
            assertTrue(worker.get().isDaemon());
            assertTrue(worker.get().getName().startsWith("multiquery-job-"));
        } finally {
            executor.shutdownNow();
            assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void test_newBoundedExecutor_withCustomParameters() throws Exception {
        ThreadFactory factory = new ThreadFactoryBuilder()
                .setNameFormat("test-worker-%d")
                .build();

        ExecutorService executor = JobExecutors.newBoundedExecutor(4, 1L, TimeUnit.MINUTES, factory);

        try {
            CountDownLatch latch = new CountDownLatch(1);
            Future<?> future = executor.submit(latch::countDown);

            assertTrue(latch.await(5, TimeUnit.SECONDS));
            future.get(5, TimeUnit.SECONDS);
            assertTrue(future.isDone());
        } finally {
            executor.shutdownNow();
            assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void test_newBoundedExecutor_growsToMaxThreads() throws Exception {
        ThreadFactory factory = new ThreadFactoryBuilder()
                .setNameFormat("scale-test-%d")
                .build();
        ExecutorService executor = JobExecutors.newBoundedExecutor(4, 1L, TimeUnit.MINUTES, factory);

        try {
            CountDownLatch started = new CountDownLatch(4);
            CountDownLatch release = new CountDownLatch(1);
            for (int i = 0; i < 4; i++) {
                executor.submit(() -> {
                    started.countDown();
                    release.await();
                    return null;
                });
            }

            // Every task blocks, so all four only start when the pool has four threads
            assertTrue(started.await(5, TimeUnit.SECONDS));
            release.countDown();
        } finally {
            executor.shutdownNow();
            assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void test_newBoundedExecutor_invalidMaxThreads() {
        ThreadFactory factory = new ThreadFactoryBuilder().build();

        assertThrows(IllegalArgumentException.class,
                () -> JobExecutors.newBoundedExecutor(0, 1L, TimeUnit.MINUTES, factory));
    }
}
