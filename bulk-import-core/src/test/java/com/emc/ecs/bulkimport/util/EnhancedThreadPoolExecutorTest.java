/*
 * Copyright (c) 2014-2022 Dell Inc. or its subsidiaries. All Rights Reserved.
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
package com.emc.ecs.bulkimport.util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

public class EnhancedThreadPoolExecutorTest {
    public static final int THREAD_COUNT = 2;
    public static final int TASK_COUNT = 10;

    @Test
    public void testStopDrainsQueuedTasks() throws Exception {
        CountDownLatch started = new CountDownLatch(THREAD_COUNT);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger completed = new AtomicInteger();

        EnhancedThreadPoolExecutor executor = new EnhancedThreadPoolExecutor(THREAD_COUNT,
                new LinkedBlockingDeque<>(), "test-pool");
        try {
            for (int i = 0; i < TASK_COUNT; i++) {
                executor.blockingSubmit(new BlockedJob(started, release, completed));
            }
            Assertions.assertTrue(started.await(10, TimeUnit.SECONDS));
            Assertions.assertEquals(TASK_COUNT, executor.getUnfinishedTasks());
            Assertions.assertEquals(THREAD_COUNT, executor.getActiveCount());

            List<Runnable> drained = executor.stop();
            Assertions.assertEquals(TASK_COUNT - THREAD_COUNT, drained.size());
            for (Runnable r : drained) {
                Assertions.assertTrue(r instanceof BlockedJob);
            }
            Assertions.assertEquals(THREAD_COUNT, executor.getUnfinishedTasks());

            // running tasks are left to finish
            release.countDown();
            long deadline = System.currentTimeMillis() + 10000;
            while (executor.getUnfinishedTasks() > 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }
            Assertions.assertEquals(0, executor.getUnfinishedTasks());
            Assertions.assertEquals(THREAD_COUNT, completed.get());
            Assertions.assertEquals(0, executor.getActiveCount());
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    public void testBlockingSubmitWaitsForSpace() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger completed = new AtomicInteger();

        // one worker, room for one queued task
        EnhancedThreadPoolExecutor executor = new EnhancedThreadPoolExecutor(1, new LinkedBlockingDeque<>(1));
        try {
            executor.blockingSubmit(new BlockedJob(started, release, completed));
            Assertions.assertTrue(started.await(10, TimeUnit.SECONDS));
            executor.blockingSubmit(new BlockedJob(new CountDownLatch(1), release, completed));

            Thread submitter = new Thread(() -> executor.blockingSubmit(new BlockedJob(new CountDownLatch(1), release, completed)));
            submitter.start();
            submitter.join(500);
            Assertions.assertTrue(submitter.isAlive());

            release.countDown();
            submitter.join(10000);
            Assertions.assertFalse(submitter.isAlive());

            long deadline = System.currentTimeMillis() + 10000;
            while (executor.getUnfinishedTasks() > 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }
            Assertions.assertEquals(3, completed.get());
        } finally {
            release.countDown();
            executor.shutdownNow();
        }
    }

    @Test
    public void testSubmitAfterShutdown() {
        EnhancedThreadPoolExecutor executor = new EnhancedThreadPoolExecutor(1, new LinkedBlockingDeque<>());
        executor.shutdown();
        Assertions.assertThrows(IllegalStateException.class, () -> executor.blockingSubmit(() -> {
        }));
        Assertions.assertEquals(0, executor.getUnfinishedTasks());
    }

    static class BlockedJob implements Runnable {
        private final CountDownLatch started;
        private final CountDownLatch release;
        private final AtomicInteger completed;

        BlockedJob(CountDownLatch started, CountDownLatch release, AtomicInteger completed) {
            this.started = started;
            this.release = release;
            this.completed = completed;
        }

        @Override
        public void run() {
            started.countDown();
            try {
                release.await();
                completed.incrementAndGet();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
