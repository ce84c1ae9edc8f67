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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RunnableFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed-size pool with a bounded queue that blocks submitters instead of rejecting them and keeps an exact count of
 * tasks that have been submitted but not finished.
 */
public class EnhancedThreadPoolExecutor extends ThreadPoolExecutor {
    private static final Logger log = LoggerFactory.getLogger(EnhancedThreadPoolExecutor.class);

    public static final String DEFAULT_POOL_NAME = "x-pool";

    private final BlockingDeque<Runnable> workDeque;
    private final Object submitLock = new Object();
    private final AtomicLong unfinishedTasks = new AtomicLong();
    private final AtomicInteger activeTasks = new AtomicInteger();

    public EnhancedThreadPoolExecutor(int poolSize, BlockingDeque<Runnable> workDeque) {
        this(poolSize, workDeque, DEFAULT_POOL_NAME);
    }

    public EnhancedThreadPoolExecutor(int poolSize, BlockingDeque<Runnable> workDeque, String poolName) {
        this(poolSize, workDeque, new NamedThreadFactory(poolName));
    }

    public EnhancedThreadPoolExecutor(int poolSize, BlockingDeque<Runnable> workDeque, ThreadFactory threadFactory) {
        super(poolSize, poolSize, 0L, TimeUnit.MILLISECONDS, workDeque, threadFactory);
        this.workDeque = workDeque;
    }

    @Override
    protected void beforeExecute(Thread t, Runnable r) {
        // a new task started, so the queue should be smaller.
        synchronized (submitLock) {
            submitLock.notify();
        }

        activeTasks.incrementAndGet();

        super.beforeExecute(t, r);
    }

    @Override
    protected void afterExecute(Runnable r, Throwable t) {
        activeTasks.decrementAndGet();
        unfinishedTasks.decrementAndGet();
        super.afterExecute(r, t);
    }

    @Override
    protected <T> RunnableFuture<T> newTaskFor(Runnable runnable, T value) {
        return new EnhancedFutureTask<>(runnable, value);
    }

    @Override
    protected <T> RunnableFuture<T> newTaskFor(Callable<T> callable) {
        return new EnhancedFutureTask<>(callable);
    }

    /**
     * This will attempt to submit the task to the pool and, in the case where the queue is full, block until space is
     * available
     *
     * @throws IllegalStateException if the executor is shutting down or terminated
     */
    public void blockingSubmit(Runnable task) {
        while (true) {
            if (this.isShutdown()) throw new IllegalStateException("executor is shut down");

            synchronized (submitLock) {
                try {
                    this.submit(task);
                    return;
                } catch (RejectedExecutionException e) {
                    log.trace("task queue is full", e);
                }
                if (this.isShutdown()) throw new IllegalStateException("executor is shut down");
                try {
                    log.debug("task queue is full; waiting until space is available");
                    submitLock.wait(1000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("interrupted while waiting to submit a task", e);
                }
            }
        }
    }

    @Override
    @Nonnull
    public Future<?> submit(@Nonnull Runnable task) {
        // count first, so a task that finishes immediately cannot drive the counter negative
        unfinishedTasks.incrementAndGet();
        try {
            return super.submit(task);
        } catch (RuntimeException e) {
            unfinishedTasks.decrementAndGet();
            throw e;
        }
    }

    /**
     * Removes every task that has not started yet and returns the original runnables. Tasks already running are
     * left to complete.
     */
    public List<Runnable> stop() {
        List<Runnable> drained = new ArrayList<>();
        synchronized (submitLock) {
            Runnable r;
            while ((r = workDeque.pollFirst()) != null) {
                unfinishedTasks.decrementAndGet();
                if (r instanceof EnhancedFutureTask && ((EnhancedFutureTask<?>) r).getRunnable() != null)
                    drained.add(((EnhancedFutureTask<?>) r).getRunnable());
                else
                    drained.add(r);
            }
            submitLock.notifyAll();
        }
        return drained;
    }

    @Override
    public int getActiveCount() {
        return activeTasks.get();
    }

    public long getUnfinishedTasks() {
        return unfinishedTasks.get();
    }

    static class NamedThreadFactory implements ThreadFactory {
        private static final AtomicInteger poolNumber = new AtomicInteger();
        private final AtomicInteger threadNumber = new AtomicInteger();
        private final String threadPrefix;

        public NamedThreadFactory(String poolName) {
            if (poolName == null) {
                this.threadPrefix = DEFAULT_POOL_NAME + "-" + poolNumber.incrementAndGet() + "-t-";
            } else {
                this.threadPrefix = poolName + "-t-";
            }
        }

        @Override
        public Thread newThread(@Nonnull Runnable r) {
            Thread t = new Thread(r, threadPrefix + threadNumber.incrementAndGet());
            t.setUncaughtExceptionHandler((thread, e) -> log.warn("uncaught exception from task in " + thread.getName(), e));
            return t;
        }
    }
}
