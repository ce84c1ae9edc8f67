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

import java.util.Iterator;
import java.util.LinkedList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tracks a measurement over a sliding window.  For example, this class can count imported files over time and
 * provide an average files/second over the window.
 */
public class PerformanceWindow implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PerformanceWindow.class);
    private final long sliceInterval;
    private final int sliceCount;

    private final AtomicLong currentValue = new AtomicLong();
    private final ScheduledExecutorService updater;
    private final LinkedList<PerformanceSlice> slices = new LinkedList<>();

    private long windowSum;
    private long windowRate;
    private long currentWindowStart;

    /**
     * @param sliceInterval size of a slice of the window in milliseconds
     * @param sliceCount    number of slices in the window.
     */
    public PerformanceWindow(long sliceInterval, int sliceCount) {
        this.sliceInterval = sliceInterval;
        this.sliceCount = sliceCount;

        currentWindowStart = System.currentTimeMillis();
        updater = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "perf-window");
            t.setDaemon(true);
            return t;
        });
        updater.scheduleAtFixedRate(this::update, sliceInterval, sliceInterval, TimeUnit.MILLISECONDS);
    }

    public void increment(final long value) {
        currentValue.addAndGet(value);
    }

    private void update() {
        long now = System.currentTimeMillis();
        PerformanceSlice completedSlice = new PerformanceSlice(currentWindowStart, now, currentValue.getAndSet(0));
        currentWindowStart = now;
        slices.add(completedSlice);

        long sum = 0;
        long startTime = Long.MAX_VALUE;
        long endTime = 0;
        long maxAge = sliceInterval * sliceCount + 50; // 50 ms fudge for timing
        for (Iterator<PerformanceSlice> i = slices.iterator(); i.hasNext(); ) {
            PerformanceSlice p = i.next();
            if (now - p.sliceStart > maxAge) {
                i.remove();
                continue;
            }
            sum += p.value;
            startTime = Math.min(startTime, p.sliceStart);
            endTime = Math.max(endTime, p.sliceEnd);
        }
        long duration = endTime - startTime;
        long rate = duration > 0 ? (long) ((double) sum / (duration / 1000.0)) : 0;

        synchronized (this) {
            this.windowSum = sum;
            this.windowRate = rate;
        }
        log.trace("window update: sum={} duration={} rate={}", sum, duration, rate);
    }

    @Override
    public void close() {
        updater.shutdownNow();
    }

    public synchronized long getWindowSum() {
        return windowSum;
    }

    /**
     * @return the rate in items/s for the current window.
     */
    public synchronized long getWindowRate() {
        return windowRate;
    }

    private static class PerformanceSlice {
        final long sliceStart;
        final long sliceEnd;
        final long value;

        PerformanceSlice(long sliceStart, long sliceEnd, long value) {
            this.sliceStart = sliceStart;
            this.sliceEnd = sliceEnd;
            this.value = value;
        }
    }
}
