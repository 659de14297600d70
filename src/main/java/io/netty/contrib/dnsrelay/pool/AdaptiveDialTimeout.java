/*
 * Copyright 2024 The Netty Project
 *
 * The Netty Project licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */
package io.netty.contrib.dnsrelay.pool;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static io.netty.util.internal.ObjectUtil.checkPositive;

/**
 * Derives the timeout of the next dial from the dial latencies observed so far.
 * <p>
 * The observed latency is tracked as a moving average {@code avg += (observed - avg) / weight}.
 * The next timeout is twice that average, but never less than the minimum and never more than the
 * maximum. The average starts at half the maximum.
 * <p>
 * This class is thread-safe. Concurrent updates may interleave, which only makes the average
 * slightly less exact.
 */
public final class AdaptiveDialTimeout {

    private final long minNanos;
    private final long maxNanos;
    private final long weight;
    private final AtomicLong averageNanos;

    public AdaptiveDialTimeout(long min, long max, TimeUnit unit, int weight) {
        minNanos = unit.toNanos(checkPositive(min, "min"));
        maxNanos = unit.toNanos(checkPositive(max, "max"));
        if (minNanos > maxNanos) {
            throw new IllegalArgumentException("min: " + min + " (expected: <= max " + max + ')');
        }
        this.weight = checkPositive(weight, "weight");
        averageNanos = new AtomicLong(maxNanos / 2);
    }

    /**
     * Returns the timeout to use for the next dial.
     */
    public long timeoutNanos() {
        long rt = averageNanos.get();
        if (rt < minNanos) {
            return minNanos;
        }
        if (rt < maxNanos / 2) {
            return 2 * rt;
        }
        return maxNanos;
    }

    public long timeoutMillis() {
        return TimeUnit.NANOSECONDS.toMillis(timeoutNanos());
    }

    /**
     * Folds the duration of a finished dial attempt, successful or not, into the average.
     */
    public void record(long observedNanos) {
        long dt = averageNanos.get();
        averageNanos.addAndGet((observedNanos - dt) / weight);
    }

    public long averageNanos() {
        return averageNanos.get();
    }
}
