/*
 * Copyright DataStax, Inc.
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

package io.github.jbellis.tagscope.harness;

import java.util.concurrent.TimeUnit;

/**
 * Elapsed time of both engines in one benchmark run.
 */
public final class RunTiming {
    private final int run;
    private final long heapNanos;
    private final long hashNanos;

    /**
     * @param run the 1-based run number
     * @param heapNanos elapsed nanoseconds of the ranking engine
     * @param hashNanos elapsed nanoseconds of the aggregation engine
     */
    public RunTiming(int run, long heapNanos, long hashNanos) {
        this.run = run;
        this.heapNanos = heapNanos;
        this.hashNanos = hashNanos;
    }

    public int getRun() {
        return run;
    }

    public long getHeapNanos() {
        return heapNanos;
    }

    public long getHashNanos() {
        return hashNanos;
    }

    /**
     * @return ranking time in whole milliseconds, truncated
     */
    public long getHeapMillis() {
        return TimeUnit.NANOSECONDS.toMillis(heapNanos);
    }

    /**
     * @return aggregation time in whole milliseconds, truncated
     */
    public long getHashMillis() {
        return TimeUnit.NANOSECONDS.toMillis(hashNanos);
    }

    @Override
    public String toString() {
        return String.format("Run %d: heap=%d ms, hash=%d ms", run, getHeapMillis(), getHashMillis());
    }
}
