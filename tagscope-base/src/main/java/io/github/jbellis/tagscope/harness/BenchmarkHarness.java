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

import io.github.jbellis.tagscope.analysis.AggregationResult;
import io.github.jbellis.tagscope.analysis.AnalysisEngine;
import io.github.jbellis.tagscope.analysis.HashAggregationEngine;
import io.github.jbellis.tagscope.analysis.HeapRankingEngine;
import io.github.jbellis.tagscope.analysis.RankingResult;
import io.github.jbellis.tagscope.model.TagSelection;
import io.github.jbellis.tagscope.model.VideoRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.LongSupplier;

/**
 * Runs the ranking and aggregation engines head-to-head over identical input.
 * <p>
 * Each run times the ranking engine and then the aggregation engine, back to back, from
 * immediately before the computation to immediately after it. Only the compute step is
 * timed; nothing is formatted or printed inside the measured interval. Runs are strictly
 * sequential and every run recomputes both results from scratch.
 */
public class BenchmarkHarness {
    private static final Logger logger = LoggerFactory.getLogger(BenchmarkHarness.class);

    /** Number of runs used by {@link #compare(List, TagSelection)}. */
    public static final int DEFAULT_RUNS = 3;

    static final String INVALID_RUNS = "invalid configuration: runs must be >= 1";

    // keeps the JIT from discarding results it can prove are unused
    private static volatile long SINK;

    private final AnalysisEngine<RankingResult> rankingEngine;
    private final AnalysisEngine<AggregationResult> aggregationEngine;
    private final LongSupplier clock;

    public BenchmarkHarness() {
        this(new HeapRankingEngine(), new HashAggregationEngine(), System::nanoTime);
    }

    /**
     * @param rankingEngine the priority-structure strategy
     * @param aggregationEngine the grouping-structure strategy
     * @param clock a monotonic nanosecond clock
     */
    public BenchmarkHarness(AnalysisEngine<RankingResult> rankingEngine,
                            AnalysisEngine<AggregationResult> aggregationEngine,
                            LongSupplier clock) {
        this.rankingEngine = rankingEngine;
        this.aggregationEngine = aggregationEngine;
        this.clock = clock;
    }

    /**
     * Compares the engines over {@value #DEFAULT_RUNS} runs.
     *
     * @param records the records to analyze; never modified
     * @param selection the query strings
     * @return the completed comparison
     */
    public BenchmarkOutcome compare(List<VideoRecord> records, TagSelection selection) {
        return compare(records, selection, DEFAULT_RUNS);
    }

    /**
     * @param records the records to analyze; never modified
     * @param selection the query strings
     * @param runs the number of runs, at least 1
     * @return the comparison, or a failed outcome when runs is less than 1
     */
    public BenchmarkOutcome compare(List<VideoRecord> records, TagSelection selection, int runs) {
        if (runs < 1) {
            logger.warn("Refusing to benchmark with {} runs", runs);
            return BenchmarkOutcome.invalid(INVALID_RUNS);
        }

        List<RunTiming> timings = new ArrayList<>(runs);
        for (int run = 1; run <= runs; run++) {
            long start = clock.getAsLong();
            RankingResult ranking = rankingEngine.analyze(records, selection);
            long heapNanos = clock.getAsLong() - start;

            start = clock.getAsLong();
            AggregationResult aggregation = aggregationEngine.analyze(records, selection);
            long hashNanos = clock.getAsLong() - start;

            SINK += ranking.getMatchCount() + aggregation.totalSamples();

            var timing = new RunTiming(run, heapNanos, hashNanos);
            timings.add(timing);
            logger.debug("{} ({} records, tags [{}])", timing, records.size(), selection);
        }

        var report = new BenchmarkReport(timings, records.size(), selection);
        logger.info("{} vs {} over {} runs: {} ms vs {} ms, {}",
                rankingEngine.getName(), aggregationEngine.getName(), runs,
                report.getAvgHeapMillis(), report.getAvgHashMillis(), report.getVerdict());
        return BenchmarkOutcome.completed(report);
    }
}
