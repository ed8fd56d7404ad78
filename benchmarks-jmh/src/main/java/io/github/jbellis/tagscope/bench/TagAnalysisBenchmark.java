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

package io.github.jbellis.tagscope.bench;

import io.github.jbellis.tagscope.analysis.HashAggregationEngine;
import io.github.jbellis.tagscope.analysis.HeapRankingEngine;
import io.github.jbellis.tagscope.model.TagSelection;
import io.github.jbellis.tagscope.model.VideoRecord;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * Compares the heap ranking and hash table aggregation strategies on a synthetic dataset.
 * <p>
 * Records are generated once per trial from a fixed seed. Each record draws its tags from a
 * small vocabulary of compound tags ("music", "musicvideo", "livemusic", ...), so a selection of
 * short substrings produces several matches per record, as real trending-video tags do.
 * <p>
 * Key characteristics:
 * <ul>
 *   <li>Deterministic input: the same records and selection for both strategies</li>
 *   <li>Only the compute step is measured; nothing is printed</li>
 *   <li>Results are consumed by the blackhole so the work cannot be eliminated</li>
 * </ul>
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Thread)
@Fork(1)
@Warmup(iterations = 2)
@Measurement(iterations = 5)
@Threads(1)
public class TagAnalysisBenchmark {
    private static final Logger log = LoggerFactory.getLogger(TagAnalysisBenchmark.class);

    private static final String[] VOCABULARY = {
            "music", "musicvideo", "livemusic", "gaming", "gamingnews", "letsplay",
            "news", "comedy", "vlog", "tutorial", "sports", "highlights", "trailer", "review"
    };

    @Param({"10000", "100000"})
    int recordCount;

    @Param({"4"})
    int tagsPerRecord;

    private List<VideoRecord> records;
    private TagSelection selection;

    /**
     * Creates a new benchmark instance.
     * <p>
     * This constructor is invoked by JMH and should not be called directly.
     */
    public TagAnalysisBenchmark() {
    }

    @Setup
    public void setup() {
        var random = new Random(42);
        records = new ArrayList<>(recordCount);
        for (int i = 0; i < recordCount; i++) {
            List<String> tags = new ArrayList<>(tagsPerRecord);
            for (int t = 0; t < tagsPerRecord; t++) {
                tags.add(VOCABULARY[random.nextInt(VOCABULARY.length)]);
            }
            double views = random.nextInt(1_000_000);
            double likes = views == 0 ? 0 : random.nextInt((int) views / 10 + 1);
            records.add(new VideoRecord("video-" + i, tags, views, likes));
        }
        selection = TagSelection.of("music", "gaming", "news");
        log.info("Generated {} records with {} tags each, selection [{}]", recordCount, tagsPerRecord, selection);
    }

    @Benchmark
    public void heapRanking(Blackhole blackhole) {
        blackhole.consume(HeapRankingEngine.rank(records, selection));
    }

    @Benchmark
    public void hashAggregation(Blackhole blackhole) {
        blackhole.consume(HashAggregationEngine.aggregate(records, selection));
    }
}
