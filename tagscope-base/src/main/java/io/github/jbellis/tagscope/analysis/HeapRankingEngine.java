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

package io.github.jbellis.tagscope.analysis;

import io.github.jbellis.tagscope.model.TagSelection;
import io.github.jbellis.tagscope.model.VideoRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Ranks matching records by like/view ratio using an unbounded max-heap.
 * <p>
 * Every (tag, query) match pushes the record once, so the heap is a multiset: a record whose
 * tags match the selection several times appears several times in the ranking. After the scan,
 * the top {@code topK} entries are popped in descending ratio order.
 * <p>
 * Entries with equal ratios come out in ascending title order. Entries that share both ratio
 * and title are indistinguishable in the result.
 */
public class HeapRankingEngine implements AnalysisEngine<RankingResult> {
    /** Number of entries returned when no limit is given. */
    public static final int DEFAULT_TOP_K = 10;

    /** Highest ratio first, then lexicographic title. */
    static final Comparator<VideoRecord> BEST_FIRST =
            Comparator.comparingDouble(VideoRecord::getRatio).reversed()
                    .thenComparing(VideoRecord::getTitle);

    private final int topK;

    public HeapRankingEngine() {
        this(DEFAULT_TOP_K);
    }

    /**
     * @param topK the maximum number of entries to return
     * @throws IllegalArgumentException if topK is negative
     */
    public HeapRankingEngine(int topK) {
        if (topK < 0) {
            throw new IllegalArgumentException("topK must be non-negative, got " + topK);
        }
        this.topK = topK;
    }

    @Override
    public String getName() {
        return "heap";
    }

    public int getTopK() {
        return topK;
    }

    @Override
    public RankingResult analyze(List<VideoRecord> records, TagSelection selection) {
        return rank(records, selection, topK);
    }

    /**
     * Ranks with the default limit of {@value #DEFAULT_TOP_K}.
     *
     * @param records the records to scan
     * @param selection the query strings
     * @return the top matches, best-first
     */
    public static RankingResult rank(List<VideoRecord> records, TagSelection selection) {
        return rank(records, selection, DEFAULT_TOP_K);
    }

    /**
     * @param records the records to scan
     * @param selection the query strings
     * @param topK the maximum number of entries to return
     * @return the top matches, best-first; fewer than topK when there are fewer matches
     */
    public static RankingResult rank(List<VideoRecord> records, TagSelection selection, int topK) {
        if (topK < 0) {
            throw new IllegalArgumentException("topK must be non-negative, got " + topK);
        }
        var heap = new PriorityQueue<VideoRecord>(BEST_FIRST);
        for (VideoRecord record : records) {
            for (String tag : record.getTags()) {
                for (String query : selection) {
                    if (TagMatcher.matches(tag, query)) {
                        heap.add(record);
                    }
                }
            }
        }

        int matchCount = heap.size();
        int n = Math.min(topK, matchCount);
        List<RankingResult.RankedEntry> entries = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            VideoRecord top = heap.poll();
            entries.add(new RankingResult.RankedEntry(i + 1, top.getTitle(), top.getRatio()));
        }
        return new RankingResult(entries, matchCount);
    }
}
