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

import com.carrotsearch.randomizedtesting.RandomizedTest;
import com.carrotsearch.randomizedtesting.annotations.ThreadLeakScope;
import io.github.jbellis.tagscope.TestUtil;
import io.github.jbellis.tagscope.model.TagSelection;
import io.github.jbellis.tagscope.model.VideoRecord;
import org.junit.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

/**
 * Both strategies scan the same (record, tag, query) triples, so the heap's match count must
 * equal the aggregation's sample total, and the ranking must agree with a brute-force sort.
 */
@ThreadLeakScope(ThreadLeakScope.Scope.NONE)
public class TestEngineAgreement extends RandomizedTest {
    @Test
    public void testMatchCountsAgree() {
        for (int trial = 0; trial < 20; trial++) {
            var records = TestUtil.createRandomVideos(getRandom(), randomIntBetween(0, 500));
            var selection = randomSelection();

            var ranking = HeapRankingEngine.rank(records, selection);
            var aggregation = HashAggregationEngine.aggregate(records, selection);

            if (distinct(selection)) {
                assertEquals(ranking.getMatchCount(), aggregation.totalSamples());
            }
            assertTrue(ranking.size() <= HeapRankingEngine.DEFAULT_TOP_K);
            assertEquals(Math.min(HeapRankingEngine.DEFAULT_TOP_K, ranking.getMatchCount()), ranking.size());

            // every ranked record matches a query the aggregation has data for
            Map<String, VideoRecord> byTitle = new HashMap<>();
            for (var record : records) {
                byTitle.put(record.getTitle(), record);
            }
            List<String> matched = aggregation.matchedQueries();
            for (var entry : ranking.getEntries()) {
                var record = byTitle.get(entry.title);
                assertTrue(entry.title, record != null && matchesAny(record, matched));
            }
            // and every query with data matches at least one record
            for (String query : matched) {
                assertTrue(query, records.stream().anyMatch(r -> matchesAny(r, List.of(query))));
            }
            assertEquals(ranking.getMatchCount() > 0, !matched.isEmpty());
        }
    }

    @Test
    public void testRankingMatchesBruteForce() {
        for (int trial = 0; trial < 20; trial++) {
            var records = TestUtil.createRandomVideos(getRandom(), randomIntBetween(1, 300));
            var selection = randomSelection();
            int topK = randomIntBetween(0, 15);

            List<VideoRecord> expanded = new ArrayList<>();
            for (var record : records) {
                for (var tag : record.getTags()) {
                    for (var query : selection) {
                        if (tag.contains(query)) {
                            expanded.add(record);
                        }
                    }
                }
            }
            expanded.sort(HeapRankingEngine.BEST_FIRST);

            var ranking = HeapRankingEngine.rank(records, selection, topK);
            assertEquals(expanded.size(), ranking.getMatchCount());
            for (int i = 0; i < ranking.size(); i++) {
                var entry = ranking.getEntries().get(i);
                assertEquals(expanded.get(i).getTitle(), entry.title);
                assertEquals(expanded.get(i).getRatio(), entry.ratio, 0.0);
                if (i > 0) {
                    assertTrue(ranking.getEntries().get(i - 1).ratio >= entry.ratio);
                }
            }
        }
    }

    private TagSelection randomSelection() {
        int n = randomIntBetween(0, 4);
        List<String> queries = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            String word = randomFrom(TestUtil.VOCABULARY);
            queries.add(word.substring(0, randomIntBetween(1, word.length())));
        }
        return TagSelection.of(queries);
    }

    private static boolean matchesAny(VideoRecord record, List<String> queries) {
        for (var tag : record.getTags()) {
            for (var query : queries) {
                if (TagMatcher.matches(tag, query)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean distinct(TagSelection selection) {
        return selection.queries().stream().distinct().count() == selection.size();
    }
}
