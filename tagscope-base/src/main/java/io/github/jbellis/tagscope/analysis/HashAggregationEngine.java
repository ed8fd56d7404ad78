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
import io.github.jbellis.tagscope.util.RatioMath;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Averages like/view ratios per selected query using a hash table of growable ratio lists.
 * <p>
 * Ratios are grouped by the query string that matched, not by the tag. A record with two tags
 * matching the same query contributes two samples to that query, and a query listed twice in
 * the selection collects every sample twice (the mean is unchanged).
 */
public class HashAggregationEngine implements AnalysisEngine<AggregationResult> {

    @Override
    public String getName() {
        return "hash";
    }

    @Override
    public AggregationResult analyze(List<VideoRecord> records, TagSelection selection) {
        return aggregate(records, selection);
    }

    /**
     * @param records the records to scan
     * @param selection the query strings
     * @return one average per distinct query, in selection order
     */
    public static AggregationResult aggregate(List<VideoRecord> records, TagSelection selection) {
        Map<String, List<Double>> ratiosByQuery = new HashMap<>();
        for (VideoRecord record : records) {
            for (String tag : record.getTags()) {
                for (String query : selection) {
                    if (TagMatcher.matches(tag, query)) {
                        ratiosByQuery.computeIfAbsent(query, k -> new ArrayList<>()).add(record.getRatio());
                    }
                }
            }
        }

        List<AggregationResult.TagAverage> averages = new ArrayList<>(selection.size());
        for (String query : selection) {
            List<Double> ratios = ratiosByQuery.getOrDefault(query, List.of());
            averages.add(new AggregationResult.TagAverage(query, RatioMath.mean(ratios), ratios.size()));
        }
        return new AggregationResult(averages);
    }
}
