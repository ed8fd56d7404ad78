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

package io.github.jbellis.tagscope.report;

import io.github.jbellis.tagscope.analysis.AggregationResult;
import io.github.jbellis.tagscope.analysis.RankingResult;
import io.github.jbellis.tagscope.util.RatioMath;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders analysis results for display. This is the report step that follows an engine's
 * compute step; benchmark runs never call it.
 */
public class AnalysisReporter {
    static final String RANKING_HEADER = "Top 10 videos by like/view ratio for selected tags:";
    static final String AGGREGATION_HEADER = "Average like/view ratio for each selected tag:";

    private final PrintStream out;

    public AnalysisReporter(PrintStream out) {
        this.out = out;
    }

    public void reportRanking(RankingResult result) {
        out.println();
        rankingLines(result).forEach(out::println);
    }

    public void reportAggregation(AggregationResult result) {
        out.println();
        aggregationLines(result).forEach(out::println);
    }

    /**
     * @param result a ranking
     * @return the header followed by one "N. title (ratio: R)" line per entry
     */
    public static List<String> rankingLines(RankingResult result) {
        List<String> lines = new ArrayList<>(result.size() + 1);
        lines.add(RANKING_HEADER);
        for (RankingResult.RankedEntry e : result.getEntries()) {
            lines.add(e.rank + ". " + e.title + " (ratio: " + RatioMath.format(e.ratio) + ")");
        }
        return lines;
    }

    /**
     * @param result per-query averages
     * @return the header followed by one line per query, with a "not found" line for queries
     * that matched nothing
     */
    public static List<String> aggregationLines(AggregationResult result) {
        List<String> lines = new ArrayList<>(result.size() + 1);
        lines.add(AGGREGATION_HEADER);
        for (AggregationResult.TagAverage a : result.getAverages()) {
            if (a.hasData()) {
                lines.add(" - " + a.query + ": " + RatioMath.format(a.average.getAsDouble()));
            } else {
                lines.add("Tag '" + a.query + "' not found.");
            }
        }
        return lines;
    }
}
