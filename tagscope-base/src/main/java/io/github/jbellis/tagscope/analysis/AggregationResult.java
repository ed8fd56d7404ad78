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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Per-query average like/view ratio. Entries follow the order in which queries were selected;
 * a query selected more than once appears once, at its first position.
 */
public final class AggregationResult {
    private final Map<String, TagAverage> averages;

    /**
     * @param averages the per-query averages, in selection order
     */
    public AggregationResult(List<TagAverage> averages) {
        var byQuery = new LinkedHashMap<String, TagAverage>();
        for (TagAverage a : averages) {
            byQuery.put(a.query, a);
        }
        this.averages = Collections.unmodifiableMap(byQuery);
    }

    /**
     * @return the averages, in selection order
     */
    public List<TagAverage> getAverages() {
        return List.copyOf(averages.values());
    }

    /**
     * @param query a selected query string
     * @return the mean ratio for that query; empty when the query matched nothing or was not selected
     */
    public OptionalDouble average(String query) {
        TagAverage a = averages.get(query);
        return a == null ? OptionalDouble.empty() : a.average;
    }

    /**
     * @return the total number of ratio samples folded into all averages
     */
    public int totalSamples() {
        int total = 0;
        for (TagAverage a : averages.values()) {
            total += a.sampleCount;
        }
        return total;
    }

    public int size() {
        return averages.size();
    }

    /**
     * @return the queries that matched at least once
     */
    public List<String> matchedQueries() {
        List<String> matched = new ArrayList<>();
        for (TagAverage a : averages.values()) {
            if (a.hasData()) {
                matched.add(a.query);
            }
        }
        return matched;
    }

    /**
     * The mean ratio of one query string across all of its (tag, query) matches. An empty
     * average means "no data": the query matched no tag. An average of 0 means the query did
     * match, but every matched ratio was zero.
     */
    public static final class TagAverage {
        /** The selected query string */
        public final String query;
        /** The mean ratio, or empty when nothing matched */
        public final OptionalDouble average;
        /** Number of ratio samples behind the mean */
        public final int sampleCount;

        public TagAverage(String query, OptionalDouble average, int sampleCount) {
            this.query = query;
            this.average = average;
            this.sampleCount = sampleCount;
        }

        public boolean hasData() {
            return average.isPresent();
        }

        @Override
        public String toString() {
            return String.format("TagAverage(%s, %s, n=%d)", query,
                    average.isPresent() ? Double.toString(average.getAsDouble()) : "no data", sampleCount);
        }

        @Override
        public boolean equals(Object o) {
            if (o == null || getClass() != o.getClass()) return false;
            TagAverage that = (TagAverage) o;
            return sampleCount == that.sampleCount && query.equals(that.query) && average.equals(that.average);
        }

        @Override
        public int hashCode() {
            return Objects.hash(query, average, sampleCount);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        return averages.equals(((AggregationResult) o).averages);
    }

    @Override
    public int hashCode() {
        return averages.hashCode();
    }

    @Override
    public String toString() {
        return "AggregationResult" + averages.values();
    }
}
