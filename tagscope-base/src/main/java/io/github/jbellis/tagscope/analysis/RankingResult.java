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

import java.util.List;
import java.util.Objects;

/**
 * Container class for the result of a ranking pass, along with the number of matches that
 * were pushed through the heap to produce it.
 */
public final class RankingResult {
    private final List<RankedEntry> entries;
    private final int matchCount;

    /**
     * @param entries the top entries, best-first
     * @param matchCount the total number of (tag, query) matches inserted into the heap
     */
    public RankingResult(List<RankedEntry> entries, int matchCount) {
        this.entries = List.copyOf(entries);
        this.matchCount = matchCount;
    }

    /**
     * @return the top entries, sorted by descending ratio
     */
    public List<RankedEntry> getEntries() {
        return entries;
    }

    /**
     * @return the total number of (tag, query) matches found, including those that did not
     * make it into the top entries
     */
    public int getMatchCount() {
        return matchCount;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * One row of a ranking: its 1-based position, the record title and its ratio.
     */
    public static final class RankedEntry {
        /** Position in the ranking, starting at 1 */
        public final int rank;
        /** Title of the matching record */
        public final String title;
        /** Like/view ratio of the matching record */
        public final double ratio;

        public RankedEntry(int rank, String title, double ratio) {
            this.rank = rank;
            this.title = title;
            this.ratio = ratio;
        }

        @Override
        public String toString() {
            return String.format("RankedEntry(%d, %s, %s)", rank, title, ratio);
        }

        @Override
        public boolean equals(Object o) {
            if (o == null || getClass() != o.getClass()) return false;
            RankedEntry that = (RankedEntry) o;
            return rank == that.rank && Double.compare(ratio, that.ratio) == 0 && title.equals(that.title);
        }

        @Override
        public int hashCode() {
            return Objects.hash(rank, title, ratio);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        RankingResult that = (RankingResult) o;
        return matchCount == that.matchCount && entries.equals(that.entries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entries, matchCount);
    }

    @Override
    public String toString() {
        return "RankingResult[" + entries.size() + " of " + matchCount + "]";
    }
}
