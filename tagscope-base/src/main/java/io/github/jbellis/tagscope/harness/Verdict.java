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

/**
 * Which strategy had the lower average time in a comparison.
 */
public enum Verdict {
    RANKING_FASTER("ranking-faster"),
    AGGREGATION_FASTER("aggregation-faster"),
    TIE("tie");

    private final String label;

    Verdict(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * @param avgHeapMillis average ranking (heap) time
     * @param avgHashMillis average aggregation (hash table) time
     * @return the verdict; exactly equal averages are a tie
     */
    public static Verdict of(double avgHeapMillis, double avgHashMillis) {
        if (avgHeapMillis < avgHashMillis) {
            return RANKING_FASTER;
        }
        if (avgHeapMillis > avgHashMillis) {
            return AGGREGATION_FASTER;
        }
        return TIE;
    }

    @Override
    public String toString() {
        return label;
    }
}
