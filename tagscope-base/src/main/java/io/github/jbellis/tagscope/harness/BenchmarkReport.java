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

import io.github.jbellis.tagscope.model.TagSelection;

import java.util.List;

/**
 * Per-run timings of a head-to-head comparison, their column averages and the verdict.
 * Averages are computed over the whole-millisecond values reported per run.
 */
public final class BenchmarkReport {
    private final List<RunTiming> runs;
    private final double avgHeapMillis;
    private final double avgHashMillis;
    private final Verdict verdict;
    private final int recordCount;
    private final TagSelection selection;

    public BenchmarkReport(List<RunTiming> runs, int recordCount, TagSelection selection) {
        if (runs.isEmpty()) {
            throw new IllegalArgumentException("A report needs at least one run");
        }
        this.runs = List.copyOf(runs);
        this.recordCount = recordCount;
        this.selection = selection;

        double heapSum = 0;
        double hashSum = 0;
        for (RunTiming t : runs) {
            heapSum += t.getHeapMillis();
            hashSum += t.getHashMillis();
        }
        this.avgHeapMillis = heapSum / runs.size();
        this.avgHashMillis = hashSum / runs.size();
        this.verdict = Verdict.of(avgHeapMillis, avgHashMillis);
    }

    public List<RunTiming> getRuns() {
        return runs;
    }

    public double getAvgHeapMillis() {
        return avgHeapMillis;
    }

    public double getAvgHashMillis() {
        return avgHashMillis;
    }

    public Verdict getVerdict() {
        return verdict;
    }

    public int getRecordCount() {
        return recordCount;
    }

    public TagSelection getSelection() {
        return selection;
    }

    @Override
    public String toString() {
        return "BenchmarkReport {\n" +
                "  runs="      + runs          + ",\n" +
                "  avgHeapMs=" + avgHeapMillis + ",\n" +
                "  avgHashMs=" + avgHashMillis + ",\n" +
                "  verdict="   + verdict       + "\n" +
                "}";
    }
}
