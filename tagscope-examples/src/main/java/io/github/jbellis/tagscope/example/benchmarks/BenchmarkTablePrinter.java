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

package io.github.jbellis.tagscope.example.benchmarks;

import io.github.jbellis.tagscope.harness.BenchmarkReport;
import io.github.jbellis.tagscope.harness.RunTiming;

import java.io.PrintStream;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;

/**
 * Prints a heap-versus-hash comparison as a fixed-width table.
 */
public class BenchmarkTablePrinter {
    private static final String ROW_FORMAT = "%-10s %-16s %-16s";

    private final PrintStream out;

    public BenchmarkTablePrinter(PrintStream out) {
        this.out = out;
    }

    /**
     * Prints the parameters of the comparison before the table.
     *
     * @param params a map from parameter name (e.g. "runs") to its value
     */
    public void printConfig(Map<String, ?> params) {
        out.println();
        out.println("Configuration:");
        params.forEach((name, value) ->
                out.printf(Locale.US, "  %-22s: %s%n", name, value)
        );
    }

    /**
     * Prints the header, one row per run, the averages row and the verdict.
     *
     * @param report a completed comparison
     */
    public void print(BenchmarkReport report) {
        out.println();
        String headerLine = String.format(Locale.US, ROW_FORMAT, "Run", "Heap (ms)", "Hash Table (ms)");
        out.println(headerLine);
        out.println(String.join("", Collections.nCopies(headerLine.length(), "-")));

        for (RunTiming t : report.getRuns()) {
            out.println(String.format(Locale.US, ROW_FORMAT,
                    t.getRun(), t.getHeapMillis(), t.getHashMillis()));
        }
        out.println(String.format(Locale.US, ROW_FORMAT, "Average",
                String.format(Locale.US, "%.3f", report.getAvgHeapMillis()),
                String.format(Locale.US, "%.3f", report.getAvgHashMillis())));
        out.println();
        out.println("Verdict: " + report.getVerdict().getLabel());
    }
}
