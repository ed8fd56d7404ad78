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

package io.github.jbellis.tagscope.example;

import io.github.jbellis.tagscope.analysis.HashAggregationEngine;
import io.github.jbellis.tagscope.analysis.HeapRankingEngine;
import io.github.jbellis.tagscope.example.benchmarks.BenchmarkTablePrinter;
import io.github.jbellis.tagscope.harness.BenchmarkHarness;
import io.github.jbellis.tagscope.harness.BenchmarkOutcome;
import io.github.jbellis.tagscope.model.TagSelection;
import io.github.jbellis.tagscope.model.VideoRecord;
import io.github.jbellis.tagscope.report.AnalysisReporter;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;

/**
 * The menu-driven console session: select tags, then run one of the strategies (or both,
 * head-to-head) over the loaded records. The current selection belongs to the session and is
 * passed explicitly to every analysis call.
 */
public class InteractiveSession {
    private final BufferedReader in;
    private final PrintStream out;
    private final List<VideoRecord> records;
    private final int topK;
    private final int runs;
    private final AnalysisReporter reporter;

    private TagSelection selection;

    /**
     * @param in operator input, one answer per line
     * @param out where prompts and reports are printed
     * @param records the loaded records
     * @param initialSelection the selection to start with, possibly empty
     * @param topK number of ranking entries to print
     * @param runs number of benchmark runs for "compare both"
     */
    public InteractiveSession(BufferedReader in, PrintStream out, List<VideoRecord> records,
                              TagSelection initialSelection, int topK, int runs) {
        this.in = in;
        this.out = out;
        this.records = records;
        this.selection = initialSelection;
        this.topK = topK;
        this.runs = runs;
        this.reporter = new AnalysisReporter(out);
    }

    public TagSelection getSelection() {
        return selection;
    }

    /**
     * Runs the menu loop until the operator exits or input ends.
     *
     * @throws IOException if reading input fails
     */
    public void run() throws IOException {
        boolean running = true;
        while (running) {
            out.println();
            out.println("1. Select tag(s)");
            out.println("2. Choose data structure (Heap / Hash Table)");
            out.println("3. Exit");
            out.print("> ");
            out.flush();

            String line = in.readLine();
            if (line == null) {
                break;
            }
            switch (parseChoice(line)) {
                case 1:
                    selectTags();
                    break;
                case 2:
                    if (!chooseStructure()) {
                        running = false;
                    }
                    break;
                case 3:
                    running = false;
                    break;
                default:
                    out.println("Invalid input.");
            }
        }
        out.println("Exiting... Goodbye!");
    }

    private void selectTags() throws IOException {
        out.print("Enter tags separated by commas (e.g., music,gaming): ");
        out.flush();
        String line = in.readLine();
        selection = TagSelection.parse(line);
        out.println("Tags selected.");
    }

    /**
     * @return false if input ended while waiting for a choice
     */
    private boolean chooseStructure() throws IOException {
        out.println("Choose data structure:");
        out.println("1. Heap");
        out.println("2. Hash Table");
        out.println("3. Compare both");
        out.print("> ");
        out.flush();
        String line = in.readLine();
        if (line == null) {
            return false;
        }
        int choice = parseChoice(line);

        if (selection.isEmpty()) {
            out.println("Select tags first.");
            return true;
        }

        switch (choice) {
            case 1:
                reporter.reportRanking(HeapRankingEngine.rank(records, selection, topK));
                break;
            case 2:
                reporter.reportAggregation(HashAggregationEngine.aggregate(records, selection));
                break;
            case 3:
                compareBoth();
                break;
            default:
                out.println("Invalid choice.");
        }
        return true;
    }

    private void compareBoth() {
        BenchmarkOutcome outcome = new BenchmarkHarness().compare(records, selection, runs);
        if (outcome.isSuccess()) {
            new BenchmarkTablePrinter(out).print(outcome.getReport().orElseThrow());
        } else {
            out.println(outcome.getFailure().orElseThrow());
        }
    }

    static int parseChoice(String line) {
        try {
            return Integer.parseInt(line.trim());
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
