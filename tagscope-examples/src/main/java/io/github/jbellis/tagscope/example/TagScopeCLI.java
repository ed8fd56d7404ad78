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
import io.github.jbellis.tagscope.example.ingest.DatasetArchive;
import io.github.jbellis.tagscope.example.ingest.DatasetLoader;
import io.github.jbellis.tagscope.example.util.BenchmarkCsvLog;
import io.github.jbellis.tagscope.example.util.LoggerConfig;
import io.github.jbellis.tagscope.example.yaml.AnalyzerSettings;
import io.github.jbellis.tagscope.harness.BenchmarkHarness;
import io.github.jbellis.tagscope.harness.BenchmarkOutcome;
import io.github.jbellis.tagscope.harness.BenchmarkReport;
import io.github.jbellis.tagscope.model.TagSelection;
import io.github.jbellis.tagscope.model.VideoRecord;
import io.github.jbellis.tagscope.report.AnalysisReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line interface for TagScope using PicoCLI.
 *
 * <h2>Available Subcommands</h2>
 * <ul>
 *   <li>{@code analyze} - Print the heap ranking and/or the hash table averages for a tag selection</li>
 *   <li>{@code bench} - Time both strategies over the same selection and print the comparison</li>
 *   <li>{@code interactive} - The menu-driven console session</li>
 * </ul>
 *
 * <h2>Usage Examples</h2>
 * <pre>
 * # Rank and average over every CSV in ./data
 * java -jar tagscope.jar analyze --tags music,gaming
 *
 * # Extract data/archive.zip on first use, then compare the strategies over 5 runs
 * java -jar tagscope.jar bench --archive data/archive.zip --tags music --runs 5 --csv results_
 *
 * # Interactive menu over a single file
 * java -jar tagscope.jar interactive --file data/USvideos.csv
 * </pre>
 */
@CommandLine.Command(
        name = "tagscope",
        mixinStandardHelpOptions = true,
        version = "1.0",
        description = "Tag correlation analysis over trending-video datasets",
        subcommands = {
                TagScopeCLI.AnalyzeCommand.class,
                TagScopeCLI.BenchCommand.class,
                TagScopeCLI.InteractiveCommand.class
        }
)
public class TagScopeCLI implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(TagScopeCLI.class);

    static final int EXIT_OK = 0;
    static final int EXIT_IO = 1;
    static final int EXIT_CONFIG = 2;

    static final String INVALID_TOP_K = "invalid configuration: top-k must be >= 0";

    private final PrintStream out;
    private final InputStream in;

    public TagScopeCLI() {
        this(System.out, System.in);
    }

    /**
     * @param out where reports are printed
     * @param in operator input for the interactive session
     */
    public TagScopeCLI(PrintStream out, InputStream in) {
        this.out = out;
        this.in = in;
    }

    /**
     * Called when no subcommand is specified. Displays help information.
     *
     * @return exit code 0
     */
    @Override
    public Integer call() {
        CommandLine.usage(this, out);
        return EXIT_OK;
    }

    /**
     * Builds the command line with the error handling shared by every subcommand: I/O failures
     * are logged and mapped to exit code {@value #EXIT_IO}.
     *
     * @param cli the root command
     * @return a configured command line
     */
    public static CommandLine newCommandLine(TagScopeCLI cli) {
        var commandLine = new CommandLine(cli);
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            if (ex instanceof IOException) {
                logger.error("Failed to load dataset: {}", ex.getMessage());
                cmd.getErr().println("Error: " + ex.getMessage());
                return EXIT_IO;
            }
            throw ex;
        });
        return commandLine;
    }

    /**
     * Options shared by every subcommand: where the data comes from and the settings file.
     */
    static class DataOptions {
        @CommandLine.Option(names = {"-c", "--config"}, description = "YAML settings file")
        File config;

        @CommandLine.Option(names = {"-d", "--data"}, description = "Directory of CSV datasets (default: data)")
        Path dataDirectory;

        @CommandLine.Option(names = {"-f", "--file"}, description = "Load a single CSV file instead of a directory")
        Path file;

        @CommandLine.Option(names = {"-a", "--archive"}, description = "Zip archive extracted into <data>/unzipped on first use")
        Path archive;

        @CommandLine.Option(names = "--min-records", description = "Warn when fewer records are loaded")
        Integer minimumRecords;

        @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log every benchmark run and skipped row")
        boolean verbose;

        AnalyzerSettings settings() throws IOException {
            LoggerConfig.configure(verbose);
            AnalyzerSettings settings = config == null ? new AnalyzerSettings() : AnalyzerSettings.load(config);
            if (dataDirectory != null) {
                settings.dataDirectory = dataDirectory.toString();
            }
            if (archive != null) {
                settings.archive = archive.toString();
            }
            if (minimumRecords != null) {
                settings.minimumRecords = minimumRecords;
            }
            logger.debug("Effective settings: {}", settings);
            return settings;
        }

        List<VideoRecord> load(AnalyzerSettings settings) throws IOException {
            var loader = new DatasetLoader(settings.minimumRecords);
            if (file != null) {
                return loader.loadFile(file);
            }
            Path directory = Path.of(settings.dataDirectory);
            if (settings.archive != null) {
                Path unzipped = directory.resolve("unzipped");
                DatasetArchive.ensureExtracted(Path.of(settings.archive), unzipped);
                return loader.loadAll(unzipped);
            }
            return loader.loadAll(directory);
        }
    }

    enum Structure {
        HEAP, HASH, BOTH
    }

    @CommandLine.Command(
            name = "analyze",
            description = "Rank matching videos with a heap and/or average ratios per tag with a hash table"
    )
    static class AnalyzeCommand implements Callable<Integer> {
        @CommandLine.ParentCommand
        TagScopeCLI parent;

        @CommandLine.Mixin
        DataOptions data = new DataOptions();

        @CommandLine.Option(names = {"-t", "--tags"}, description = "Comma-separated tag substrings, e.g. music,gaming")
        String tags;

        @CommandLine.Option(
                names = {"-s", "--structure"},
                description = "Which strategy to report: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
                defaultValue = "BOTH"
        )
        Structure structure;

        @CommandLine.Option(names = {"-k", "--top-k"}, description = "Number of ranked videos to print")
        Integer topK;

        @Override
        public Integer call() throws IOException {
            AnalyzerSettings settings = data.settings();
            TagSelection selection = tags != null ? TagSelection.parse(tags) : settings.selection();
            if (selection.isEmpty()) {
                parent.out.println("Select tags first.");
                return EXIT_CONFIG;
            }
            int k = topK != null ? topK : settings.topK;
            if (k < 0) {
                parent.out.println(INVALID_TOP_K);
                return EXIT_CONFIG;
            }

            List<VideoRecord> records = data.load(settings);
            var reporter = new AnalysisReporter(parent.out);
            if (structure != Structure.HASH) {
                reporter.reportRanking(HeapRankingEngine.rank(records, selection, k));
            }
            if (structure != Structure.HEAP) {
                reporter.reportAggregation(HashAggregationEngine.aggregate(records, selection));
            }
            return EXIT_OK;
        }
    }

    @CommandLine.Command(
            name = "bench",
            description = "Time the heap and hash table strategies head-to-head over the same selection"
    )
    static class BenchCommand implements Callable<Integer> {
        @CommandLine.ParentCommand
        TagScopeCLI parent;

        @CommandLine.Mixin
        DataOptions data = new DataOptions();

        @CommandLine.Option(names = {"-t", "--tags"}, description = "Comma-separated tag substrings, e.g. music,gaming")
        String tags;

        @CommandLine.Option(names = {"-r", "--runs"}, description = "Number of timed runs (default: 3)")
        Integer runs;

        @CommandLine.Option(names = "--csv", description = "Also append each run to <prefix>yyyyMMdd_HHmmss.csv")
        String csvPrefix;

        @CommandLine.Option(names = "--csv-dir", description = "Directory for the CSV log (default: ${DEFAULT-VALUE})", defaultValue = ".")
        Path csvDirectory;

        @Override
        public Integer call() throws IOException {
            AnalyzerSettings settings = data.settings();
            TagSelection selection = tags != null ? TagSelection.parse(tags) : settings.selection();
            if (selection.isEmpty()) {
                parent.out.println("Select tags first.");
                return EXIT_CONFIG;
            }
            int runCount = runs != null ? runs : settings.runs;

            List<VideoRecord> records = data.load(settings);
            BenchmarkOutcome outcome = new BenchmarkHarness().compare(records, selection, runCount);
            if (!outcome.isSuccess()) {
                parent.out.println(outcome.getFailure().orElseThrow());
                return EXIT_CONFIG;
            }

            BenchmarkReport report = outcome.getReport().orElseThrow();
            var printer = new BenchmarkTablePrinter(parent.out);
            Map<String, Object> config = new LinkedHashMap<>();
            config.put("tags", selection);
            config.put("records", records.size());
            config.put("runs", runCount);
            printer.printConfig(config);
            printer.print(report);

            if (csvPrefix != null) {
                try (var log = new BenchmarkCsvLog(csvDirectory, csvPrefix)) {
                    log.append(report);
                    parent.out.println("Wrote " + log.getOutFile());
                }
            }
            return EXIT_OK;
        }
    }

    @CommandLine.Command(
            name = "interactive",
            description = "Menu-driven console session"
    )
    static class InteractiveCommand implements Callable<Integer> {
        @CommandLine.ParentCommand
        TagScopeCLI parent;

        @CommandLine.Mixin
        DataOptions data = new DataOptions();

        @Override
        public Integer call() throws IOException {
            AnalyzerSettings settings = data.settings();
            if (settings.topK < 0) {
                parent.out.println(INVALID_TOP_K);
                return EXIT_CONFIG;
            }
            parent.out.println("--------------------------------------------------");
            parent.out.println("   YouTube Tag Correlation Analyzer");
            parent.out.println("--------------------------------------------------");

            List<VideoRecord> records = data.load(settings);
            var reader = new BufferedReader(new InputStreamReader(parent.in, StandardCharsets.UTF_8));
            new InteractiveSession(reader, parent.out, records, settings.selection(), settings.topK, settings.runs).run();
            return EXIT_OK;
        }
    }

    /**
     * Main entry point for command-line execution.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = newCommandLine(new TagScopeCLI()).execute(args);
        System.exit(exitCode);
    }
}
