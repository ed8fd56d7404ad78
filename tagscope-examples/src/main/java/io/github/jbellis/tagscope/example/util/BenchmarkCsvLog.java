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

package io.github.jbellis.tagscope.example.util;

import io.github.jbellis.tagscope.harness.BenchmarkReport;
import io.github.jbellis.tagscope.harness.RunTiming;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Appends benchmark runs to a timestamped CSV file using Apache Commons CSV. One row is
 * written per run; the header is written only when the file is new.
 */
public class BenchmarkCsvLog implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(BenchmarkCsvLog.class);

    static final String DEFAULT_PREFIX = "tagscope_bench_";
    static final List<String> COLUMNS = List.of("run", "heap_ms", "hash_ms", "heap_ns", "hash_ns", "tags", "records");
    private static final DateTimeFormatter TS_FMT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path outFile;
    private CSVPrinter printer;

    /**
     * @param directory where the file is created
     * @param filePrefix prefix for the file name (null/blank selects the default)
     */
    public BenchmarkCsvLog(Path directory, String filePrefix) {
        String prefix = (filePrefix == null || filePrefix.isBlank()) ? DEFAULT_PREFIX : filePrefix;
        this.outFile = directory.resolve(prefix + LocalDateTime.now().format(TS_FMT) + ".csv");
    }

    public Path getOutFile() {
        return outFile;
    }

    /**
     * Writes one row per run of the report.
     *
     * @param report a completed comparison
     * @throws IOException if the file cannot be written
     */
    public void append(BenchmarkReport report) throws IOException {
        if (printer == null) {
            boolean exists = Files.exists(outFile);
            Writer writer = Files.newBufferedWriter(outFile, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            printer = openPrinter(writer, exists);
            logger.info("Writing benchmark log: {}", outFile);
        }
        String tags = report.getSelection().toString();
        for (RunTiming t : report.getRuns()) {
            printer.printRecord(t.getRun(), t.getHeapMillis(), t.getHashMillis(),
                    t.getHeapNanos(), t.getHashNanos(), tags, report.getRecordCount());
        }
        printer.flush();
    }

    /**
     * Wraps the writer in a printer, writing the header unless the file already had one.
     * The writer is closed if the header cannot be written.
     */
    static CSVPrinter openPrinter(Writer writer, boolean skipHeader) throws IOException {
        CSVFormat fmt = CSVFormat.DEFAULT.builder()
                .setHeader(COLUMNS.toArray(new String[0]))
                .setSkipHeaderRecord(skipHeader)
                .build();
        try {
            return new CSVPrinter(writer, fmt);
        } catch (IOException e) {
            try {
                writer.close();
            } catch (IOException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
    }

    @Override
    public void close() throws IOException {
        if (printer != null) {
            printer.close();
        }
    }
}
