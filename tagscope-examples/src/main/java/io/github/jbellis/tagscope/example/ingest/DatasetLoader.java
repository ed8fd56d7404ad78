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

package io.github.jbellis.tagscope.example.ingest;

import io.github.jbellis.tagscope.model.VideoRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads and combines the CSV datasets found in a directory.
 */
public class DatasetLoader {
    private static final Logger logger = LoggerFactory.getLogger(DatasetLoader.class);

    /** Below this many records the combined dataset is considered small. */
    public static final int DEFAULT_MINIMUM_RECORDS = 100_000;

    private final int minimumRecords;

    public DatasetLoader() {
        this(DEFAULT_MINIMUM_RECORDS);
    }

    /**
     * @param minimumRecords record count below which a warning is logged
     */
    public DatasetLoader(int minimumRecords) {
        this.minimumRecords = minimumRecords;
    }

    /**
     * Loads every {@code .csv} file directly inside {@code directory}, in file name order, and
     * concatenates their records.
     *
     * @param directory the dataset directory
     * @return all records, in file then row order
     * @throws FileNotFoundException if the directory does not exist
     * @throws IOException if a file cannot be read
     */
    public List<VideoRecord> loadAll(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new FileNotFoundException("Dataset directory not found: " + directory.toAbsolutePath());
        }
        List<Path> files;
        try (Stream<Path> entries = Files.list(directory)) {
            files = entries.filter(p -> Files.isRegularFile(p) && p.getFileName().toString().endsWith(".csv"))
                    .sorted()
                    .collect(Collectors.toList());
        }

        List<VideoRecord> all = new ArrayList<>();
        for (Path file : files) {
            logger.info("Loading: {} ...", file.getFileName());
            LoadReport report = VideoCsvReader.read(file);
            logger.info("  -> Loaded {} videos ({} rows skipped)", report.getRecords().size(), report.getSkippedRows());
            all.addAll(report.getRecords());
        }
        logger.info("Total videos loaded from all datasets: {}", all.size());
        checkSize(all.size());
        return all;
    }

    /**
     * @param file a single CSV file
     * @return the records in that file
     * @throws IOException if the file cannot be read
     */
    public List<VideoRecord> loadFile(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new FileNotFoundException("Dataset file not found: " + file.toAbsolutePath());
        }
        LoadReport report = VideoCsvReader.read(file);
        logger.info("Loaded {} videos from {} ({} rows skipped)",
                report.getRecords().size(), report.getSource(), report.getSkippedRows());
        checkSize(report.getRecords().size());
        return report.getRecords();
    }

    private void checkSize(int loaded) {
        if (loaded < minimumRecords) {
            logger.warn("Combined dataset has only {} videos. Try adding more CSVs to the data folder.", loaded);
        }
    }
}
