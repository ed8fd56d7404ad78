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

package io.github.jbellis.tagscope.example.yaml;

import io.github.jbellis.tagscope.analysis.HeapRankingEngine;
import io.github.jbellis.tagscope.example.ingest.DatasetLoader;
import io.github.jbellis.tagscope.harness.BenchmarkHarness;
import io.github.jbellis.tagscope.model.TagSelection;
import org.yaml.snakeyaml.Yaml;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Analyzer settings, loaded from a YAML file. Every field has a default, so an empty file
 * (or no file at all) is a valid configuration.
 *
 * <pre>
 * dataDirectory: data
 * archive: data/archive.zip
 * tags: [music, gaming]
 * topK: 10
 * runs: 3
 * minimumRecords: 100000
 * </pre>
 */
public class AnalyzerSettings {
    /** Directory holding the CSV datasets. */
    public String dataDirectory = "data";
    /** Optional zip archive extracted into {@code dataDirectory/unzipped} before loading. */
    public String archive;
    /** Initial tag selection. */
    public List<String> tags = new ArrayList<>();
    /** Number of ranking entries to print. */
    public int topK = HeapRankingEngine.DEFAULT_TOP_K;
    /** Number of benchmark runs. */
    public int runs = BenchmarkHarness.DEFAULT_RUNS;
    /** Record count below which the loader warns. */
    public int minimumRecords = DatasetLoader.DEFAULT_MINIMUM_RECORDS;

    public AnalyzerSettings() {
    }

    /**
     * @param configFile the YAML file to load
     * @return the loaded settings, with defaults for missing keys
     * @throws FileNotFoundException if the file does not exist
     * @throws IOException if the file cannot be read
     */
    public static AnalyzerSettings load(File configFile) throws IOException {
        if (!configFile.exists()) {
            throw new FileNotFoundException(configFile.getAbsolutePath());
        }
        try (InputStream inputStream = new FileInputStream(configFile)) {
            return load(inputStream);
        }
    }

    public static AnalyzerSettings load(InputStream inputStream) {
        Yaml yaml = new Yaml();
        AnalyzerSettings settings = yaml.loadAs(inputStream, AnalyzerSettings.class);
        return settings == null ? new AnalyzerSettings() : settings;
    }

    public TagSelection selection() {
        return tags == null ? TagSelection.empty() : TagSelection.of(tags);
    }

    @Override
    public String toString() {
        return "AnalyzerSettings{dataDirectory=" + dataDirectory + ", archive=" + archive + ", tags=" + tags
                + ", topK=" + topK + ", runs=" + runs + ", minimumRecords=" + minimumRecords + "}";
    }
}
