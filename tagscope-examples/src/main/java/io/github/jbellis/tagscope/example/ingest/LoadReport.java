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

import java.util.List;

/**
 * What a reader produced from one source: the valid records, how many rows were skipped, and
 * whether reading stopped early on a syntax error.
 */
public final class LoadReport {
    private final String source;
    private final List<VideoRecord> records;
    private final int skippedRows;
    private final boolean truncated;

    public LoadReport(String source, List<VideoRecord> records, int skippedRows, boolean truncated) {
        this.source = source;
        this.records = List.copyOf(records);
        this.skippedRows = skippedRows;
        this.truncated = truncated;
    }

    public String getSource() {
        return source;
    }

    public List<VideoRecord> getRecords() {
        return records;
    }

    public int getSkippedRows() {
        return skippedRows;
    }

    /**
     * @return true if a CSV syntax error stopped reading before the end of the source
     */
    public boolean isTruncated() {
        return truncated;
    }

    @Override
    public String toString() {
        return String.format("LoadReport(%s, records=%d, skipped=%d%s)",
                source, records.size(), skippedRows, truncated ? ", truncated" : "");
    }
}
