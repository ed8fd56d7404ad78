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

import io.github.jbellis.tagscope.exceptions.MalformedRecordException;
import io.github.jbellis.tagscope.model.VideoRecord;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Reads trending-video CSV exports into {@link VideoRecord}s using Apache Commons CSV.
 * <p>
 * The first row is a header and is skipped. Data rows must have at least
 * {@value #MIN_FIELDS} fields; the title, tags, views and likes are taken from fixed
 * positions. The tags field is split on {@code |}, surrounding double quotes are removed from
 * each tag and empty tags are dropped. Rows that are too short or carry an unparsable,
 * negative or infinite count are skipped and counted.
 */
public class VideoCsvReader {
    private static final Logger logger = LoggerFactory.getLogger(VideoCsvReader.class);

    static final int MIN_FIELDS = 16;
    static final int TITLE_FIELD = 2;
    static final int TAGS_FIELD = 6;
    static final int VIEWS_FIELD = 7;
    static final int LIKES_FIELD = 8;

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setIgnoreEmptyLines(true)
            .build();

    private VideoCsvReader() {
    }

    /**
     * Reads a CSV file. Bytes that are not valid UTF-8 are replaced rather than rejected.
     *
     * @param path the file to read
     * @return the records read and the number of skipped rows
     * @throws IOException if the file cannot be opened
     */
    public static LoadReport read(Path path) throws IOException {
        try (Reader reader = new BufferedReader(new InputStreamReader(Files.newInputStream(path), StandardCharsets.UTF_8))) {
            return read(reader, path.getFileName().toString());
        }
    }

    /**
     * @param reader the CSV source; not closed by this method
     * @param sourceName name used in logs and the report
     * @return the records read and the number of skipped rows
     * @throws IOException if the source cannot be read
     */
    public static LoadReport read(Reader reader, String sourceName) throws IOException {
        List<VideoRecord> records = new ArrayList<>();
        int skipped = 0;
        boolean truncated = false;

        CSVParser parser = FORMAT.parse(reader);
        Iterator<CSVRecord> rows = parser.iterator();
        boolean header = true;
        while (true) {
            CSVRecord row;
            try {
                if (!rows.hasNext()) {
                    break;
                }
                row = rows.next();
            } catch (UncheckedIOException | IllegalStateException e) {
                logger.warn("Stopped reading {} after {} records: {}", sourceName, records.size(), e.getMessage());
                truncated = true;
                break;
            }
            if (header) {
                header = false;
                continue;
            }
            try {
                records.add(toRecord(row));
            } catch (MalformedRecordException e) {
                skipped++;
                logger.debug("Skipping {} {}", sourceName, e.getMessage());
            }
        }
        return new LoadReport(sourceName, records, skipped, truncated);
    }

    static VideoRecord toRecord(CSVRecord row) {
        long rowNumber = row.getRecordNumber();
        if (row.size() < MIN_FIELDS) {
            throw new MalformedRecordException(rowNumber, "expected at least " + MIN_FIELDS + " fields, got " + row.size());
        }
        double views = parseCount(rowNumber, "views", row.get(VIEWS_FIELD));
        double likes = parseCount(rowNumber, "likes", row.get(LIKES_FIELD));
        return new VideoRecord(row.get(TITLE_FIELD), splitTags(row.get(TAGS_FIELD)), views, likes);
    }

    private static double parseCount(long rowNumber, String name, String raw) {
        double value;
        try {
            value = Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new MalformedRecordException(rowNumber, "invalid " + name + " '" + raw + "'", e);
        }
        if (!Double.isFinite(value) || value < 0) {
            throw new MalformedRecordException(rowNumber, "invalid " + name + " '" + raw + "'");
        }
        return value;
    }

    /**
     * Splits a raw tags field such as {@code music|"live concert"|"rock"}.
     *
     * @param raw the tags field
     * @return the tags, in order, without quotes or empty entries
     */
    public static List<String> splitTags(String raw) {
        List<String> tags = new ArrayList<>();
        for (String item : raw.split("\\|")) {
            String tag = stripQuotes(item);
            if (!tag.isEmpty()) {
                tags.add(tag);
            }
        }
        return tags;
    }

    private static String stripQuotes(String item) {
        int start = 0;
        int end = item.length();
        while (start < end && item.charAt(start) == '"') {
            start++;
        }
        while (end > start && item.charAt(end - 1) == '"') {
            end--;
        }
        return item.substring(start, end);
    }
}
