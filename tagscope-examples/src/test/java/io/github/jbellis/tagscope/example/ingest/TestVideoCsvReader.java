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

import org.junit.Test;

import java.io.IOException;
import java.io.StringReader;
import java.util.List;

import static io.github.jbellis.tagscope.example.ingest.CsvFixtures.csv;
import static io.github.jbellis.tagscope.example.ingest.CsvFixtures.row;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class TestVideoCsvReader {

    private static LoadReport read(String content) throws IOException {
        return VideoCsvReader.read(new StringReader(content), "fixture.csv");
    }

    @Test
    public void readsWellFormedRows() throws IOException {
        var report = read(csv(
                row("First", "music|pop", "1000", "50"),
                row("Second", "gaming", "200", "20")));

        assertEquals(2, report.getRecords().size());
        assertEquals(0, report.getSkippedRows());
        assertFalse(report.isTruncated());

        var first = report.getRecords().get(0);
        assertEquals("First", first.getTitle());
        assertEquals(List.of("music", "pop"), first.getTags());
        assertEquals(1000.0, first.getViews(), 0.0);
        assertEquals(0.05, first.getRatio(), 1e-12);
    }

    @Test
    public void headerOnlyYieldsNothing() throws IOException {
        var report = read(csv());
        assertTrue(report.getRecords().isEmpty());
        assertEquals(0, report.getSkippedRows());
    }

    @Test
    public void quotedFieldsKeepCommas() throws IOException {
        var report = read(csv(row("\"Hello, World\"", "\"\"\"funny\"\"|\"\"cats, dogs\"\"\"", "10", "1")));

        var record = report.getRecords().get(0);
        assertEquals("Hello, World", record.getTitle());
        assertEquals(List.of("funny", "cats, dogs"), record.getTags());
    }

    @Test
    public void skipsShortRows() throws IOException {
        var report = read(csv(
                "id,date,Short",
                row("Kept", "news", "10", "1")));

        assertEquals(1, report.getRecords().size());
        assertEquals(1, report.getSkippedRows());
        assertEquals("Kept", report.getRecords().get(0).getTitle());
    }

    @Test
    public void skipsUnparseableCounts() throws IOException {
        var report = read(csv(
                row("BadViews", "news", "lots", "1"),
                row("NegativeLikes", "news", "10", "-3"),
                row("Good", "news", " 10 ", "2")));

        assertEquals(2, report.getSkippedRows());
        assertEquals(1, report.getRecords().size());
        assertEquals(0.2, report.getRecords().get(0).getRatio(), 1e-12);
    }

    @Test
    public void skipsInfiniteCounts() throws IOException {
        var report = read(csv(
                row("Endless", "music", "Infinity", "Infinity"),
                row("Viral", "music", "100", "Infinity"),
                row("Finite", "music", "100", "5")));

        assertEquals(2, report.getSkippedRows());
        assertEquals(1, report.getRecords().size());
        assertEquals("Finite", report.getRecords().get(0).getTitle());
    }

    @Test
    public void zeroViewsGiveZeroRatio() throws IOException {
        var report = read(csv(row("Unseen", "vlog", "0", "7")));
        assertEquals(0.0, report.getRecords().get(0).getRatio(), 0.0);
    }

    @Test
    public void unterminatedQuoteKeepsEarlierRows() throws IOException {
        var report = read(csv(row("Before", "music", "10", "1")) + "id,date,\"never closed");

        assertTrue(report.isTruncated());
        assertEquals(1, report.getRecords().size());
        assertEquals("Before", report.getRecords().get(0).getTitle());
    }

    @Test
    public void splitTagsStripsQuotesAndDropsEmpty() {
        assertEquals(List.of("a", "b", "c"), VideoCsvReader.splitTags("\"a\"|b||\"c\""));
        assertEquals(List.of(), VideoCsvReader.splitTags(""));
        assertEquals(List.of("[none]"), VideoCsvReader.splitTags("[none]"));
    }
}
