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
import io.github.jbellis.tagscope.model.TagSelection;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class TestBenchmarkCsvLog {
    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private static BenchmarkReport report() {
        var runs = List.of(new RunTiming(1, 2_500_000, 1_000_000), new RunTiming(2, 3_000_000, 999_999));
        return new BenchmarkReport(runs, 42, TagSelection.of("music", "gaming"));
    }

    @Test
    public void writesHeaderOnceAndOneRowPerRun() throws IOException {
        Path dir = tmp.getRoot().toPath();
        Path out;
        try (var log = new BenchmarkCsvLog(dir, "bench_")) {
            out = log.getOutFile();
            log.append(report());
            log.append(report());
        }

        assertTrue(out.getFileName().toString().matches("bench_\\d{8}_\\d{6}\\.csv"));
        List<String> lines = Files.readAllLines(out);
        assertEquals(5, lines.size());
        assertEquals("run,heap_ms,hash_ms,heap_ns,hash_ns,tags,records", lines.get(0));
        assertEquals("1,2,1,2500000,1000000,\"music,gaming\",42", lines.get(1));
        assertEquals("2,3,0,3000000,999999,\"music,gaming\",42", lines.get(2));
    }

    @Test
    public void blankPrefixUsesDefault() throws IOException {
        try (var log = new BenchmarkCsvLog(tmp.getRoot().toPath(), " ")) {
            assertTrue(log.getOutFile().getFileName().toString().startsWith(BenchmarkCsvLog.DEFAULT_PREFIX));
        }
    }

    @Test
    public void writerClosedWhenHeaderFails() {
        var writer = new Writer() {
            boolean closed;

            @Override
            public void write(char[] buf, int off, int len) throws IOException {
                throw new IOException("disk full");
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
                closed = true;
            }
        };

        var ex = assertThrows(IOException.class, () -> BenchmarkCsvLog.openPrinter(writer, false));
        assertEquals("disk full", ex.getMessage());
        assertTrue(writer.closed);
    }
}
