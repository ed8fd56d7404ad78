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

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class TestDatasetArchive {
    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private Path zip(Map<String, String> entries) throws IOException {
        Path archive = tmp.getRoot().toPath().resolve("archive.zip");
        try (OutputStream os = Files.newOutputStream(archive);
             ZipOutputStream zos = new ZipOutputStream(os)) {
            for (var e : entries.entrySet()) {
                zos.putNextEntry(new ZipEntry(e.getKey()));
                zos.write(e.getValue().getBytes(StandardCharsets.UTF_8));
                zos.closeEntry();
            }
        }
        return archive;
    }

    @Test
    public void extractsIntoTarget() throws IOException {
        Path archive = zip(Map.of("USvideos.csv", "a", "nested/CAvideos.csv", "b"));
        Path target = tmp.getRoot().toPath().resolve("data").resolve("unzipped");

        assertEquals(2, DatasetArchive.ensureExtracted(archive, target));
        assertEquals("a", Files.readString(target.resolve("USvideos.csv")));
        assertEquals("b", Files.readString(target.resolve("nested").resolve("CAvideos.csv")));
    }

    @Test
    public void skipsWhenTargetExists() throws IOException {
        Path archive = zip(Map.of("USvideos.csv", "a"));
        Path target = tmp.newFolder("unzipped").toPath();

        assertEquals(0, DatasetArchive.ensureExtracted(archive, target));
        assertFalse(Files.exists(target.resolve("USvideos.csv")));
    }

    @Test
    public void missingArchiveFails() {
        Path target = tmp.getRoot().toPath().resolve("unzipped");
        assertThrows(FileNotFoundException.class,
                () -> DatasetArchive.ensureExtracted(tmp.getRoot().toPath().resolve("missing.zip"), target));
    }

    @Test
    public void rejectsEntriesOutsideTarget() throws IOException {
        Path archive = zip(Map.of("../evil.csv", "x"));
        Path target = tmp.getRoot().toPath().resolve("unzipped");

        var ex = assertThrows(IOException.class, () -> DatasetArchive.ensureExtracted(archive, target));
        assertTrue(ex.getMessage().startsWith("Archive entry escapes target directory"));
        assertFalse(Files.exists(tmp.getRoot().toPath().resolve("evil.csv")));
    }
}
