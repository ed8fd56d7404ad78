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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Extracts a zipped dataset the first time it is needed.
 */
public class DatasetArchive {
    private static final Logger logger = LoggerFactory.getLogger(DatasetArchive.class);

    private DatasetArchive() {
    }

    /**
     * Extracts {@code archive} into {@code targetDir} unless the target directory already exists.
     *
     * @param archive the zip file
     * @param targetDir where to extract
     * @return the number of files extracted; 0 when the target already existed
     * @throws FileNotFoundException if the archive does not exist
     * @throws IOException if extraction fails or an entry would be written outside targetDir
     */
    public static int ensureExtracted(Path archive, Path targetDir) throws IOException {
        if (Files.exists(targetDir)) {
            logger.debug("{} already exists, skipping extraction", targetDir);
            return 0;
        }
        if (!Files.isRegularFile(archive)) {
            throw new FileNotFoundException("Archive not found: " + archive.toAbsolutePath());
        }

        logger.info("Extracting dataset {} into {}", archive.getFileName(), targetDir);
        Path root = targetDir.toAbsolutePath().normalize();
        Files.createDirectories(root);
        int extracted = 0;
        try (InputStream in = Files.newInputStream(archive);
             ZipInputStream zip = new ZipInputStream(in)) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                Path out = root.resolve(entry.getName()).normalize();
                if (!out.startsWith(root)) {
                    throw new IOException("Archive entry escapes target directory: " + entry.getName());
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(out);
                } else {
                    Files.createDirectories(out.getParent());
                    Files.copy(zip, out, StandardCopyOption.REPLACE_EXISTING);
                    extracted++;
                }
                zip.closeEntry();
            }
        }
        logger.info("Extracted {} files", extracted);
        return extracted;
    }
}
