/*
 * Copyright (c) 2023-2025 Umit Unal
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

package com.umitunal.lake.core.compaction;

import com.umitunal.lake.storage.StorageLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Dated holding area for compaction inputs: {@code backup/<yyyyMMdd>/<key>}.
 */
public class BackupArea {
    private static final Logger logger = LoggerFactory.getLogger(BackupArea.class);

    static final DateTimeFormatter DATE_FOLDER = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final StorageLayout layout;
    private final Clock clock;

    public BackupArea(StorageLayout layout, Clock clock) {
        this.layout = layout;
        this.clock = clock;
    }

    /**
     * Moves a file into today's backup folder under its logical key.
     *
     * @return the backup location
     */
    public Path store(String key, Path file) throws IOException {
        Path target = layout.backupLocation(LocalDate.now(clock).format(DATE_FOLDER), key);
        Files.createDirectories(target.getParent());
        Files.move(file, target, StandardCopyOption.REPLACE_EXISTING);
        return target;
    }

    /**
     * Deletes dated folders older than the retention. Folders whose name is not a date are left alone.
     *
     * @return number of folders deleted
     */
    public int purgeExpired(int retentionDays) throws IOException {
        Path root = layout.backupRoot();
        if (!Files.isDirectory(root)) {
            return 0;
        }
        LocalDate cutoff = LocalDate.now(clock).minusDays(retentionDays);
        int purged = 0;
        try (DirectoryStream<Path> folders = Files.newDirectoryStream(root)) {
            for (Path folder : folders) {
                if (!Files.isDirectory(folder)) {
                    continue;
                }
                LocalDate date;
                try {
                    date = LocalDate.parse(folder.getFileName().toString(), DATE_FOLDER);
                } catch (DateTimeParseException e) {
                    continue;
                }
                if (date.isBefore(cutoff)) {
                    deleteRecursively(folder);
                    purged++;
                    logger.info("Purged backup folder " + folder.getFileName());
                }
            }
        }
        return purged;
    }

    private static void deleteRecursively(Path folder) throws IOException {
        Files.walkFileTree(folder, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
