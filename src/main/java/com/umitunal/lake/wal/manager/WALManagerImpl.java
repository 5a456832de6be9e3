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

package com.umitunal.lake.wal.manager;

import com.umitunal.lake.wal.file.WALFile;
import com.umitunal.lake.wal.file.WALFileImpl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Implementation of the WALManager interface.
 * A fresh segment is opened on startup; existing segments are left untouched for replay.
 */
public class WALManagerImpl implements WALManager {
    private static final Logger logger = LoggerFactory.getLogger(WALManagerImpl.class);

    private static final DateTimeFormatter NAME_TIME = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmssSSS");
    private static final Pattern NAME_PATTERN = Pattern.compile("wal_(\\d{8}T\\d{9})_(\\d+)\\.log");

    private final Path directory;
    private final long maxLogSizeBytes;
    private final Clock clock;

    private WALFile currentFile;
    private long nextSequence;

    /**
     * Creates a new WALManagerImpl and opens a new current segment.
     *
     * @param directory the directory to store segments
     * @param maxLogSizeBytes size of a segment that triggers rotation
     * @param clock source of segment creation times
     * @throws IOException if an I/O error occurs
     */
    public WALManagerImpl(Path directory, long maxLogSizeBytes, Clock clock) throws IOException {
        this.directory = directory;
        this.maxLogSizeBytes = maxLogSizeBytes;
        this.clock = clock;

        Files.createDirectories(directory);

        List<Path> existing = findLogFiles();
        this.nextSequence = existing.isEmpty() ? 0 : sequenceOf(existing.get(existing.size() - 1)) + 1;
        this.currentFile = createNewFile();

        logger.info("WALManager initialized in directory: " + directory + " with " + existing.size()
            + " existing segments");
    }

    private WALFile createNewFile() throws IOException {
        long seqNum = nextSequence++;
        long now = clock.millis();
        String time = NAME_TIME.format(LocalDateTime.ofInstant(Instant.ofEpochMilli(now), ZoneOffset.UTC));
        Path path = directory.resolve(String.format("wal_%s_%06d.log", time, seqNum));
        WALFile file = new WALFileImpl(path, seqNum, now);
        logger.info("Created new WAL segment: " + path.getFileName());
        return file;
    }

    @Override
    public synchronized WALFile getCurrentFile() {
        return currentFile;
    }

    @Override
    public synchronized WALFile rotateLog() throws IOException {
        WALFile previous = currentFile;
        currentFile = createNewFile();
        previous.close();
        logger.info("Rotated WAL from " + previous.getName() + " to " + currentFile.getName());
        return currentFile;
    }

    @Override
    public List<Path> findLogFiles() throws IOException {
        List<Path> logFiles = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "wal_*.log")) {
            for (Path path : stream) {
                if (NAME_PATTERN.matcher(path.getFileName().toString()).matches()) {
                    logFiles.add(path);
                } else {
                    logger.warn("Ignoring file with unexpected WAL name: " + path);
                }
            }
        }
        logFiles.sort(Comparator.comparingLong(WALManagerImpl::sequenceOf));
        return logFiles;
    }

    @Override
    public long createdAtOf(Path segment) {
        Matcher matcher = NAME_PATTERN.matcher(segment.getFileName().toString());
        if (!matcher.matches()) {
            return -1;
        }
        try {
            return LocalDateTime.parse(matcher.group(1), NAME_TIME).toInstant(ZoneOffset.UTC).toEpochMilli();
        } catch (DateTimeParseException e) {
            logger.warn("Could not parse creation time from WAL segment name: " + segment.getFileName());
            return -1;
        }
    }

    @Override
    public synchronized void deleteLog(Path segment) throws IOException {
        if (segment.getFileName().equals(currentFile.getPath().getFileName())) {
            throw new IllegalArgumentException("Cannot delete the current WAL segment: " + segment);
        }
        Files.deleteIfExists(segment);
        logger.info("Deleted WAL segment: " + segment.getFileName());
    }

    @Override
    public Path getDirectory() {
        return directory;
    }

    @Override
    public long getMaxLogSizeBytes() {
        return maxLogSizeBytes;
    }

    @Override
    public synchronized void close() throws IOException {
        currentFile.close();
    }

    private static long sequenceOf(Path segment) {
        Matcher matcher = NAME_PATTERN.matcher(segment.getFileName().toString());
        if (!matcher.matches()) {
            return -1;
        }
        return Long.parseLong(matcher.group(2));
    }
}
