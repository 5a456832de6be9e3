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

package com.umitunal.lake.wal.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.umitunal.lake.catalog.FileMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Writes catalog checkpoints as {@code checkpoint_<millis>.json} and keeps the newest few.
 */
public class CheckpointManager {
    private static final Logger logger = LoggerFactory.getLogger(CheckpointManager.class);

    private final Path directory;
    private final ObjectMapper objectMapper;
    private final int checkpointsToKeep;

    public CheckpointManager(Path directory, ObjectMapper objectMapper, int checkpointsToKeep) throws IOException {
        this.directory = directory;
        this.objectMapper = objectMapper;
        this.checkpointsToKeep = checkpointsToKeep;
        Files.createDirectories(directory);
    }

    /**
     * Writes a checkpoint and removes the oldest ones beyond the retention count.
     *
     * @throws IOException if the checkpoint cannot be written
     */
    public Checkpoint write(long createdAt, String segment, List<FileMetadata> files) throws IOException {
        Checkpoint checkpoint = new Checkpoint(createdAt, segment, files);
        Path target = directory.resolve(String.format("checkpoint_%013d.json", createdAt));
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        objectMapper.writeValue(temp.toFile(), checkpoint);
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        logger.info("Wrote checkpoint " + target.getFileName() + " with " + files.size()
            + " catalog entries, resuming at " + segment);

        List<Path> all = listCheckpoints();
        for (int i = 0; i < all.size() - checkpointsToKeep; i++) {
            try {
                Files.deleteIfExists(all.get(i));
            } catch (IOException e) {
                logger.warn("Failed to delete old checkpoint " + all.get(i), e);
            }
        }
        return checkpoint;
    }

    /**
     * @return the newest readable checkpoint; unreadable ones are logged and passed over
     * @throws IOException if the checkpoint directory cannot be listed
     */
    public Optional<Checkpoint> latest() throws IOException {
        List<Path> all = listCheckpoints();
        for (int i = all.size() - 1; i >= 0; i--) {
            try {
                return Optional.of(objectMapper.readValue(all.get(i).toFile(), Checkpoint.class));
            } catch (IOException e) {
                logger.warn("Ignoring unreadable checkpoint " + all.get(i).getFileName() + ": " + e.getMessage());
            }
        }
        return Optional.empty();
    }

    public int count() throws IOException {
        return listCheckpoints().size();
    }

    private List<Path> listCheckpoints() throws IOException {
        List<Path> checkpoints = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "checkpoint_*.json")) {
            for (Path path : stream) {
                checkpoints.add(path);
            }
        }
        checkpoints.sort(Comparator.comparing(p -> p.getFileName().toString()));
        return checkpoints;
    }
}
