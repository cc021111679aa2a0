/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.weft.core.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.weft.core.exceptions.PersistenceException;
import dev.mars.weft.core.exceptions.ReconstructionException;
import dev.mars.weft.core.process.Process;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link Persister} storing one JSON document per checkpoint.
 *
 * <p><b>Storage Layout:</b></p>
 * <pre>
 * {directory}/
 *   ├── {pid}.json          // default checkpoint
 *   └── {pid}.{tag}.json    // tagged checkpoint
 * </pre>
 *
 * <p>Each document records the pid, tag, save time and bundle. Writes go to
 * a temp file which is then atomically renamed over the previous document,
 * so a reader sees either the old or the new checkpoint, never a torn one.</p>
 *
 * <p>Pids and tags must not contain path separators or dots.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-03
 * @version 1.0
 */
public class FilePersister implements Persister {

    private static final Logger logger = LoggerFactory.getLogger(FilePersister.class);

    private static final String EXTENSION = ".json";
    private static final String TEMP_SUFFIX = ".tmp";

    private final ProcessBundler bundler;
    private final Path directory;
    private final boolean fsyncEnabled;
    private final ObjectMapper objectMapper;

    public FilePersister(ProcessBundler bundler, Path directory) throws PersistenceException {
        this(bundler, directory, true);
    }

    /**
     * @param bundler      converts processes to bundles
     * @param directory    the checkpoint directory, created if missing
     * @param fsyncEnabled whether to fsync each document before the rename
     * @throws PersistenceException if the directory cannot be created
     */
    public FilePersister(ProcessBundler bundler, Path directory, boolean fsyncEnabled) throws PersistenceException {
        this.bundler = Objects.requireNonNull(bundler, "Bundler cannot be null");
        this.directory = Objects.requireNonNull(directory, "Directory cannot be null");
        this.fsyncEnabled = fsyncEnabled;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new PersistenceException("Cannot create checkpoint directory " + directory, e);
        }
        logger.info("File checkpoint store opened at {}", directory.toAbsolutePath());
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public PersistedCheckpoint saveCheckpoint(Process process, String tag) throws PersistenceException {
        Bundle bundle = bundler.save(process);
        PersistedCheckpoint checkpoint = new PersistedCheckpoint(process.getPid(), tag);
        CheckpointDocument document = new CheckpointDocument(checkpoint.pid(), tag, Instant.now(), bundle.toMap());

        Path target = pathOf(checkpoint);
        Path tmp = target.resolveSibling(target.getFileName() + TEMP_SUFFIX);
        try {
            ByteBuffer buf = ByteBuffer.wrap(objectMapper.writeValueAsBytes(document));
            try (FileChannel ch = FileChannel.open(tmp,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE)) {
                while (buf.hasRemaining()) {
                    ch.write(buf);
                }
                if (fsyncEnabled) {
                    ch.force(true);
                }
            }
            Files.move(tmp, target,
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new PersistenceException("Cannot write checkpoint " + target, e);
        }
        logger.debug("Saved checkpoint {} to {}", checkpoint, target.getFileName());
        return checkpoint;
    }

    @Override
    public Bundle loadCheckpoint(String pid, String tag) throws PersistenceException {
        Path path = pathOf(new PersistedCheckpoint(pid, tag));
        if (!Files.exists(path)) {
            throw new PersistenceException("No checkpoint for pid " + pid + (tag == null ? "" : " with tag '" + tag + "'"));
        }
        CheckpointDocument document;
        try {
            document = objectMapper.readValue(path.toFile(), CheckpointDocument.class);
        } catch (IOException e) {
            throw new ReconstructionException("Cannot read checkpoint " + path, e);
        }
        return Bundle.fromMap(document.bundle());
    }

    @Override
    public List<PersistedCheckpoint> getCheckpoints() throws PersistenceException {
        List<PersistedCheckpoint> checkpoints = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + EXTENSION)) {
            for (Path path : stream) {
                checkpoints.add(checkpointOf(path));
            }
        } catch (IOException e) {
            throw new PersistenceException("Cannot list checkpoints in " + directory, e);
        }
        return checkpoints;
    }

    @Override
    public List<PersistedCheckpoint> getProcessCheckpoints(String pid) throws PersistenceException {
        List<PersistedCheckpoint> result = new ArrayList<>();
        for (PersistedCheckpoint checkpoint : getCheckpoints()) {
            if (checkpoint.pid().equals(pid)) {
                result.add(checkpoint);
            }
        }
        return result;
    }

    @Override
    public void deleteCheckpoint(String pid, String tag) throws PersistenceException {
        Path path = pathOf(new PersistedCheckpoint(pid, tag));
        try {
            if (Files.deleteIfExists(path)) {
                logger.debug("Deleted checkpoint {}", path.getFileName());
            }
        } catch (IOException e) {
            throw new PersistenceException("Cannot delete checkpoint " + path, e);
        }
    }

    @Override
    public void deleteProcessCheckpoints(String pid) throws PersistenceException {
        for (PersistedCheckpoint checkpoint : getProcessCheckpoints(pid)) {
            deleteCheckpoint(checkpoint.pid(), checkpoint.tag());
        }
    }

    private Path pathOf(PersistedCheckpoint checkpoint) {
        requireSafeName("pid", checkpoint.pid());
        if (checkpoint.tag() == null) {
            return directory.resolve(checkpoint.pid() + EXTENSION);
        }
        requireSafeName("tag", checkpoint.tag());
        return directory.resolve(checkpoint.pid() + "." + checkpoint.tag() + EXTENSION);
    }

    private static PersistedCheckpoint checkpointOf(Path path) {
        String name = path.getFileName().toString();
        String stem = name.substring(0, name.length() - EXTENSION.length());
        int dot = stem.indexOf('.');
        return dot < 0
                ? new PersistedCheckpoint(stem, null)
                : new PersistedCheckpoint(stem.substring(0, dot), stem.substring(dot + 1));
    }

    private static void requireSafeName(String what, String value) {
        if (value.isEmpty() || value.contains(".") || value.contains("/") || value.contains("\\")) {
            throw new IllegalArgumentException("Invalid checkpoint " + what + " '" + value + "'");
        }
    }

    /**
     * On-disk form of a checkpoint.
     */
    record CheckpointDocument(String pid, String tag, Instant savedAt, Map<String, Object> bundle) {
    }
}
