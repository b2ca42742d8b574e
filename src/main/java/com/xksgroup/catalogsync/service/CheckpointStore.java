package com.xksgroup.catalogsync.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.xksgroup.catalogsync.exception.CheckpointException;
import com.xksgroup.catalogsync.model.SyncCheckpoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Loads and saves the single checkpoint file.
 * <p>
 * Single writer, single process. Two processes pointed at the same file will overwrite each other's progress.
 */
@Slf4j
@Component
public class CheckpointStore {

    private final Path file;
    private final ObjectMapper mapper;

    @Autowired
    public CheckpointStore(@Value("${sync.checkpoint-file:state.json}") String checkpointFile) {
        this(Path.of(checkpointFile));
    }

    public CheckpointStore(Path file) {
        this.file = file.toAbsolutePath();
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path getFile() {
        return file;
    }

    /**
     * Reads the checkpoint, creating a zero-valued one on first run.
     *
     * @throws CheckpointException the file exists but cannot be read or parsed
     */
    public SyncCheckpoint load() {
        if (!Files.exists(file)) {
            log.warn("Checkpoint file not found, initializing a new one: {}", file);
            SyncCheckpoint initial = new SyncCheckpoint();
            save(initial);
            return initial;
        }

        try {
            SyncCheckpoint checkpoint = mapper.readValue(file.toFile(), SyncCheckpoint.class);
            if (checkpoint == null) {
                throw new CheckpointException("Checkpoint file is empty: " + file, null);
            }
            log.debug("Checkpoint loaded from {} (lastPage: {}, failedUploads: {}, failedDomains: {})",
                    file, checkpoint.getLastPage(), checkpoint.getFailedUploadIds().size(),
                    checkpoint.getFailedDistribution().size());
            return checkpoint;
        } catch (IOException e) {
            log.error("Checkpoint file is corrupt or unreadable: {}", file, e);
            throw new CheckpointException("Cannot read checkpoint " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Writes the checkpoint to a sibling temp file, forces it to disk, then renames it over the real file.
     */
    public void save(SyncCheckpoint checkpoint) {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            byte[] json = mapper.writeValueAsBytes(checkpoint);
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }

            try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                channel.write(ByteBuffer.wrap(json));
                channel.force(true);
            }

            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("Atomic rename not supported for {}, falling back to replace", file);
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Checkpoint saved: {} (lastPage: {})", file, checkpoint.getLastPage());

        } catch (JsonProcessingException e) {
            throw new CheckpointException("Cannot serialize checkpoint", e);
        } catch (IOException e) {
            log.error("Failed to write checkpoint {}", file, e);
            throw new CheckpointException("Cannot write checkpoint " + file + ": " + e.getMessage(), e);
        }
    }
}
