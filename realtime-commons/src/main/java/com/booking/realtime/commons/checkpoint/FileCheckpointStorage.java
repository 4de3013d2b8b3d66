package com.booking.realtime.commons.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Stores checkpoints as JSON files. Writes go to a sibling temporary file first and are moved
 * into place, so a crash never leaves a half written checkpoint behind.
 */
public class FileCheckpointStorage implements CheckpointStorage {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public void saveCheckpoint(String path, Checkpoint checkpoint) throws IOException {
        if (checkpoint != null) {
            Path target = Paths.get(path);
            Path temporary = target.resolveSibling(target.getFileName() + ".tmp");

            Files.write(temporary, FileCheckpointStorage.MAPPER.writeValueAsBytes(checkpoint));
            Files.move(temporary, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        }
    }

    @Override
    public Checkpoint loadCheckpoint(String path) throws IOException {
        try {
            byte[] bytes = Files.readAllBytes(Paths.get(path));

            if (bytes.length > 0) {
                return FileCheckpointStorage.MAPPER.readValue(bytes, Checkpoint.class);
            } else {
                return null;
            }
        } catch (NoSuchFileException exception) {
            return null;
        }
    }
}
