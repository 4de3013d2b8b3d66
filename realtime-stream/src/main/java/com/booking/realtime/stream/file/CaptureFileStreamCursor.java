package com.booking.realtime.stream.file;

import com.booking.realtime.commons.checkpoint.Checkpoint;
import com.booking.realtime.commons.checkpoint.CheckpointStorage;
import com.booking.realtime.commons.checkpoint.StreamPosition;
import com.booking.realtime.stream.PendingChange;
import com.booking.realtime.stream.StreamCursor;
import com.booking.realtime.stream.publication.Publication;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Replays a capture file holding one canonical change payload per line. The position of a
 * change is its line number; the acknowledged position survives restarts through
 * {@link CheckpointStorage}.
 */
public class CaptureFileStreamCursor implements StreamCursor {
    private static final Logger LOG = LogManager.getLogger(CaptureFileStreamCursor.class);

    public interface Configuration {
        String PATH = "stream.file.path";
        String POSITION_PATH = "stream.file.position.path";
    }

    private final Path path;
    private final CheckpointStorage storage;
    private final String positionPath;
    private final Publication publication;

    private StreamPosition acknowledged;

    public CaptureFileStreamCursor(Path path, CheckpointStorage storage, String positionPath, Publication publication) throws IOException {
        this.path = Objects.requireNonNull(path, "path");
        this.storage = Objects.requireNonNull(storage, "storage");
        this.positionPath = Objects.requireNonNull(positionPath, "positionPath");
        this.publication = Objects.requireNonNull(publication, "publication");

        Checkpoint checkpoint = this.storage.loadCheckpoint(this.positionPath);

        this.acknowledged = (checkpoint != null && checkpoint.getPosition() != null) ? checkpoint.getPosition() : StreamPosition.START;

        CaptureFileStreamCursor.LOG.info(String.format("replaying %s from %s", this.path, this.acknowledged));
    }

    @Override
    public List<PendingChange> peek(int max) throws IOException {
        List<PendingChange> changes = new ArrayList<>();

        try (BufferedReader reader = Files.newBufferedReader(this.path, StandardCharsets.UTF_8)) {
            String line;
            long number = 0L;

            while (changes.size() < max && (line = reader.readLine()) != null) {
                number++;

                if (line.trim().isEmpty()) {
                    continue;
                }

                StreamPosition position = new StreamPosition(number, 0);

                if (position.isAfter(this.acknowledged)) {
                    changes.add(new PendingChange(position, line));
                }
            }
        }

        return changes;
    }

    @Override
    public void advance(StreamPosition position) throws IOException {
        if (!position.isAfter(this.acknowledged)) {
            return;
        }

        this.storage.saveCheckpoint(this.positionPath, new Checkpoint(position, System.currentTimeMillis()));
        this.acknowledged = position;
    }

    public StreamPosition getAcknowledged() {
        return this.acknowledged;
    }

    @Override
    public Publication getPublication() {
        return this.publication;
    }

    @Override
    public void close() {
    }

    public static CaptureFileStreamCursor build(Map<String, Object> configuration, CheckpointStorage storage) {
        Object path = configuration.get(Configuration.PATH);

        Objects.requireNonNull(path, String.format("Configuration required: %s", Configuration.PATH));

        String positionPath = configuration.getOrDefault(Configuration.POSITION_PATH, String.format("%s.position", path)).toString();

        try {
            return new CaptureFileStreamCursor(Paths.get(path.toString()), storage, positionPath, Publication.fromConfiguration(configuration));
        } catch (IOException exception) {
            throw new UncheckedIOException(exception);
        }
    }
}
