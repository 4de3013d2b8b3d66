package com.booking.realtime.commons.checkpoint;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class FileCheckpointStorageTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testSaveAndLoad() throws IOException {
        String path = new File(this.folder.getRoot(), "checkpoint").getPath();
        CheckpointStorage storage = CheckpointStorage.build(Collections.singletonMap(
                CheckpointStorage.Configuration.TYPE, CheckpointStorage.Type.FILE.name()
        ));

        Checkpoint checkpoint = new Checkpoint(StreamPosition.of("16/B374D848", 2), System.currentTimeMillis());

        storage.saveCheckpoint(path, checkpoint);

        Checkpoint loaded = storage.loadCheckpoint(path);

        assertEquals(checkpoint, loaded);
        assertEquals(checkpoint.getTimestamp(), loaded.getTimestamp());
        assertEquals(2, loaded.getPosition().getOrdinal());
    }

    @Test
    public void testOverwriteKeepsLatest() throws IOException {
        String path = new File(this.folder.getRoot(), "checkpoint").getPath();
        CheckpointStorage storage = new FileCheckpointStorage();

        storage.saveCheckpoint(path, new Checkpoint(StreamPosition.of("0/10", 0), 1L));
        storage.saveCheckpoint(path, new Checkpoint(StreamPosition.of("0/20", 0), 2L));

        assertEquals(StreamPosition.of("0/20", 0), storage.loadCheckpoint(path).getPosition());
        assertTrue(new File(path).exists());
    }

    @Test
    public void testMissingFileLoadsNothing() throws IOException {
        String path = new File(this.folder.getRoot(), "absent").getPath();

        assertNull(new FileCheckpointStorage().loadCheckpoint(path));
    }
}
