package com.booking.realtime.commons.checkpoint;

import java.io.IOException;
import java.util.Map;

public interface CheckpointStorage {
    enum Type {
        NONE {
            @Override
            protected CheckpointStorage newInstance(Map<String, Object> configuration) {
                return new CheckpointStorage() {
                    @Override
                    public void saveCheckpoint(String path, Checkpoint checkpoint) {
                    }

                    @Override
                    public Checkpoint loadCheckpoint(String path) {
                        return null;
                    }
                };
            }
        },
        FILE {
            @Override
            protected CheckpointStorage newInstance(Map<String, Object> configuration) {
                return new FileCheckpointStorage();
            }
        };

        protected abstract CheckpointStorage newInstance(Map<String, Object> configuration);
    }

    interface Configuration {
        String TYPE = "checkpoint.storage.type";
        String PATH = "checkpoint.path";
    }

    void saveCheckpoint(String path, Checkpoint checkpoint) throws IOException;

    Checkpoint loadCheckpoint(String path) throws IOException;

    static CheckpointStorage build(Map<String, Object> configuration) {
        return Type.valueOf(
                configuration.getOrDefault(Configuration.TYPE, Type.FILE.name()).toString()
        ).newInstance(configuration);
    }
}
