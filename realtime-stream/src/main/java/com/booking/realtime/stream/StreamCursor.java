package com.booking.realtime.stream;

import com.booking.realtime.commons.checkpoint.CheckpointStorage;
import com.booking.realtime.commons.checkpoint.StreamPosition;
import com.booking.realtime.commons.jdbc.PostgresDataSource;
import com.booking.realtime.stream.file.CaptureFileStreamCursor;
import com.booking.realtime.stream.publication.Publication;
import com.booking.realtime.stream.slot.WalSlotStreamCursor;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Sequential, resumable reader over the change stream. Changes come back in commit order and
 * stay available until the cursor is advanced through them.
 */
public interface StreamCursor extends Closeable {
    enum Type {
        SLOT {
            @Override
            protected StreamCursor newInstance(Map<String, Object> configuration) {
                return WalSlotStreamCursor.build(configuration, PostgresDataSource.build(configuration));
            }
        },
        FILE {
            @Override
            protected StreamCursor newInstance(Map<String, Object> configuration) {
                return CaptureFileStreamCursor.build(configuration, CheckpointStorage.build(configuration));
            }
        };

        protected abstract StreamCursor newInstance(Map<String, Object> configuration);
    }

    interface Configuration {
        String TYPE = "stream.type";
    }

    /**
     * Returns pending changes without acknowledging them. Repeated calls return the same
     * changes until {@link #advance(StreamPosition)} moves past them.
     */
    List<PendingChange> peek(int max) throws IOException;

    /**
     * Durably acknowledges every change up to and including {@code position}, which must come
     * from a previous {@link #peek(int)}.
     */
    void advance(StreamPosition position) throws IOException;

    default List<PendingChange> consume(int max) throws IOException {
        List<PendingChange> changes = this.peek(max);

        if (!changes.isEmpty()) {
            this.advance(changes.get(changes.size() - 1).getPosition());
        }

        return changes;
    }

    /**
     * The publication that decides which of the returned changes are captured.
     */
    Publication getPublication() throws IOException;

    static StreamCursor build(Map<String, Object> configuration) {
        return Type.valueOf(
                configuration.getOrDefault(Configuration.TYPE, Type.SLOT.name()).toString()
        ).newInstance(configuration);
    }
}
