package com.booking.realtime.stream.slot;

import com.booking.realtime.commons.checkpoint.StreamPosition;
import com.booking.realtime.stream.PendingChange;
import com.booking.realtime.stream.StreamCursor;
import com.booking.realtime.stream.publication.Publication;
import com.booking.realtime.stream.publication.PublicationLoader;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sql.DataSource;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads a PostgreSQL logical replication slot decoded by wal2json (format-version 2).
 * <p>
 * Peeking returns whole transactions. A slot can only be consumed transaction by transaction,
 * so {@link #advance(StreamPosition)} acknowledges the transactions whose changes are all at or
 * before the given position and leaves a partially processed transaction pending.
 */
public class WalSlotStreamCursor implements StreamCursor {
    private static final Logger LOG = LogManager.getLogger(WalSlotStreamCursor.class);

    public interface Configuration {
        String SLOT = "stream.slot.name";
        String CREATE = "stream.slot.create";
    }

    private static final String DEFAULT_SLOT = "realtime";

    private static final String OPTIONS = "'format-version', '2', 'include-transaction', 'true', "
            + "'include-timestamp', 'true', 'include-pk', '1'";

    private static final String PEEK_CHANGES_SQL = "SELECT lsn::text AS lsn, data FROM pg_logical_slot_peek_changes(?, NULL, ?, "
            + WalSlotStreamCursor.OPTIONS + "%s)";

    private static final String GET_CHANGES_SQL = "SELECT count(*) FROM pg_logical_slot_get_changes(?, ?::pg_lsn, NULL, "
            + WalSlotStreamCursor.OPTIONS + ")";

    private static final String FIND_SLOT_SQL = "SELECT 1 FROM pg_replication_slots WHERE slot_name = ?";

    private static final String CREATE_SLOT_SQL = "SELECT pg_create_logical_replication_slot(?, 'wal2json')";

    private static final class Boundary {
        private final StreamPosition lastChange;
        private final String commitLsn;

        private Boundary(StreamPosition lastChange, String commitLsn) {
            this.lastChange = lastChange;
            this.commitLsn = commitLsn;
        }
    }

    private final DataSource dataSource;
    private final String slot;
    private final boolean create;
    private final PublicationLoader publicationLoader;
    private final Wal2JsonTranslator translator;

    private List<Boundary> boundaries;
    private Publication publication;
    private boolean slotReady;

    public WalSlotStreamCursor(DataSource dataSource, String slot, boolean create, PublicationLoader publicationLoader, Wal2JsonTranslator translator) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.slot = Objects.requireNonNull(slot, "slot");
        this.create = create;
        this.publicationLoader = Objects.requireNonNull(publicationLoader, "publicationLoader");
        this.translator = Objects.requireNonNull(translator, "translator");
        this.boundaries = Collections.emptyList();
    }

    @Override
    public List<PendingChange> peek(int max) throws IOException {
        this.ensureSlot();
        this.publication = this.publicationLoader.load();

        List<String> options = new ArrayList<>();
        StringBuilder optionSql = new StringBuilder();

        // without a captured table the slot is still drained, the publication filter drops everything
        if (this.publication.capturesAnything()) {
            options.add("actions");
            options.add(this.publication.toWal2JsonActions());

            String tables = this.publication.toWal2JsonTables();

            if (tables != null) {
                options.add("add-tables");
                options.add(tables);
            }
        }

        for (int index = 0; index < options.size(); index++) {
            optionSql.append(", ?");
        }

        List<PendingChange> changes = new ArrayList<>();
        List<Boundary> boundaries = new ArrayList<>();

        try (Connection connection = this.dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(String.format(WalSlotStreamCursor.PEEK_CHANGES_SQL, optionSql))) {
            statement.setString(1, this.slot);
            statement.setInt(2, max);

            for (int index = 0; index < options.size(); index++) {
                statement.setString(3 + index, options.get(index));
            }

            try (ResultSet resultSet = statement.executeQuery()) {
                StreamPosition previous = null;
                StreamPosition lastChange = null;

                while (resultSet.next()) {
                    String lsn = resultSet.getString("lsn");
                    String data = resultSet.getString("data");

                    if (this.translator.isCommit(data)) {
                        boundaries.add(new Boundary(lastChange, lsn));
                        continue;
                    }

                    if (this.translator.isTransactionBoundary(data)) {
                        continue;
                    }

                    long value = StreamPosition.parseLsn(lsn);
                    int ordinal = (previous != null && previous.getLsn() == value) ? previous.getOrdinal() + 1 : 0;
                    StreamPosition position = new StreamPosition(value, ordinal);

                    changes.add(new PendingChange(position, this.translator.translate(data)));

                    previous = position;
                    lastChange = position;
                }
            }
        } catch (SQLException exception) {
            throw new IOException(String.format("error peeking slot %s: %s", this.slot, exception.getMessage()), exception);
        }

        this.boundaries = boundaries;

        WalSlotStreamCursor.LOG.debug(String.format("peeked %d changes in %d transactions from slot %s", changes.size(), boundaries.size(), this.slot));

        return changes;
    }

    @Override
    public void advance(StreamPosition position) throws IOException {
        int covered = 0;

        for (Boundary boundary : this.boundaries) {
            if (boundary.lastChange != null && boundary.lastChange.isAfter(position)) {
                break;
            }

            covered++;
        }

        if (covered == 0) {
            WalSlotStreamCursor.LOG.debug(String.format("no complete transaction up to %s on slot %s", position, this.slot));
            return;
        }

        String commitLsn = this.boundaries.get(covered - 1).commitLsn;

        try (Connection connection = this.dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(WalSlotStreamCursor.GET_CHANGES_SQL)) {
            statement.setString(1, this.slot);
            statement.setString(2, commitLsn);

            try (ResultSet resultSet = statement.executeQuery()) {
                if (resultSet.next()) {
                    WalSlotStreamCursor.LOG.debug(String.format("consumed %d messages up to %s on slot %s", resultSet.getLong(1), commitLsn, this.slot));
                }
            }
        } catch (SQLException exception) {
            throw new IOException(String.format("error advancing slot %s to %s: %s", this.slot, commitLsn, exception.getMessage()), exception);
        }

        this.boundaries = new ArrayList<>(this.boundaries.subList(covered, this.boundaries.size()));
    }

    @Override
    public Publication getPublication() throws IOException {
        if (this.publication == null) {
            this.publication = this.publicationLoader.load();
        }

        return this.publication;
    }

    private void ensureSlot() throws IOException {
        if (this.slotReady) {
            return;
        }

        try (Connection connection = this.dataSource.getConnection()) {
            boolean exists;

            try (PreparedStatement statement = connection.prepareStatement(WalSlotStreamCursor.FIND_SLOT_SQL)) {
                statement.setString(1, this.slot);

                try (ResultSet resultSet = statement.executeQuery()) {
                    exists = resultSet.next();
                }
            }

            if (!exists) {
                if (!this.create) {
                    throw new IOException(String.format("replication slot %s does not exist", this.slot));
                }

                try (PreparedStatement statement = connection.prepareStatement(WalSlotStreamCursor.CREATE_SLOT_SQL)) {
                    statement.setString(1, this.slot);
                    statement.executeQuery().close();
                }

                WalSlotStreamCursor.LOG.info(String.format("created replication slot %s", this.slot));
            }
        } catch (SQLException exception) {
            throw new IOException(String.format("error checking replication slot %s: %s", this.slot, exception.getMessage()), exception);
        }

        this.slotReady = true;
    }

    @Override
    public void close() throws IOException {
        if (this.dataSource instanceof AutoCloseable) {
            try {
                ((AutoCloseable) this.dataSource).close();
            } catch (IOException exception) {
                throw exception;
            } catch (Exception exception) {
                throw new IOException(exception);
            }
        }
    }

    public static WalSlotStreamCursor build(Map<String, Object> configuration, DataSource dataSource) {
        return new WalSlotStreamCursor(
                dataSource,
                configuration.getOrDefault(Configuration.SLOT, WalSlotStreamCursor.DEFAULT_SLOT).toString(),
                Boolean.parseBoolean(configuration.getOrDefault(Configuration.CREATE, "false").toString()),
                new PublicationLoader(dataSource, configuration.getOrDefault(Publication.Configuration.NAME, Publication.DEFAULT_NAME).toString()),
                new Wal2JsonTranslator()
        );
    }
}
