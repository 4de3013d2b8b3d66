package com.booking.realtime.stream.publication;

import com.booking.realtime.model.event.ChangeEventType;
import com.booking.realtime.model.event.EntityName;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sql.DataSource;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Reads a publication definition from {@code pg_publication} and {@code pg_publication_rel}.
 */
public class PublicationLoader {
    private static final Logger LOG = LogManager.getLogger(PublicationLoader.class);

    private static final String LOAD_PUBLICATION_SQL = "SELECT p.puballtables, p.pubinsert, p.pubupdate, p.pubdelete, p.pubtruncate, "
            + "n.nspname, c.relname "
            + "FROM pg_publication p "
            + "LEFT JOIN pg_publication_rel r ON r.prpubid = p.oid "
            + "LEFT JOIN pg_class c ON c.oid = r.prrelid "
            + "LEFT JOIN pg_namespace n ON n.oid = c.relnamespace "
            + "WHERE p.pubname = ?";

    private final DataSource dataSource;
    private final String name;

    public PublicationLoader(DataSource dataSource, String name) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.name = Objects.requireNonNull(name, "name");
    }

    public Publication load() throws IOException {
        boolean found = false;
        boolean allTables = false;
        Set<ChangeEventType> actions = EnumSet.noneOf(ChangeEventType.class);
        Set<EntityName> tables = new LinkedHashSet<>();

        try (Connection connection = this.dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(PublicationLoader.LOAD_PUBLICATION_SQL)) {
            statement.setString(1, this.name);

            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    found = true;
                    allTables = resultSet.getBoolean("puballtables");

                    PublicationLoader.addIf(actions, resultSet.getBoolean("pubinsert"), ChangeEventType.INSERT);
                    PublicationLoader.addIf(actions, resultSet.getBoolean("pubupdate"), ChangeEventType.UPDATE);
                    PublicationLoader.addIf(actions, resultSet.getBoolean("pubdelete"), ChangeEventType.DELETE);
                    PublicationLoader.addIf(actions, resultSet.getBoolean("pubtruncate"), ChangeEventType.TRUNCATE);

                    String table = resultSet.getString("relname");

                    if (table != null) {
                        tables.add(new EntityName(resultSet.getString("nspname"), table));
                    }
                }
            }
        } catch (SQLException exception) {
            throw new IOException(String.format("error loading publication %s: %s", this.name, exception.getMessage()), exception);
        }

        if (!found) {
            PublicationLoader.LOG.warn(String.format("publication %s does not exist, nothing is captured", this.name));
            return Publication.empty(this.name);
        }

        return new Publication(this.name, allTables, actions, tables);
    }

    private static void addIf(Set<ChangeEventType> actions, boolean enabled, ChangeEventType type) {
        if (enabled) {
            actions.add(type);
        }
    }
}
