package com.booking.realtime.catalog;

import com.booking.realtime.model.event.EntityName;
import com.booking.realtime.model.security.TableSecurityDescriptor;
import com.booking.realtime.visibility.TableSecurityCatalog;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sql.DataSource;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Reads whether row level security is enabled on a table and which of its columns a role may
 * select, from the PostgreSQL system catalog.
 */
public class JdbcTableSecurityCatalog implements TableSecurityCatalog {
    private static final Logger LOG = LogManager.getLogger(JdbcTableSecurityCatalog.class);

    private static final String UNDEFINED_TABLE = "42P01";

    private static final String DESCRIBE_SQL = "SELECT c.relrowsecurity, a.attname, "
            + "has_column_privilege(?, c.oid, a.attnum, 'SELECT') AS readable "
            + "FROM pg_class c "
            + "LEFT JOIN pg_attribute a ON a.attrelid = c.oid AND a.attnum > 0 AND NOT a.attisdropped "
            + "WHERE c.oid = ?::regclass "
            + "ORDER BY a.attnum";

    private final DataSource dataSource;

    public JdbcTableSecurityCatalog(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    }

    @Override
    public TableSecurityDescriptor describe(EntityName entity, String role) throws IOException {
        Boolean rlsEnabled = null;
        Set<String> readableColumns = new LinkedHashSet<>();

        try (Connection connection = this.dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(JdbcTableSecurityCatalog.DESCRIBE_SQL)) {
            statement.setString(1, role);
            statement.setString(2, entity.quoted());

            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    rlsEnabled = resultSet.getBoolean("relrowsecurity");

                    String column = resultSet.getString("attname");

                    if (column != null && resultSet.getBoolean("readable")) {
                        readableColumns.add(column);
                    }
                }
            }
        } catch (SQLException exception) {
            if (JdbcTableSecurityCatalog.UNDEFINED_TABLE.equals(exception.getSQLState())) {
                JdbcTableSecurityCatalog.LOG.warn(String.format("table %s does not exist", entity));
                return null;
            }

            throw new IOException(String.format("error describing %s for role %s: %s", entity, role, exception.getMessage()), exception);
        }

        if (rlsEnabled == null) {
            return null;
        }

        return new TableSecurityDescriptor(entity, rlsEnabled, role, readableColumns);
    }
}
