package com.booking.realtime.catalog;

import com.booking.realtime.model.event.EntityName;
import com.booking.realtime.visibility.RowSecurityAdmission;
import com.fasterxml.jackson.databind.ObjectMapper;

import javax.sql.DataSource;
import java.io.IOException;
import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Delegates row level security to the database: one statement per batch of identities asks a
 * host function whether the row would be visible to each identity under the table's policies.
 * The function takes {@code (regclass, jsonb, uuid)} and returns {@code boolean}.
 */
public class JdbcRowSecurityAdmission implements RowSecurityAdmission {

    public interface Configuration {
        String FUNCTION = "catalog.rls.function";
        String QUERY_TIMEOUT = "catalog.rls.query.timeout.seconds";
    }

    private static final String DEFAULT_FUNCTION = "realtime.is_visible_through_rls";

    private static final String ADMITS_SQL = "SELECT s.id FROM unnest(?::uuid[]) AS s(id) WHERE %s(?::regclass, ?::jsonb, s.id)";

    private final DataSource dataSource;
    private final ObjectMapper mapper;
    private final String query;
    private final int queryTimeoutSeconds;

    public JdbcRowSecurityAdmission(DataSource dataSource, String function, int queryTimeoutSeconds) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.mapper = new ObjectMapper();
        this.query = String.format(JdbcRowSecurityAdmission.ADMITS_SQL, SqlIdentifiers.requireQualifiedName(function, Configuration.FUNCTION));
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    @Override
    public Set<UUID> admits(EntityName entity, Map<String, Object> row, Collection<UUID> identities) throws IOException {
        Set<UUID> admitted = new LinkedHashSet<>();

        if (identities.isEmpty()) {
            return admitted;
        }

        String json = this.mapper.writeValueAsString(row);

        try (Connection connection = this.dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(this.query)) {
            Array array = connection.createArrayOf("uuid", identities.toArray(new UUID[0]));

            statement.setArray(1, array);
            statement.setString(2, entity.quoted());
            statement.setString(3, json);

            if (this.queryTimeoutSeconds > 0) {
                statement.setQueryTimeout(this.queryTimeoutSeconds);
            }

            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    admitted.add(UUID.fromString(resultSet.getString(1)));
                }
            } finally {
                array.free();
            }
        } catch (SQLException exception) {
            throw new IOException(String.format("error evaluating row level security on %s: %s", entity, exception.getMessage()), exception);
        }

        return admitted;
    }

    public static JdbcRowSecurityAdmission build(Map<String, Object> configuration, DataSource dataSource) {
        return new JdbcRowSecurityAdmission(
                dataSource,
                configuration.getOrDefault(Configuration.FUNCTION, JdbcRowSecurityAdmission.DEFAULT_FUNCTION).toString(),
                Integer.parseInt(configuration.getOrDefault(Configuration.QUERY_TIMEOUT, "0").toString())
        );
    }
}
