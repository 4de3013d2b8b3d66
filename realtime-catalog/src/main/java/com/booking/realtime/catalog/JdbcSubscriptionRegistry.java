package com.booking.realtime.catalog;

import com.booking.realtime.model.event.EntityName;
import com.booking.realtime.model.subscription.FilterOperator;
import com.booking.realtime.model.subscription.Subscription;
import com.booking.realtime.model.subscription.UserDefinedFilter;
import com.booking.realtime.visibility.SubscriptionRegistry;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sql.DataSource;
import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Reads the subscriptions of one entity, filters included, with a single query.
 */
public class JdbcSubscriptionRegistry implements SubscriptionRegistry {
    private static final Logger LOG = LogManager.getLogger(JdbcSubscriptionRegistry.class);

    public interface Configuration {
        String TABLE = "registry.subscription.table";
    }

    private static final String DEFAULT_TABLE = "realtime.subscription";

    private static final String LIST_SUBSCRIPTIONS_SQL = "SELECT s.id, s.user_id, f.column_name, f.op::text AS op, f.value "
            + "FROM %s s "
            + "LEFT JOIN LATERAL unnest(s.filters) WITH ORDINALITY AS f(column_name, op, value, position) ON true "
            + "WHERE s.entity = ?::regclass "
            + "ORDER BY s.id, f.position";

    private final DataSource dataSource;
    private final String query;

    public JdbcSubscriptionRegistry(DataSource dataSource, String table) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.query = String.format(
                JdbcSubscriptionRegistry.LIST_SUBSCRIPTIONS_SQL,
                SqlIdentifiers.requireQualifiedName(table, Configuration.TABLE)
        );
    }

    @Override
    public List<Subscription> listSubscriptions(EntityName entity) throws IOException {
        Map<Long, UUID> subscribers = new LinkedHashMap<>();
        Map<Long, List<UserDefinedFilter>> filters = new LinkedHashMap<>();
        Set<Long> broken = new HashSet<>();

        try (Connection connection = this.dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(this.query)) {
            statement.setString(1, entity.quoted());

            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    long id = resultSet.getLong("id");

                    subscribers.putIfAbsent(id, UUID.fromString(resultSet.getString("user_id")));
                    filters.putIfAbsent(id, new ArrayList<>());

                    String column = resultSet.getString("column_name");

                    if (column == null) {
                        continue;
                    }

                    String op = resultSet.getString("op");

                    try {
                        filters.get(id).add(new UserDefinedFilter(column, FilterOperator.fromCode(op), resultSet.getString("value")));
                    } catch (IllegalArgumentException exception) {
                        // a subscription is never widened by dropping one of its filters
                        JdbcSubscriptionRegistry.LOG.error(String.format("ignoring subscription %d on %s: unknown filter operator %s", id, entity, op));
                        broken.add(id);
                    }
                }
            }
        } catch (SQLException exception) {
            throw new IOException(String.format("error listing subscriptions of %s: %s", entity, exception.getMessage()), exception);
        }

        List<Subscription> subscriptions = new ArrayList<>(subscribers.size());

        for (Map.Entry<Long, UUID> entry : subscribers.entrySet()) {
            if (!broken.contains(entry.getKey())) {
                subscriptions.add(new Subscription(entry.getKey(), entry.getValue(), entity, filters.get(entry.getKey())));
            }
        }

        return subscriptions;
    }

    public static JdbcSubscriptionRegistry build(Map<String, Object> configuration, DataSource dataSource) {
        return new JdbcSubscriptionRegistry(
                dataSource,
                configuration.getOrDefault(Configuration.TABLE, JdbcSubscriptionRegistry.DEFAULT_TABLE).toString()
        );
    }
}
