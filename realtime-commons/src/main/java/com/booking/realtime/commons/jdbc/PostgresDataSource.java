package com.booking.realtime.commons.jdbc;

import org.apache.commons.dbcp2.BasicDataSource;
import org.postgresql.Driver;

import java.util.Map;
import java.util.Objects;

/**
 * Pooled connections to the PostgreSQL database that owns the replication slot, the
 * subscription table and the row level security policies.
 */
public final class PostgresDataSource {

    public interface Configuration {
        String DRIVER_CLASS = "postgres.driver.class";
        String HOSTNAME = "postgres.hostname";
        String PORT = "postgres.port";
        String DATABASE = "postgres.database";
        String USERNAME = "postgres.username";
        String PASSWORD = "postgres.password";
        String POOL_SIZE = "postgres.pool.size";
    }

    private static final String DEFAULT_DRIVER_CLASS = Driver.class.getName();
    private static final String CONNECTION_URL_FORMAT = "jdbc:postgresql://%s:%d/%s";

    private PostgresDataSource() {
    }

    public static BasicDataSource build(Map<String, Object> configuration) {
        Object driverClass = configuration.getOrDefault(Configuration.DRIVER_CLASS, PostgresDataSource.DEFAULT_DRIVER_CLASS);
        Object hostname = configuration.get(Configuration.HOSTNAME);
        Object port = configuration.getOrDefault(Configuration.PORT, "5432");
        Object database = configuration.get(Configuration.DATABASE);
        Object username = configuration.get(Configuration.USERNAME);
        Object password = configuration.get(Configuration.PASSWORD);
        Object poolSize = configuration.getOrDefault(Configuration.POOL_SIZE, "8");

        Objects.requireNonNull(hostname, String.format("Configuration required: %s", Configuration.HOSTNAME));
        Objects.requireNonNull(database, String.format("Configuration required: %s", Configuration.DATABASE));
        Objects.requireNonNull(username, String.format("Configuration required: %s", Configuration.USERNAME));
        Objects.requireNonNull(password, String.format("Configuration required: %s", Configuration.PASSWORD));

        BasicDataSource dataSource = new BasicDataSource();

        dataSource.setDriverClassName(driverClass.toString());
        dataSource.setUrl(String.format(PostgresDataSource.CONNECTION_URL_FORMAT, hostname, Integer.parseInt(port.toString()), database));
        dataSource.setUsername(username.toString());
        dataSource.setPassword(password.toString());
        dataSource.setMaxTotal(Integer.parseInt(poolSize.toString()));
        dataSource.setTestOnBorrow(true);

        return dataSource;
    }
}
