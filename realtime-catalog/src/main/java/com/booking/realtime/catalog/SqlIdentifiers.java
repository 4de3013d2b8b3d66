package com.booking.realtime.catalog;

import java.util.regex.Pattern;

final class SqlIdentifiers {
    private static final Pattern QUALIFIED_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_$]*(\\.[A-Za-z_][A-Za-z0-9_$]*)?");

    private SqlIdentifiers() {
    }

    /**
     * Checks a configured, optionally schema qualified, name before it is embedded in SQL.
     */
    static String requireQualifiedName(String name, String configurationKey) {
        if (name == null || !SqlIdentifiers.QUALIFIED_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException(String.format("Configuration %s is not a valid qualified name: %s", configurationKey, name));
        }

        return name;
    }
}
