package com.booking.realtime.model.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.io.Serializable;
import java.util.Objects;

/**
 * Schema qualified relation name. Unqualified names resolve to {@code public}.
 */
public final class EntityName implements Serializable {
    public static final String DEFAULT_SCHEMA = "public";

    private final String schema;
    private final String table;

    public EntityName(String schema, String table) {
        this.schema = Objects.requireNonNull(schema, "schema");
        this.table = Objects.requireNonNull(table, "table");
    }

    @JsonCreator
    public static EntityName parse(String qualifiedName) {
        Objects.requireNonNull(qualifiedName, "qualified name");

        String name = qualifiedName.replace("\"", "").trim();
        int dot = name.indexOf('.');

        if (dot < 0) {
            return new EntityName(EntityName.DEFAULT_SCHEMA, name);
        }

        if (dot == 0 || dot == name.length() - 1 || name.indexOf('.', dot + 1) >= 0) {
            throw new IllegalArgumentException(String.format("invalid entity name: %s", qualifiedName));
        }

        return new EntityName(name.substring(0, dot), name.substring(dot + 1));
    }

    public String getSchema() {
        return this.schema;
    }

    public String getTable() {
        return this.table;
    }

    /**
     * Identifier quoted form, safe to embed in SQL ({@code "public"."note"}).
     */
    public String quoted() {
        return String.format("%s.%s", EntityName.quote(this.schema), EntityName.quote(this.table));
    }

    private static String quote(String identifier) {
        return '"' + identifier.replace("\"", "\"\"") + '"';
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }

        if (!(other instanceof EntityName)) {
            return false;
        }

        EntityName entity = (EntityName) other;

        return this.schema.equals(entity.schema) && this.table.equals(entity.table);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.schema, this.table);
    }

    @JsonValue
    @Override
    public String toString() {
        return String.format("%s.%s", this.schema, this.table);
    }
}
