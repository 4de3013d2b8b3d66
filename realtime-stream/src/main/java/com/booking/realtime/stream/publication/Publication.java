package com.booking.realtime.stream.publication;

import com.booking.realtime.model.event.ChangeEventType;
import com.booking.realtime.model.event.EntityName;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The set of tables and change kinds the service captures.
 */
public final class Publication {

    public interface Configuration {
        String NAME = "publication.name";
        String ALL_TABLES = "publication.all_tables";
        String ACTIONS = "publication.actions";
        String TABLES = "publication.tables";
    }

    public static final String DEFAULT_NAME = "supabase_realtime";

    private final String name;
    private final boolean allTables;
    private final Set<ChangeEventType> actions;
    private final Set<EntityName> tables;

    public Publication(String name, boolean allTables, Collection<ChangeEventType> actions, Collection<EntityName> tables) {
        this.name = Objects.requireNonNull(name, "name");
        this.allTables = allTables;
        this.actions = actions.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(ChangeEventType.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(actions));
        this.tables = Collections.unmodifiableSet(new LinkedHashSet<>(tables));
    }

    /**
     * A publication that does not exist: it captures nothing.
     */
    public static Publication empty(String name) {
        return new Publication(name, false, Collections.emptySet(), Collections.emptySet());
    }

    public String getName() {
        return this.name;
    }

    public boolean isAllTables() {
        return this.allTables;
    }

    public Set<ChangeEventType> getActions() {
        return this.actions;
    }

    public Set<EntityName> getTables() {
        return this.tables;
    }

    public boolean capturesAnything() {
        return !this.actions.isEmpty() && (this.allTables || !this.tables.isEmpty());
    }

    public boolean captures(EntityName entity, ChangeEventType type) {
        return this.actions.contains(type) && (this.allTables || this.tables.contains(entity));
    }

    /**
     * The {@code actions} option of wal2json, e.g. {@code insert,update}.
     */
    public String toWal2JsonActions() {
        List<String> actions = new ArrayList<>();

        for (ChangeEventType type : this.actions) {
            actions.add(type.name().toLowerCase(Locale.ROOT));
        }

        return String.join(",", actions);
    }

    /**
     * The {@code add-tables} option of wal2json, or {@code null} when every table is published.
     */
    public String toWal2JsonTables() {
        if (this.allTables) {
            return null;
        }

        List<String> tables = new ArrayList<>();

        for (EntityName table : this.tables) {
            tables.add(String.format("%s.%s", Publication.escapeWal2Json(table.getSchema()), Publication.escapeWal2Json(table.getTable())));
        }

        return String.join(",", tables);
    }

    private static String escapeWal2Json(String identifier) {
        StringBuilder escaped = new StringBuilder();

        for (char character : identifier.toCharArray()) {
            if (character == '\\' || character == ',' || character == '.' || character == '*' || Character.isWhitespace(character)) {
                escaped.append('\\');
            }

            escaped.append(character);
        }

        return escaped.toString();
    }

    public static Publication fromConfiguration(Map<String, Object> configuration) {
        String name = configuration.getOrDefault(Configuration.NAME, Publication.DEFAULT_NAME).toString();
        boolean allTables = Boolean.parseBoolean(configuration.getOrDefault(Configuration.ALL_TABLES, "false").toString());
        Set<ChangeEventType> actions = EnumSet.noneOf(ChangeEventType.class);
        Set<EntityName> tables = new LinkedHashSet<>();

        for (String action : Publication.split(configuration.getOrDefault(Configuration.ACTIONS, "insert,update,delete,truncate"))) {
            ChangeEventType type = ChangeEventType.fromName(action.toUpperCase(Locale.ROOT));

            if (type == null) {
                throw new IllegalArgumentException(String.format("Configuration %s has an unknown action: %s", Configuration.ACTIONS, action));
            }

            actions.add(type);
        }

        for (String table : Publication.split(configuration.getOrDefault(Configuration.TABLES, ""))) {
            tables.add(EntityName.parse(table));
        }

        return new Publication(name, allTables, actions, tables);
    }

    @SuppressWarnings("unchecked")
    private static List<String> split(Object value) {
        List<String> parts = new ArrayList<>();

        if (value instanceof Collection) {
            for (Object part : (Collection<Object>) value) {
                parts.add(part.toString().trim());
            }
        } else {
            for (String part : value.toString().split(",")) {
                if (!part.trim().isEmpty()) {
                    parts.add(part.trim());
                }
            }
        }

        return parts;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }

        if (other == null || this.getClass() != other.getClass()) {
            return false;
        }

        Publication publication = (Publication) other;

        return this.name.equals(publication.name)
                && this.allTables == publication.allTables
                && this.actions.equals(publication.actions)
                && this.tables.equals(publication.tables);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.name, this.allTables, this.actions, this.tables);
    }

    @Override
    public String toString() {
        return String.format("%s(all_tables=%s, actions=%s, tables=%s)", this.name, this.allTables, this.actions, this.tables);
    }
}
