package com.booking.realtime.model.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One decoded row change. Instances are immutable: every transformation returns a new event.
 *
 * The subclasses fix which record snapshots exist for each kind of change: inserts carry the
 * new {@code record}, updates carry {@code record} and the identity columns of the previous row
 * in {@code old_record}, deletes carry only {@code old_record} and truncates carry neither.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "schema", "table", "commit_timestamp", "columns", "record", "old_record"})
public abstract class ChangeEvent implements Serializable {

    private final String schema;
    private final String table;
    private final OffsetDateTime commitTimestamp;
    private final List<ChangeColumn> columns;

    protected ChangeEvent(String schema, String table, OffsetDateTime commitTimestamp, List<ChangeColumn> columns) {
        this.schema = Objects.requireNonNull(schema, "schema");
        this.table = Objects.requireNonNull(table, "table");
        this.commitTimestamp = Objects.requireNonNull(commitTimestamp, "commit timestamp");
        this.columns = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(columns, "columns")));
    }

    @JsonProperty("type")
    public abstract ChangeEventType getType();

    @JsonProperty("schema")
    public String getSchema() {
        return this.schema;
    }

    @JsonProperty("table")
    public String getTable() {
        return this.table;
    }

    @JsonProperty("commit_timestamp")
    public OffsetDateTime getCommitTimestamp() {
        return this.commitTimestamp;
    }

    @JsonProperty("columns")
    public List<ChangeColumn> getColumns() {
        return this.columns;
    }

    @JsonIgnore
    public EntityName getEntity() {
        return new EntityName(this.schema, this.table);
    }

    /**
     * Declared type of a carried column, or {@code null} when the column is not carried.
     */
    public String getColumnType(String name) {
        for (ChangeColumn column : this.columns) {
            if (column.getName().equals(name)) {
                return column.getType();
            }
        }

        return null;
    }

    /**
     * The row that identifies this change for row level security: the new values for inserts
     * and updates, the identity columns for deletes, nothing for truncates.
     */
    @JsonIgnore
    public abstract Map<String, Object> getTargetRow();

    /**
     * Returns a copy carrying only the given columns in {@code columns} and in every record
     * snapshot.
     */
    public abstract ChangeEvent restrict(Set<String> columnNames);

    protected List<ChangeColumn> restrictColumns(Set<String> columnNames) {
        List<ChangeColumn> restricted = new ArrayList<>();

        for (ChangeColumn column : this.columns) {
            if (columnNames.contains(column.getName())) {
                restricted.add(column);
            }
        }

        return restricted;
    }

    protected static Map<String, Object> copyRecord(Map<String, Object> record, String name) {
        Objects.requireNonNull(record, name);

        return Collections.unmodifiableMap(new LinkedHashMap<>(record));
    }

    protected static Map<String, Object> restrictRecord(Map<String, Object> record, Set<String> columnNames) {
        Map<String, Object> restricted = new LinkedHashMap<>();

        for (Map.Entry<String, Object> entry : record.entrySet()) {
            if (columnNames.contains(entry.getKey())) {
                restricted.put(entry.getKey(), entry.getValue());
            }
        }

        return restricted;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }

        if (other == null || this.getClass() != other.getClass()) {
            return false;
        }

        ChangeEvent event = (ChangeEvent) other;

        return this.schema.equals(event.schema)
                && this.table.equals(event.table)
                && this.commitTimestamp.isEqual(event.commitTimestamp)
                && this.columns.equals(event.columns)
                && Objects.equals(this.getRecord(), event.getRecord())
                && Objects.equals(this.getOldRecord(), event.getOldRecord());
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.getType(), this.schema, this.table, this.commitTimestamp.toInstant(), this.columns);
    }

    @JsonProperty("record")
    public Map<String, Object> getRecord() {
        return null;
    }

    @JsonProperty("old_record")
    public Map<String, Object> getOldRecord() {
        return null;
    }

    @Override
    public String toString() {
        return String.format("type: %s | entity: %s | commit_timestamp: %s | columns: %d", this.getType(), this.getEntity(), this.commitTimestamp, this.columns.size());
    }
}
