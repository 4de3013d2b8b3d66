package com.booking.realtime.model.event;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class InsertChangeEvent extends ChangeEvent {
    private final Map<String, Object> record;

    public InsertChangeEvent(String schema, String table, OffsetDateTime commitTimestamp, List<ChangeColumn> columns, Map<String, Object> record) {
        super(schema, table, commitTimestamp, columns);
        this.record = ChangeEvent.copyRecord(record, "record");
    }

    @Override
    public ChangeEventType getType() {
        return ChangeEventType.INSERT;
    }

    @Override
    public Map<String, Object> getRecord() {
        return this.record;
    }

    @Override
    public Map<String, Object> getTargetRow() {
        return this.record;
    }

    @Override
    public InsertChangeEvent restrict(Set<String> columnNames) {
        return new InsertChangeEvent(
                this.getSchema(),
                this.getTable(),
                this.getCommitTimestamp(),
                this.restrictColumns(columnNames),
                ChangeEvent.restrictRecord(this.record, columnNames)
        );
    }
}
