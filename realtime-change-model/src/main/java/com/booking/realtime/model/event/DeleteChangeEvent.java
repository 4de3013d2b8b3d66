package com.booking.realtime.model.event;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class DeleteChangeEvent extends ChangeEvent {
    private final Map<String, Object> oldRecord;

    public DeleteChangeEvent(String schema, String table, OffsetDateTime commitTimestamp, List<ChangeColumn> columns, Map<String, Object> oldRecord) {
        super(schema, table, commitTimestamp, columns);
        this.oldRecord = ChangeEvent.copyRecord(oldRecord, "old_record");
    }

    @Override
    public ChangeEventType getType() {
        return ChangeEventType.DELETE;
    }

    @Override
    public Map<String, Object> getOldRecord() {
        return this.oldRecord;
    }

    // identity columns only
    @Override
    public Map<String, Object> getTargetRow() {
        return this.oldRecord;
    }

    @Override
    public DeleteChangeEvent restrict(Set<String> columnNames) {
        return new DeleteChangeEvent(
                this.getSchema(),
                this.getTable(),
                this.getCommitTimestamp(),
                this.restrictColumns(columnNames),
                ChangeEvent.restrictRecord(this.oldRecord, columnNames)
        );
    }
}
