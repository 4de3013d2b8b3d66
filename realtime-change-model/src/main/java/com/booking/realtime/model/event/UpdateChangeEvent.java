package com.booking.realtime.model.event;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An update. {@code old_record} holds the replica identity of the previous row version only,
 * so it differs from {@code record} on identity columns when the update changed them.
 */
public final class UpdateChangeEvent extends ChangeEvent {
    private final Map<String, Object> record;
    private final Map<String, Object> oldRecord;

    public UpdateChangeEvent(String schema, String table, OffsetDateTime commitTimestamp, List<ChangeColumn> columns, Map<String, Object> record, Map<String, Object> oldRecord) {
        super(schema, table, commitTimestamp, columns);
        this.record = ChangeEvent.copyRecord(record, "record");
        this.oldRecord = ChangeEvent.copyRecord(oldRecord, "old_record");
    }

    @Override
    public ChangeEventType getType() {
        return ChangeEventType.UPDATE;
    }

    @Override
    public Map<String, Object> getRecord() {
        return this.record;
    }

    @Override
    public Map<String, Object> getOldRecord() {
        return this.oldRecord;
    }

    @Override
    public Map<String, Object> getTargetRow() {
        return this.record;
    }

    @Override
    public UpdateChangeEvent restrict(Set<String> columnNames) {
        return new UpdateChangeEvent(
                this.getSchema(),
                this.getTable(),
                this.getCommitTimestamp(),
                this.restrictColumns(columnNames),
                ChangeEvent.restrictRecord(this.record, columnNames),
                ChangeEvent.restrictRecord(this.oldRecord, columnNames)
        );
    }
}
