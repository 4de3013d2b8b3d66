package com.booking.realtime.model.event;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class TruncateChangeEvent extends ChangeEvent {

    public TruncateChangeEvent(String schema, String table, OffsetDateTime commitTimestamp, List<ChangeColumn> columns) {
        super(schema, table, commitTimestamp, columns);
    }

    @Override
    public ChangeEventType getType() {
        return ChangeEventType.TRUNCATE;
    }

    @Override
    public Map<String, Object> getTargetRow() {
        return null;
    }

    @Override
    public TruncateChangeEvent restrict(Set<String> columnNames) {
        return new TruncateChangeEvent(this.getSchema(), this.getTable(), this.getCommitTimestamp(), this.restrictColumns(columnNames));
    }
}
