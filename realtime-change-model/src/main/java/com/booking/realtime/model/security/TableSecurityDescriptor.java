package com.booking.realtime.model.security;

import com.booking.realtime.model.event.EntityName;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * What the consuming role may see of one table: whether row level security is enforced and
 * which columns the role holds SELECT on. A {@code null} column set means the grants could
 * not be determined.
 */
public final class TableSecurityDescriptor implements Serializable {
    private final EntityName entity;
    private final boolean rlsEnabled;
    private final String role;
    private final Set<String> readableColumns;

    public TableSecurityDescriptor(EntityName entity, boolean rlsEnabled, String role, Set<String> readableColumns) {
        this.entity = Objects.requireNonNull(entity, "entity");
        this.rlsEnabled = rlsEnabled;
        this.role = Objects.requireNonNull(role, "role");
        this.readableColumns = (readableColumns != null) ? Collections.unmodifiableSet(new LinkedHashSet<>(readableColumns)) : null;
    }

    public EntityName getEntity() {
        return this.entity;
    }

    public boolean isRlsEnabled() {
        return this.rlsEnabled;
    }

    public String getRole() {
        return this.role;
    }

    public Set<String> getReadableColumns() {
        return this.readableColumns;
    }

    @Override
    public String toString() {
        return String.format("entity: %s | rls: %s | role: %s | columns: %s", this.entity, this.rlsEnabled, this.role, this.readableColumns);
    }
}
