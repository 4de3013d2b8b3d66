package com.booking.realtime.visibility;

import com.booking.realtime.model.event.ChangeEvent;
import com.booking.realtime.model.security.TableSecurityDescriptor;
import com.booking.realtime.model.visibility.VisibilityError;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Removes every column the consuming role may not read from an event's column list and record
 * snapshots. Missing or mismatching grant metadata counts as no grant at all.
 */
public class ColumnRedactor {
    private static final Logger LOG = LogManager.getLogger(ColumnRedactor.class);

    private final String role;

    public ColumnRedactor(String role) {
        this.role = Objects.requireNonNull(role, "role");
    }

    public String getRole() {
        return this.role;
    }

    public ChangeEvent redact(ChangeEvent event, TableSecurityDescriptor descriptor, List<VisibilityError> errors) {
        String problem = null;

        if (descriptor == null) {
            problem = String.format("no grant metadata for %s", event.getEntity());
        } else if (!this.role.equals(descriptor.getRole())) {
            problem = String.format("grant metadata for %s describes role %s instead of %s", event.getEntity(), descriptor.getRole(), this.role);
        } else if (!descriptor.getEntity().equals(event.getEntity())) {
            problem = String.format("grant metadata describes %s instead of %s", descriptor.getEntity(), event.getEntity());
        } else if (descriptor.getReadableColumns() == null) {
            problem = String.format("no column grants known for %s", event.getEntity());
        }

        if (problem != null) {
            ColumnRedactor.LOG.warn(String.format("%s, redacting every column", problem));
            errors.add(VisibilityError.redaction(problem));

            return this.redact(event, Collections.emptySet());
        }

        return this.redact(event, descriptor.getReadableColumns());
    }

    public ChangeEvent redact(ChangeEvent event, Set<String> grantedColumns) {
        return event.restrict(grantedColumns);
    }
}
