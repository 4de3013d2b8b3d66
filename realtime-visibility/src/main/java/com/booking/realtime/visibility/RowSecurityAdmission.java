package com.booking.realtime.visibility;

import com.booking.realtime.model.event.EntityName;

import java.io.Closeable;
import java.io.IOException;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Host provided row level security check: would a query issued as a given identity against
 * {@code entity} return {@code row}? Implementations answer for a whole batch of identities
 * in one operation; they never open a session per identity.
 */
public interface RowSecurityAdmission extends Closeable {

    /**
     * @return the identities, among {@code identities}, whose policies admit the row
     */
    Set<UUID> admits(EntityName entity, Map<String, Object> row, Collection<UUID> identities) throws IOException;

    default boolean admits(EntityName entity, Map<String, Object> row, UUID identity) throws IOException {
        return this.admits(entity, row, Collections.singleton(identity)).contains(identity);
    }

    @Override
    default void close() throws IOException {
    }
}
