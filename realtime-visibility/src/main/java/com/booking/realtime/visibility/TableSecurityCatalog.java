package com.booking.realtime.visibility;

import com.booking.realtime.model.event.EntityName;
import com.booking.realtime.model.security.TableSecurityDescriptor;

import java.io.Closeable;
import java.io.IOException;

public interface TableSecurityCatalog extends Closeable {

    /**
     * Describes row level security and column grants of {@code entity} for {@code role}.
     *
     * @return the descriptor, or {@code null} when the entity is unknown to the catalog
     */
    TableSecurityDescriptor describe(EntityName entity, String role) throws IOException;

    @Override
    default void close() throws IOException {
    }
}
