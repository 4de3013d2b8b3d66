package com.booking.realtime.visibility;

import com.booking.realtime.model.event.EntityName;
import com.booking.realtime.model.subscription.Subscription;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * Read-only view of who subscribed to which entity, and with which filters.
 */
public interface SubscriptionRegistry extends Closeable {

    List<Subscription> listSubscriptions(EntityName entity) throws IOException;

    @Override
    default void close() throws IOException {
    }
}
