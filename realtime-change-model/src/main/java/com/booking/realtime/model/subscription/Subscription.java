package com.booking.realtime.model.subscription;

import com.booking.realtime.model.event.EntityName;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

public final class Subscription implements Serializable {
    private final long id;
    private final UUID userId;
    private final EntityName entity;
    private final List<UserDefinedFilter> filters;

    public Subscription(long id, UUID userId, EntityName entity, List<UserDefinedFilter> filters) {
        this.id = id;
        this.userId = Objects.requireNonNull(userId, "user id");
        this.entity = Objects.requireNonNull(entity, "entity");
        this.filters = (filters != null) ? Collections.unmodifiableList(new ArrayList<>(filters)) : Collections.emptyList();
    }

    public Subscription(long id, UUID userId, EntityName entity) {
        this(id, userId, entity, null);
    }

    public long getId() {
        return this.id;
    }

    public UUID getUserId() {
        return this.userId;
    }

    public EntityName getEntity() {
        return this.entity;
    }

    public List<UserDefinedFilter> getFilters() {
        return this.filters;
    }

    public boolean hasFilters() {
        return !this.filters.isEmpty();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }

        if (!(other instanceof Subscription)) {
            return false;
        }

        Subscription subscription = (Subscription) other;

        return this.id == subscription.id
                && this.userId.equals(subscription.userId)
                && this.entity.equals(subscription.entity)
                && this.filters.equals(subscription.filters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.id, this.userId, this.entity, this.filters);
    }

    @Override
    public String toString() {
        return String.format("id: %d | user: %s | entity: %s | filters: %s", this.id, this.userId, this.entity, this.filters);
    }
}
