package com.booking.realtime.model.visibility;

import com.booking.realtime.model.event.ChangeEvent;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Outcome of evaluating one change: the redacted event, whether row level security applied,
 * the subscribers allowed to receive it and the per-subscriber failures met on the way.
 */
@JsonPropertyOrder({"wal", "is_rls_enabled", "subscribers", "errors"})
public final class VisibilityResult implements Serializable {
    private final ChangeEvent event;
    private final boolean rlsEnabled;
    private final Set<UUID> visibleSubscribers;
    private final List<VisibilityError> errors;

    public VisibilityResult(ChangeEvent event, boolean rlsEnabled, Set<UUID> visibleSubscribers, List<VisibilityError> errors) {
        this.event = Objects.requireNonNull(event, "event");
        this.rlsEnabled = rlsEnabled;
        this.visibleSubscribers = Collections.unmodifiableSet(new LinkedHashSet<>(visibleSubscribers));
        this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
    }

    @JsonProperty("wal")
    public ChangeEvent getEvent() {
        return this.event;
    }

    @JsonProperty("is_rls_enabled")
    public boolean isRlsEnabled() {
        return this.rlsEnabled;
    }

    @JsonProperty("subscribers")
    public Set<UUID> getVisibleSubscribers() {
        return this.visibleSubscribers;
    }

    @JsonProperty("errors")
    public List<VisibilityError> getErrors() {
        return this.errors;
    }

    public boolean hasErrors() {
        return !this.errors.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("event: [%s] | rls: %s | subscribers: %d | errors: %d", this.event, this.rlsEnabled, this.visibleSubscribers.size(), this.errors.size());
    }
}
