package com.booking.realtime.model.visibility;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * A failure that excluded subscribers from one event without failing the event as a whole.
 */
public final class VisibilityError implements Serializable {

    public enum Kind {
        REDACTION,
        VISIBILITY,
        FILTER
    }

    private final Kind kind;
    private final Set<UUID> subscribers;
    private final String message;

    public VisibilityError(Kind kind, Collection<UUID> subscribers, String message) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.subscribers = (subscribers != null) ? Collections.unmodifiableSet(new LinkedHashSet<>(subscribers)) : Collections.emptySet();
        this.message = message;
    }

    public static VisibilityError redaction(String message) {
        return new VisibilityError(Kind.REDACTION, null, message);
    }

    public static VisibilityError visibility(Collection<UUID> subscribers, String message) {
        return new VisibilityError(Kind.VISIBILITY, subscribers, message);
    }

    public static VisibilityError filter(UUID subscriber, String message) {
        return new VisibilityError(Kind.FILTER, Collections.singleton(subscriber), message);
    }

    @JsonProperty("kind")
    public Kind getKind() {
        return this.kind;
    }

    @JsonProperty("subscribers")
    public Set<UUID> getSubscribers() {
        return this.subscribers;
    }

    @JsonProperty("message")
    public String getMessage() {
        return this.message;
    }

    @Override
    public String toString() {
        return String.format("%s: %s (%d subscribers)", this.kind, this.message, this.subscribers.size());
    }
}
