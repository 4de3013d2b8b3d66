package com.booking.realtime.stream.publication;

import com.booking.realtime.model.event.ChangeEventType;
import com.booking.realtime.model.event.EntityName;
import com.booking.realtime.stream.PendingChange;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Drops changes of tables or kinds the publication does not capture, before decoding.
 * Payloads it cannot read are kept so that the decoder reports them.
 */
public class PublicationFilter implements Predicate<PendingChange> {
    private static final Logger LOG = LogManager.getLogger(PublicationFilter.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Publication publication;

    public PublicationFilter(Publication publication) {
        this.publication = Objects.requireNonNull(publication, "publication");
    }

    public Publication getPublication() {
        return this.publication;
    }

    @Override
    public boolean test(PendingChange change) {
        JsonNode payload;

        try {
            payload = PublicationFilter.MAPPER.readTree(change.getData());
        } catch (IOException exception) {
            return true;
        }

        if (payload == null || !payload.isObject()) {
            return true;
        }

        JsonNode type = payload.get("type");
        JsonNode schema = payload.get("schema");
        JsonNode table = payload.get("table");

        if (type == null || schema == null || table == null || !type.isTextual() || !schema.isTextual() || !table.isTextual()) {
            return true;
        }

        ChangeEventType kind = ChangeEventType.fromName(type.asText());

        if (kind == null) {
            return true;
        }

        boolean captured = this.publication.captures(new EntityName(schema.asText(), table.asText()), kind);

        if (!captured) {
            PublicationFilter.LOG.trace(String.format("%s on %s.%s is not in publication %s", kind, schema.asText(), table.asText(), this.publication.getName()));
        }

        return captured;
    }
}
