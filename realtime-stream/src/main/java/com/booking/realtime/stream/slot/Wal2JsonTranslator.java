package com.booking.realtime.stream.slot;

import com.booking.realtime.model.event.ChangeEventType;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Rewrites wal2json format-version 2 messages into the canonical change payload.
 * <p>
 * Anything that is not a recognisable wal2json row message is passed through untouched, so
 * that the decoder rejects it with a precise reason.
 */
public class Wal2JsonTranslator {

    public interface Fields {
        String ACTION = "action";
        String TIMESTAMP = "timestamp";
        String SCHEMA = "schema";
        String TABLE = "table";
        String COLUMNS = "columns";
        String IDENTITY = "identity";
        String NAME = "name";
        String TYPE = "type";
        String VALUE = "value";
    }

    private static final String BEGIN = "B";
    private static final String COMMIT = "C";

    private final ObjectMapper mapper;

    public Wal2JsonTranslator() {
        this(new ObjectMapper());
    }

    public Wal2JsonTranslator(ObjectMapper mapper) {
        this.mapper = mapper.copy()
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .configure(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES, false);
    }

    public boolean isTransactionBoundary(String data) {
        String action = this.readAction(data);

        return Wal2JsonTranslator.BEGIN.equals(action) || Wal2JsonTranslator.COMMIT.equals(action);
    }

    public boolean isCommit(String data) {
        return Wal2JsonTranslator.COMMIT.equals(this.readAction(data));
    }

    private String readAction(String data) {
        JsonNode message = this.readMessage(data);

        if (message == null || !message.path(Fields.ACTION).isTextual()) {
            return null;
        }

        return message.get(Fields.ACTION).asText();
    }

    private JsonNode readMessage(String data) {
        try {
            JsonNode message = this.mapper.readTree(data);

            return (message != null && message.isObject()) ? message : null;
        } catch (IOException exception) {
            return null;
        }
    }

    public String translate(String data) {
        JsonNode message = this.readMessage(data);

        if (message == null || !message.path(Fields.ACTION).isTextual()) {
            return data;
        }

        ChangeEventType type = ChangeEventType.fromAction(message.get(Fields.ACTION).asText());

        if (type == null) {
            return data;
        }

        ObjectNode payload = JsonNodeFactory.instance.objectNode();

        payload.put("type", type.name());
        Wal2JsonTranslator.setIfPresent(payload, "schema", message.get(Fields.SCHEMA));
        Wal2JsonTranslator.setIfPresent(payload, "table", message.get(Fields.TABLE));
        Wal2JsonTranslator.setIfPresent(payload, "commit_timestamp", message.get(Fields.TIMESTAMP));

        // deletes only carry the replica identity
        JsonNode described = (type == ChangeEventType.DELETE) ? message.get(Fields.IDENTITY) : message.get(Fields.COLUMNS);

        if (type == ChangeEventType.TRUNCATE) {
            payload.set("columns", JsonNodeFactory.instance.arrayNode());
        } else {
            Wal2JsonTranslator.setIfPresent(payload, "columns", this.columns(described));
        }

        if (type.carriesRecord()) {
            payload.set("record", this.record(message.get(Fields.COLUMNS)));
        }

        if (type.carriesOldRecord()) {
            payload.set("old_record", this.record(message.get(Fields.IDENTITY)));
        }

        try {
            return this.mapper.writeValueAsString(payload);
        } catch (IOException exception) {
            throw new UncheckedIOException(exception);
        }
    }

    private static void setIfPresent(ObjectNode payload, String field, JsonNode value) {
        if (value != null) {
            payload.set(field, value);
        }
    }

    private JsonNode columns(JsonNode entries) {
        if (entries == null) {
            return null;
        }

        if (!entries.isArray()) {
            return entries;
        }

        ArrayNode columns = JsonNodeFactory.instance.arrayNode();

        for (JsonNode entry : entries) {
            ObjectNode column = columns.addObject();

            column.set(Fields.NAME, entry.get(Fields.NAME));
            column.set(Fields.TYPE, entry.get(Fields.TYPE));
        }

        return columns;
    }

    private JsonNode record(JsonNode entries) {
        if (entries == null) {
            // unchanged replica identity is not repeated by wal2json
            return JsonNodeFactory.instance.objectNode();
        }

        if (!entries.isArray()) {
            return entries;
        }

        ObjectNode record = JsonNodeFactory.instance.objectNode();

        for (JsonNode entry : entries) {
            JsonNode name = entry.get(Fields.NAME);

            if (name != null && name.isTextual()) {
                record.set(name.asText(), entry.has(Fields.VALUE) ? entry.get(Fields.VALUE) : JsonNodeFactory.instance.nullNode());
            }
        }

        return record;
    }
}
