package com.booking.realtime.decoder;

import com.booking.realtime.model.event.ChangeColumn;
import com.booking.realtime.model.event.ChangeEvent;
import com.booking.realtime.model.event.ChangeEventType;
import com.booking.realtime.model.event.DeleteChangeEvent;
import com.booking.realtime.model.event.InsertChangeEvent;
import com.booking.realtime.model.event.TruncateChangeEvent;
import com.booking.realtime.model.event.UpdateChangeEvent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decodes canonical change payloads into {@link ChangeEvent}s.
 *
 * Decoding is strict: every kind has an explicit list of fields, all of which are required,
 * and anything outside that list is rejected instead of ignored. Declared column types are
 * never interpreted here.
 */
public class ChangeDecoder {
    private static final Logger LOG = LogManager.getLogger(ChangeDecoder.class);

    public interface Fields {
        String TYPE = "type";
        String SCHEMA = "schema";
        String TABLE = "table";
        String COMMIT_TIMESTAMP = "commit_timestamp";
        String COLUMNS = "columns";
        String RECORD = "record";
        String OLD_RECORD = "old_record";
        String COLUMN_NAME = "name";
        String COLUMN_TYPE = "type";
    }

    private static final List<String> COMMON_FIELDS = Arrays.asList(
            Fields.TYPE, Fields.SCHEMA, Fields.TABLE, Fields.COMMIT_TIMESTAMP, Fields.COLUMNS
    );

    private static final Set<String> COLUMN_FIELDS = new LinkedHashSet<>(Arrays.asList(Fields.COLUMN_NAME, Fields.COLUMN_TYPE));

    private static final Map<ChangeEventType, Set<String>> FIELDS_BY_TYPE = new EnumMap<>(ChangeEventType.class);

    static {
        FIELDS_BY_TYPE.put(ChangeEventType.INSERT, ChangeDecoder.fields(Fields.RECORD));
        FIELDS_BY_TYPE.put(ChangeEventType.UPDATE, ChangeDecoder.fields(Fields.RECORD, Fields.OLD_RECORD));
        FIELDS_BY_TYPE.put(ChangeEventType.DELETE, ChangeDecoder.fields(Fields.OLD_RECORD));
        FIELDS_BY_TYPE.put(ChangeEventType.TRUNCATE, ChangeDecoder.fields());
    }

    // ISO-8601 as well as the PostgreSQL text form "2021-09-01 12:00:00.123456+00"
    private static final DateTimeFormatter COMMIT_TIMESTAMP_FORMAT = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .appendOffset("+HH:mm", "Z")
            .toFormatter();

    private final ObjectMapper mapper;

    public ChangeDecoder() {
        this(new ObjectMapper());
    }

    /**
     * Record values keep the exact digits of the payload: fractional numbers decode to
     * {@link java.math.BigDecimal} with their scale intact.
     */
    public ChangeDecoder(ObjectMapper mapper) {
        this.mapper = mapper.copy()
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .configure(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES, false);
    }

    private static Set<String> fields(String... specific) {
        Set<String> fields = new LinkedHashSet<>(ChangeDecoder.COMMON_FIELDS);
        fields.addAll(Arrays.asList(specific));
        return Collections.unmodifiableSet(fields);
    }

    /**
     * Fields a payload of the given kind must carry, and may carry.
     */
    public static Set<String> fieldsOf(ChangeEventType type) {
        return ChangeDecoder.FIELDS_BY_TYPE.get(type);
    }

    public ChangeEvent decode(byte[] payload) throws DecodeException {
        try {
            return this.decode(this.mapper.readTree(payload));
        } catch (IOException exception) {
            throw new DecodeException(DecodeException.Reason.MALFORMED_PAYLOAD, null, "payload is not valid JSON", exception);
        }
    }

    public ChangeEvent decode(String payload) throws DecodeException {
        if (payload == null) {
            throw new DecodeException(DecodeException.Reason.MALFORMED_PAYLOAD, null, "payload is null");
        }

        return this.decode(payload.getBytes(StandardCharsets.UTF_8));
    }

    public ChangeEvent decode(JsonNode payload) throws DecodeException {
        if (payload == null || !payload.isObject()) {
            throw new DecodeException(DecodeException.Reason.MALFORMED_PAYLOAD, null, "payload is not a JSON object");
        }

        ChangeEventType type = this.decodeType(payload);
        Set<String> allowed = ChangeDecoder.FIELDS_BY_TYPE.get(type);

        Iterator<String> names = payload.fieldNames();

        while (names.hasNext()) {
            String name = names.next();

            if (!allowed.contains(name)) {
                throw new DecodeException(
                        DecodeException.Reason.UNEXPECTED_FIELD,
                        name,
                        String.format("field \"%s\" is not allowed in a %s change", name, type.name())
                );
            }
        }

        for (String name : allowed) {
            if (!payload.has(name)) {
                throw new DecodeException(
                        DecodeException.Reason.MISSING_FIELD,
                        name,
                        String.format("field \"%s\" is required in a %s change", name, type.name())
                );
            }
        }

        String schema = ChangeDecoder.text(payload, Fields.SCHEMA);
        String table = ChangeDecoder.text(payload, Fields.TABLE);
        OffsetDateTime commitTimestamp = ChangeDecoder.timestamp(payload, Fields.COMMIT_TIMESTAMP);
        List<ChangeColumn> columns = ChangeDecoder.columns(payload.get(Fields.COLUMNS));

        ChangeEvent event;

        switch (type) {
            case INSERT:
                event = new InsertChangeEvent(schema, table, commitTimestamp, columns, this.record(payload, Fields.RECORD));
                break;
            case UPDATE:
                event = new UpdateChangeEvent(schema, table, commitTimestamp, columns, this.record(payload, Fields.RECORD), this.record(payload, Fields.OLD_RECORD));
                break;
            case DELETE:
                event = new DeleteChangeEvent(schema, table, commitTimestamp, columns, this.record(payload, Fields.OLD_RECORD));
                break;
            case TRUNCATE:
                event = new TruncateChangeEvent(schema, table, commitTimestamp, columns);
                break;
            default:
                throw new DecodeException(DecodeException.Reason.UNKNOWN_KIND, Fields.TYPE, String.format("unsupported change kind %s", type));
        }

        if (ChangeDecoder.LOG.isTraceEnabled()) {
            ChangeDecoder.LOG.trace(String.format("decoded %s", event));
        }

        return event;
    }

    private ChangeEventType decodeType(JsonNode payload) throws DecodeException {
        JsonNode node = payload.get(Fields.TYPE);

        if (node == null) {
            throw new DecodeException(DecodeException.Reason.MISSING_FIELD, Fields.TYPE, "field \"type\" is required");
        }

        if (!node.isTextual()) {
            throw new DecodeException(DecodeException.Reason.MALFORMED_FIELD, Fields.TYPE, "field \"type\" must be a string");
        }

        ChangeEventType type = ChangeEventType.fromName(node.asText());

        if (type == null) {
            throw new DecodeException(
                    DecodeException.Reason.UNKNOWN_KIND,
                    Fields.TYPE,
                    String.format("unknown change kind \"%s\"", node.asText())
            );
        }

        return type;
    }

    private static String text(JsonNode parent, String field) throws DecodeException {
        JsonNode node = parent.get(field);

        if (node == null || !node.isTextual()) {
            throw new DecodeException(DecodeException.Reason.MALFORMED_FIELD, field, String.format("field \"%s\" must be a string", field));
        }

        return node.asText();
    }

    private static OffsetDateTime timestamp(JsonNode parent, String field) throws DecodeException {
        String text = ChangeDecoder.text(parent, field);

        try {
            return OffsetDateTime.parse(text, ChangeDecoder.COMMIT_TIMESTAMP_FORMAT);
        } catch (DateTimeParseException exception) {
            throw new DecodeException(
                    DecodeException.Reason.MALFORMED_FIELD,
                    field,
                    String.format("field \"%s\" is not a timestamp with offset: %s", field, text),
                    exception
            );
        }
    }

    private static List<ChangeColumn> columns(JsonNode node) throws DecodeException {
        if (!node.isArray()) {
            throw new DecodeException(DecodeException.Reason.MALFORMED_FIELD, Fields.COLUMNS, "field \"columns\" must be an array");
        }

        List<ChangeColumn> columns = new ArrayList<>(node.size());
        Set<String> seen = new LinkedHashSet<>();

        for (JsonNode column : node) {
            if (!column.isObject()) {
                throw new DecodeException(DecodeException.Reason.MALFORMED_FIELD, Fields.COLUMNS, "column entries must be objects");
            }

            Iterator<String> names = column.fieldNames();

            while (names.hasNext()) {
                String name = names.next();

                if (!ChangeDecoder.COLUMN_FIELDS.contains(name)) {
                    throw new DecodeException(
                            DecodeException.Reason.UNEXPECTED_FIELD,
                            String.format("%s.%s", Fields.COLUMNS, name),
                            String.format("field \"%s\" is not allowed in a column entry", name)
                    );
                }
            }

            for (String name : ChangeDecoder.COLUMN_FIELDS) {
                if (!column.has(name)) {
                    throw new DecodeException(
                            DecodeException.Reason.MISSING_FIELD,
                            String.format("%s.%s", Fields.COLUMNS, name),
                            String.format("field \"%s\" is required in a column entry", name)
                    );
                }
            }

            String name = ChangeDecoder.text(column, Fields.COLUMN_NAME);

            if (!seen.add(name)) {
                throw new DecodeException(DecodeException.Reason.MALFORMED_FIELD, Fields.COLUMNS, String.format("column \"%s\" is listed twice", name));
            }

            columns.add(new ChangeColumn(name, ChangeDecoder.text(column, Fields.COLUMN_TYPE)));
        }

        return columns;
    }

    private Map<String, Object> record(JsonNode parent, String field) throws DecodeException {
        JsonNode node = parent.get(field);

        if (!node.isObject()) {
            throw new DecodeException(DecodeException.Reason.MALFORMED_FIELD, field, String.format("field \"%s\" must be an object", field));
        }

        Map<String, Object> record = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> entries = node.fields();

        try {
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> entry = entries.next();
                record.put(entry.getKey(), this.mapper.treeToValue(entry.getValue(), Object.class));
            }
        } catch (JsonProcessingException exception) {
            throw new DecodeException(DecodeException.Reason.MALFORMED_FIELD, field, String.format("field \"%s\" has unreadable values", field), exception);
        }

        return record;
    }
}
