package com.booking.realtime.visibility.filter;

import com.booking.realtime.model.subscription.FilterOperator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Compares a record value with a filter literal according to the column's declared type.
 */
public class ColumnValueComparator {

    public enum TypeFamily {
        NUMERIC,
        BOOLEAN,
        UUID,
        DATE,
        TIMESTAMP,
        TIMESTAMPTZ,
        TIME,
        TEXT,
        ARRAY,
        JSON
    }

    private static final DateTimeFormatter DATE_TIME = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart().appendOffset("+HH:mm", "Z").optionalEnd()
            .toFormatter(Locale.ROOT);

    private final ObjectMapper mapper;

    public ColumnValueComparator() {
        this(new ObjectMapper());
    }

    public ColumnValueComparator(ObjectMapper mapper) {
        this.mapper = mapper.copy()
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .configure(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES, false);
    }

    public static TypeFamily familyOf(String declaredType) {
        String type = ColumnValueComparator.normalize(declaredType);

        if (type.startsWith("_") || type.endsWith("[]")) {
            return TypeFamily.ARRAY;
        }

        switch (type) {
            case "int2":
            case "int4":
            case "int8":
            case "smallint":
            case "integer":
            case "int":
            case "bigint":
            case "smallserial":
            case "serial":
            case "bigserial":
            case "oid":
            case "numeric":
            case "decimal":
            case "float4":
            case "float8":
            case "real":
            case "double precision":
                return TypeFamily.NUMERIC;
            case "bool":
            case "boolean":
                return TypeFamily.BOOLEAN;
            case "uuid":
                return TypeFamily.UUID;
            case "date":
                return TypeFamily.DATE;
            case "timestamp":
            case "timestamp without time zone":
                return TypeFamily.TIMESTAMP;
            case "timestamptz":
            case "timestamp with time zone":
                return TypeFamily.TIMESTAMPTZ;
            case "time":
            case "time without time zone":
                return TypeFamily.TIME;
            case "json":
            case "jsonb":
                return TypeFamily.JSON;
            default:
                return TypeFamily.TEXT;
        }
    }

    private static String normalize(String declaredType) {
        String type = Objects.requireNonNull(declaredType, "declaredType").trim().toLowerCase(Locale.ROOT);
        int modifier = type.indexOf('(');

        if (modifier >= 0) {
            int end = type.indexOf(')', modifier);
            type = (type.substring(0, modifier) + ((end >= 0) ? type.substring(end + 1) : "")).trim();
        }

        return type;
    }

    /**
     * Evaluates {@code value operator literal}. The value must not be {@code null}.
     */
    public boolean test(String declaredType, Object value, FilterOperator operator, String literal) throws FilterException {
        TypeFamily family = ColumnValueComparator.familyOf(declaredType);

        if ((family == TypeFamily.ARRAY || family == TypeFamily.JSON) && !operator.isEquality()) {
            throw new FilterException(String.format("operator %s is not supported for type %s", operator, declaredType));
        }

        return operator.test(this.compare(family, declaredType, value, literal));
    }

    public int compare(String declaredType, Object value, String literal) throws FilterException {
        return this.compare(ColumnValueComparator.familyOf(declaredType), declaredType, value, literal);
    }

    private int compare(TypeFamily family, String declaredType, Object value, String literal) throws FilterException {
        Objects.requireNonNull(value, "value");

        if (literal == null) {
            throw new FilterException("filter value is missing");
        }

        switch (family) {
            case NUMERIC:
                return this.toNumber(value, declaredType, "value").compareTo(this.toNumber(literal, declaredType, "literal"));
            case BOOLEAN:
                return Boolean.compare(this.toBoolean(value, "value"), this.toBoolean(literal, "literal"));
            case UUID:
                return this.toUuid(value, "value").compareTo(this.toUuid(literal, "literal"));
            case DATE:
                return this.parse(value, literal, declaredType, LocalDate::parse);
            case TIMESTAMP:
                return this.parse(value, literal, declaredType, text -> LocalDateTime.parse(text, ColumnValueComparator.DATE_TIME));
            case TIMESTAMPTZ:
                return this.parse(value, literal, declaredType, ColumnValueComparator::toInstant);
            case TIME:
                return this.parse(value, literal, declaredType, LocalTime::parse);
            case ARRAY:
                return this.toElements(value).equals(ColumnValueComparator.parseArrayLiteral(literal)) ? 0 : 1;
            case JSON:
                return this.toJson(value, "value").equals(this.toJson(literal, "literal")) ? 0 : 1;
            default:
                if (value instanceof Map || value instanceof Collection) {
                    throw new FilterException(String.format("structured value is not comparable as %s", declaredType));
                }

                return value.toString().compareTo(literal);
        }
    }

    // text values hold serialized json, decoded values are already structured
    private JsonNode toJson(Object value, String side) throws FilterException {
        try {
            if (value instanceof String) {
                return this.mapper.readTree((String) value);
            }

            return this.mapper.valueToTree(value);
        } catch (JsonProcessingException | IllegalArgumentException exception) {
            throw new FilterException(String.format("%s \"%s\" is not valid json", side, value), exception);
        }
    }

    private BigDecimal toNumber(Object value, String declaredType, String side) throws FilterException {
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }

        try {
            return new BigDecimal(value.toString().trim());
        } catch (NumberFormatException exception) {
            throw new FilterException(String.format("%s \"%s\" is not a valid %s", side, value, declaredType), exception);
        }
    }

    private boolean toBoolean(Object value, String side) throws FilterException {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }

        switch (value.toString().trim().toLowerCase(Locale.ROOT)) {
            case "t":
            case "true":
            case "y":
            case "yes":
            case "on":
            case "1":
                return true;
            case "f":
            case "false":
            case "n":
            case "no":
            case "off":
            case "0":
                return false;
            default:
                throw new FilterException(String.format("%s \"%s\" is not a valid bool", side, value));
        }
    }

    // canonical lower case text orders like the unsigned bytes of the uuid
    private String toUuid(Object value, String side) throws FilterException {
        try {
            return UUID.fromString(value.toString().trim()).toString();
        } catch (IllegalArgumentException exception) {
            throw new FilterException(String.format("%s \"%s\" is not a valid uuid", side, value), exception);
        }
    }

    private interface Parser<T extends Comparable<? super T>> {
        T parse(String text);
    }

    private <T extends Comparable<? super T>> int parse(Object value, String literal, String declaredType, Parser<T> parser) throws FilterException {
        T left;
        T right;

        try {
            left = parser.parse(value.toString().trim());
        } catch (DateTimeParseException exception) {
            throw new FilterException(String.format("value \"%s\" is not a valid %s", value, declaredType), exception);
        }

        try {
            right = parser.parse(literal.trim());
        } catch (DateTimeParseException exception) {
            throw new FilterException(String.format("literal \"%s\" is not a valid %s", literal, declaredType), exception);
        }

        return left.compareTo(right);
    }

    private static Instant toInstant(String text) {
        TemporalAccessor parsed = ColumnValueComparator.DATE_TIME.parse(text);
        LocalDateTime local = LocalDateTime.from(parsed);

        if (parsed.isSupported(ChronoField.OFFSET_SECONDS)) {
            return OffsetDateTime.of(local, ZoneOffset.from(parsed)).toInstant();
        }

        return local.toInstant(ZoneOffset.UTC);
    }

    private List<String> toElements(Object value) throws FilterException {
        if (value instanceof Collection) {
            List<String> elements = new ArrayList<>();

            for (Object element : (Collection<?>) value) {
                elements.add((element != null) ? element.toString() : null);
            }

            return elements;
        }

        return ColumnValueComparator.parseArrayLiteral(value.toString());
    }

    /**
     * Parses a one dimensional PostgreSQL array literal such as {@code {a,"b c",NULL}}.
     */
    public static List<String> parseArrayLiteral(String literal) throws FilterException {
        String text = literal.trim();

        if (text.length() < 2 || text.charAt(0) != '{' || text.charAt(text.length() - 1) != '}') {
            throw new FilterException(String.format("literal \"%s\" is not an array literal", literal));
        }

        List<String> elements = new ArrayList<>();
        String body = text.substring(1, text.length() - 1);

        if (body.trim().isEmpty()) {
            return elements;
        }

        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        boolean wasQuoted = false;

        for (int index = 0; index < body.length(); index++) {
            char character = body.charAt(index);

            if (quoted) {
                if (character == '\\' && index + 1 < body.length()) {
                    current.append(body.charAt(++index));
                } else if (character == '"') {
                    quoted = false;
                } else {
                    current.append(character);
                }
            } else if (character == '"') {
                current.setLength(0);
                quoted = true;
                wasQuoted = true;
            } else if (character == '{' || character == '}') {
                throw new FilterException(String.format("literal \"%s\" is not a one dimensional array", literal));
            } else if (character == ',') {
                elements.add(ColumnValueComparator.element(current, wasQuoted));
                current.setLength(0);
                wasQuoted = false;
            } else {
                current.append(character);
            }
        }

        if (quoted) {
            throw new FilterException(String.format("literal \"%s\" has an unterminated quote", literal));
        }

        elements.add(ColumnValueComparator.element(current, wasQuoted));

        return elements;
    }

    private static String element(StringBuilder current, boolean wasQuoted) {
        if (wasQuoted) {
            return current.toString();
        }

        String element = current.toString().trim();

        return "NULL".equalsIgnoreCase(element) ? null : element;
    }
}
