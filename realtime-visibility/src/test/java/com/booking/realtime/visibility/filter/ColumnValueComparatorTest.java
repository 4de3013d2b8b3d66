package com.booking.realtime.visibility.filter;

import com.booking.realtime.model.subscription.FilterOperator;

import org.junit.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ColumnValueComparatorTest {
    private final ColumnValueComparator comparator = new ColumnValueComparator();

    @Test
    public void testTypeFamilies() {
        assertEquals(ColumnValueComparator.TypeFamily.NUMERIC, ColumnValueComparator.familyOf("int8"));
        assertEquals(ColumnValueComparator.TypeFamily.NUMERIC, ColumnValueComparator.familyOf("numeric(10,2)"));
        assertEquals(ColumnValueComparator.TypeFamily.NUMERIC, ColumnValueComparator.familyOf("double precision"));
        assertEquals(ColumnValueComparator.TypeFamily.BOOLEAN, ColumnValueComparator.familyOf("bool"));
        assertEquals(ColumnValueComparator.TypeFamily.UUID, ColumnValueComparator.familyOf("uuid"));
        assertEquals(ColumnValueComparator.TypeFamily.TIMESTAMPTZ, ColumnValueComparator.familyOf("timestamp with time zone"));
        assertEquals(ColumnValueComparator.TypeFamily.TIMESTAMP, ColumnValueComparator.familyOf("timestamp(6) without time zone"));
        assertEquals(ColumnValueComparator.TypeFamily.ARRAY, ColumnValueComparator.familyOf("_text"));
        assertEquals(ColumnValueComparator.TypeFamily.ARRAY, ColumnValueComparator.familyOf("integer[]"));
        assertEquals(ColumnValueComparator.TypeFamily.TEXT, ColumnValueComparator.familyOf("character varying(255)"));
        assertEquals(ColumnValueComparator.TypeFamily.JSON, ColumnValueComparator.familyOf("jsonb"));
    }

    @Test
    public void testNumbersCompareByValueNotByText() throws FilterException {
        assertTrue(this.comparator.test("int8", 10L, FilterOperator.GT, "9"));
        assertTrue(this.comparator.test("numeric", "1.50", FilterOperator.EQ, "1.5"));
        assertTrue(this.comparator.test("float8", 2.5d, FilterOperator.LT, "3"));
    }

    @Test
    public void testNumericKeepsEveryDigit() throws FilterException {
        BigDecimal amount = new BigDecimal("1234567890.12345678901");

        assertTrue(this.comparator.test("numeric", amount, FilterOperator.EQ, "1234567890.12345678901"));
        assertFalse(this.comparator.test("numeric", amount, FilterOperator.NEQ, "1234567890.12345678901"));
        assertTrue(this.comparator.test("numeric", amount, FilterOperator.LT, "1234567890.12345678902"));
    }

    @Test
    public void testBooleansAcceptPostgresSpellings() throws FilterException {
        assertTrue(this.comparator.test("bool", true, FilterOperator.EQ, "t"));
        assertTrue(this.comparator.test("bool", false, FilterOperator.EQ, "off"));
        assertTrue(this.comparator.test("bool", false, FilterOperator.LT, "true"));
    }

    @Test
    public void testUuidsCompareCanonically() throws FilterException {
        assertTrue(this.comparator.test("uuid", "9C1C3A4E-1B2A-4D5E-8F00-000000000001", FilterOperator.EQ, "9c1c3a4e-1b2a-4d5e-8f00-000000000001"));
        assertTrue(this.comparator.test("uuid", "00000000-0000-0000-0000-000000000001", FilterOperator.LT, "f0000000-0000-0000-0000-000000000000"));
    }

    @Test
    public void testTemporalTypesCompareChronologically() throws FilterException {
        assertTrue(this.comparator.test("date", "2021-09-01", FilterOperator.GT, "2021-08-31"));
        assertTrue(this.comparator.test("timestamp", "2021-09-01 12:00:00", FilterOperator.EQ, "2021-09-01T12:00:00"));
        assertTrue(this.comparator.test("timestamptz", "2021-09-01 14:00:00+02", FilterOperator.EQ, "2021-09-01T12:00:00Z"));
        assertTrue(this.comparator.test("time", "09:30:00", FilterOperator.LTE, "10:00"));
    }

    @Test
    public void testTextComparesLexically() throws FilterException {
        assertTrue(this.comparator.test("text", "bbb", FilterOperator.GT, "aaaa"));
        assertTrue(this.comparator.test("varchar", "10", FilterOperator.LT, "9"));
    }

    @Test
    public void testArraysSupportEqualityOnly() throws FilterException {
        assertTrue(this.comparator.test("_int4", Arrays.asList(1, 2), FilterOperator.EQ, "{1,2}"));
        assertTrue(this.comparator.test("_text", Arrays.asList("one", "two"), FilterOperator.NEQ, "{one}"));
        assertTrue(this.comparator.test("_text", Arrays.asList("a b", "c"), FilterOperator.EQ, "{\"a b\", c}"));

        try {
            this.comparator.test("_int4", Arrays.asList(1, 2), FilterOperator.LT, "{1,3}");
            fail("ordering arrays must be rejected");
        } catch (FilterException exception) {
            assertTrue(exception.getMessage().contains("lt"));
        }
    }

    @Test
    public void testJsonComparesDocuments() throws FilterException {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("a", 1);
        document.put("tags", Arrays.asList("x", "y"));

        assertTrue(this.comparator.test("jsonb", document, FilterOperator.EQ, "{\"tags\": [\"x\", \"y\"], \"a\": 1}"));
        assertTrue(this.comparator.test("jsonb", document, FilterOperator.NEQ, "{\"a\": 2}"));
        assertTrue(this.comparator.test("json", "{\"a\":1}", FilterOperator.EQ, "{ \"a\" : 1 }"));
    }

    @Test
    public void testJsonRejectsOrderingAndMalformedLiterals() {
        Map<String, Object> document = Collections.singletonMap("a", 1);

        try {
            this.comparator.test("jsonb", document, FilterOperator.GT, "{\"a\": 0}");
            fail("ordering json must be rejected");
        } catch (FilterException exception) {
            assertTrue(exception.getMessage().contains("jsonb"));
        }

        try {
            this.comparator.test("jsonb", document, FilterOperator.EQ, "{a=1}");
            fail("malformed json literal must be rejected");
        } catch (FilterException exception) {
            assertTrue(exception.getMessage().contains("literal"));
        }
    }

    @Test(expected = FilterException.class)
    public void testStructuredValueIsNotComparedAsText() throws FilterException {
        this.comparator.test("text", Collections.singletonMap("a", 1), FilterOperator.EQ, "{a=1}");
    }

    @Test
    public void testArrayLiteralParsing() throws FilterException {
        assertEquals(Arrays.asList("a", null, "NULL", "x,y"), ColumnValueComparator.parseArrayLiteral("{a,NULL,\"NULL\",\"x,y\"}"));
        assertTrue(ColumnValueComparator.parseArrayLiteral("{}").isEmpty());
    }

    @Test(expected = FilterException.class)
    public void testMalformedNumericLiteral() throws FilterException {
        this.comparator.test("int4", 1, FilterOperator.EQ, "one");
    }

    @Test(expected = FilterException.class)
    public void testMalformedArrayLiteral() throws FilterException {
        this.comparator.test("_text", Arrays.asList("a"), FilterOperator.EQ, "a");
    }

    @Test
    public void testMalformedDateLiteral() {
        try {
            this.comparator.test("date", "2021-09-01", FilterOperator.EQ, "yesterday");
            fail("malformed literal must be rejected");
        } catch (FilterException exception) {
            assertFalse(exception.getMessage().isEmpty());
        }
    }
}
