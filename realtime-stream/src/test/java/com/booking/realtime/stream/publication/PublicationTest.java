package com.booking.realtime.stream.publication;

import com.booking.realtime.model.event.ChangeEventType;
import com.booking.realtime.model.event.EntityName;

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class PublicationTest {
    private static final EntityName NOTE = new EntityName("public", "note");
    private static final EntityName TODO = new EntityName("public", "todo");

    @Test
    public void testEmptyPublicationCapturesNothing() {
        Publication empty = new Publication("supabase_realtime", false, EnumSet.allOf(ChangeEventType.class), Collections.emptySet());

        assertFalse(empty.capturesAnything());
        assertFalse(empty.captures(NOTE, ChangeEventType.INSERT));
        assertFalse(Publication.empty("supabase_realtime").capturesAnything());
    }

    @Test
    public void testTablesAndActions() {
        Publication publication = new Publication("supabase_realtime", false, Arrays.asList(ChangeEventType.INSERT, ChangeEventType.DELETE), Collections.singleton(NOTE));

        assertTrue(publication.captures(NOTE, ChangeEventType.INSERT));
        assertFalse(publication.captures(NOTE, ChangeEventType.UPDATE));
        assertFalse(publication.captures(TODO, ChangeEventType.INSERT));
        assertEquals("insert,delete", publication.toWal2JsonActions());
        assertEquals("public.note", publication.toWal2JsonTables());
    }

    @Test
    public void testAllTables() {
        Publication publication = new Publication("supabase_realtime", true, EnumSet.of(ChangeEventType.TRUNCATE), Collections.emptySet());

        assertTrue(publication.captures(TODO, ChangeEventType.TRUNCATE));
        assertNull(publication.toWal2JsonTables());
    }

    @Test
    public void testFromConfiguration() {
        Map<String, Object> configuration = new HashMap<>();
        configuration.put(Publication.Configuration.ACTIONS, "insert, update");
        configuration.put(Publication.Configuration.TABLES, Arrays.asList("note", "public.todo"));

        Publication publication = Publication.fromConfiguration(configuration);

        assertEquals(Publication.DEFAULT_NAME, publication.getName());
        assertEquals(EnumSet.of(ChangeEventType.INSERT, ChangeEventType.UPDATE), publication.getActions());
        assertEquals(2, publication.getTables().size());
        assertTrue(publication.captures(NOTE, ChangeEventType.UPDATE));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownActionIsRejected() {
        Publication.fromConfiguration(Collections.singletonMap(Publication.Configuration.ACTIONS, "upsert"));
    }
}
