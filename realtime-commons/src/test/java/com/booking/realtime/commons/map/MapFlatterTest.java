package com.booking.realtime.commons.map;

import org.junit.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

public class MapFlatterTest {

    @Test
    public void testFlattenNestedMaps() {
        Map<String, Object> slot = new HashMap<>();
        slot.put("name", "realtime");
        slot.put("batch", 100);

        Map<String, Object> stream = new HashMap<>();
        stream.put("type", "SLOT");
        stream.put("slot", slot);
        stream.put("tables", Arrays.asList("public.note", "public.todo"));

        Map<String, Object> configuration = new HashMap<>();
        configuration.put("stream", stream);

        Map<String, Object> flat = new MapFlatter(".").flattenMap(configuration);

        assertEquals("SLOT", flat.get("stream.type"));
        assertEquals("realtime", flat.get("stream.slot.name"));
        assertEquals(100, flat.get("stream.slot.batch"));
        assertEquals(Arrays.asList("public.note", "public.todo"), flat.get("stream.tables"));
        assertFalse(flat.containsKey("stream"));
    }
}
