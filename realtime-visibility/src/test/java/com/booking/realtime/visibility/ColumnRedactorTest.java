package com.booking.realtime.visibility;

import com.booking.realtime.model.event.ChangeColumn;
import com.booking.realtime.model.event.ChangeEvent;
import com.booking.realtime.model.event.EntityName;
import com.booking.realtime.model.security.TableSecurityDescriptor;
import com.booking.realtime.model.visibility.VisibilityError;

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ColumnRedactorTest {
    private final ColumnRedactor redactor = new ColumnRedactor(NoteFixtures.ROLE);

    private static List<String> names(ChangeEvent event) {
        List<String> names = new ArrayList<>();

        for (ChangeColumn column : event.getColumns()) {
            names.add(column.getName());
        }

        return names;
    }

    @Test
    public void testUngrantedColumnNeverSurfaces() {
        List<VisibilityError> errors = new ArrayList<>();
        ChangeEvent update = NoteFixtures.update(1, 99, UUID.randomUUID(), "bbb");
        ChangeEvent redacted = this.redactor.redact(update, NoteFixtures.descriptor(false), errors);

        assertTrue(errors.isEmpty());
        assertFalse(names(redacted).contains("dummy"));
        assertFalse(redacted.getRecord().containsKey("dummy"));
        assertFalse(redacted.getOldRecord().containsKey("dummy"));
        assertEquals(5, redacted.getColumns().size());
        assertEquals(99L, redacted.getRecord().get("id"));
        assertEquals(1L, redacted.getOldRecord().get("id"));

        // the input is left untouched
        assertTrue(update.getRecord().containsKey("dummy"));
    }

    @Test
    public void testRedactionIsIdempotent() {
        TableSecurityDescriptor descriptor = NoteFixtures.descriptor(true);
        ChangeEvent once = this.redactor.redact(NoteFixtures.insert(1, UUID.randomUUID(), "bbb"), descriptor, new ArrayList<>());
        ChangeEvent twice = this.redactor.redact(once, descriptor, new ArrayList<>());

        assertEquals(once, twice);
    }

    @Test
    public void testMissingDescriptorRedactsEverything() {
        List<VisibilityError> errors = new ArrayList<>();
        ChangeEvent redacted = this.redactor.redact(NoteFixtures.insert(1, UUID.randomUUID(), "bbb"), null, errors);

        assertTrue(redacted.getColumns().isEmpty());
        assertTrue(redacted.getRecord().isEmpty());
        assertEquals(1, errors.size());
        assertEquals(VisibilityError.Kind.REDACTION, errors.get(0).getKind());
    }

    @Test
    public void testDescriptorOfAnotherRoleRedactsEverything() {
        List<VisibilityError> errors = new ArrayList<>();
        TableSecurityDescriptor anon = new TableSecurityDescriptor(NoteFixtures.NOTE, false, "anon", NoteFixtures.GRANTED);
        ChangeEvent redacted = this.redactor.redact(NoteFixtures.insert(1, UUID.randomUUID(), "bbb"), anon, errors);

        assertTrue(redacted.getRecord().isEmpty());
        assertEquals(VisibilityError.Kind.REDACTION, errors.get(0).getKind());
    }

    @Test
    public void testUnknownGrantsRedactEverything() {
        List<VisibilityError> errors = new ArrayList<>();
        TableSecurityDescriptor unknown = new TableSecurityDescriptor(NoteFixtures.NOTE, false, NoteFixtures.ROLE, null);
        ChangeEvent redacted = this.redactor.redact(NoteFixtures.delete(4), unknown, errors);

        assertTrue(redacted.getOldRecord().isEmpty());
        assertEquals(1, errors.size());
    }

    @Test
    public void testDescriptorOfAnotherEntityRedactsEverything() {
        List<VisibilityError> errors = new ArrayList<>();
        TableSecurityDescriptor other = new TableSecurityDescriptor(new EntityName("public", "todo"), false, NoteFixtures.ROLE, NoteFixtures.GRANTED);
        ChangeEvent redacted = this.redactor.redact(NoteFixtures.insert(1, UUID.randomUUID(), "bbb"), other, errors);

        assertTrue(redacted.getColumns().isEmpty());
        assertEquals(1, errors.size());
    }
}
