package com.booking.realtime.visibility;

import com.booking.realtime.commons.metrics.ConsoleMetrics;
import com.booking.realtime.commons.metrics.Metrics;
import com.booking.realtime.model.event.ChangeEvent;
import com.booking.realtime.model.subscription.FilterOperator;
import com.booking.realtime.model.subscription.Subscription;
import com.booking.realtime.model.subscription.UserDefinedFilter;
import com.booking.realtime.model.visibility.VisibilityError;
import com.booking.realtime.model.visibility.VisibilityResult;
import com.booking.realtime.visibility.filter.FilterEvaluator;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.UUID;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class VisibilityEngineTest {
    private static final UUID ALICE = UUID.fromString("11111111-1111-1111-1111-111111111111");
    private static final UUID BOB = UUID.fromString("22222222-2222-2222-2222-222222222222");

    private SubscriptionRegistry registry;
    private TableSecurityCatalog catalog;
    private Metrics<?> metrics;
    private VisibilityEngine engine;

    private VisibilityEngine engine(Map<String, Object> configuration) {
        return VisibilityEngine.build(configuration, this.registry, this.catalog, new NoteFixtures.OwnershipAdmission(), this.metrics);
    }

    @Before
    public void setUp() {
        Map<String, Object> configuration = new HashMap<>();
        configuration.put(Metrics.Configuration.REPORT_PERIOD, "0");

        this.registry = mock(SubscriptionRegistry.class);
        this.catalog = mock(TableSecurityCatalog.class);
        this.metrics = new ConsoleMetrics(configuration);
        this.engine = this.engine(new HashMap<>());
    }

    @After
    public void tearDown() throws IOException {
        this.engine.close();
        this.metrics.close();
    }

    @Test
    public void testFilteredSubscriberFollowsBody() throws IOException {
        when(this.catalog.describe(NoteFixtures.NOTE, NoteFixtures.ROLE)).thenReturn(NoteFixtures.descriptor(false));
        when(this.registry.listSubscriptions(NoteFixtures.NOTE)).thenReturn(Collections.singletonList(
                new Subscription(1L, ALICE, NoteFixtures.NOTE, Collections.singletonList(new UserDefinedFilter("body", FilterOperator.EQ, "bbb")))
        ));

        VisibilityResult matching = this.engine.apply(NoteFixtures.insert(1, BOB, "bbb"));
        VisibilityResult other = this.engine.apply(NoteFixtures.insert(2, BOB, "aaaa"));

        assertEquals(Collections.singleton(ALICE), matching.getVisibleSubscribers());
        assertFalse(matching.isRlsEnabled());
        assertTrue(other.getVisibleSubscribers().isEmpty());
        assertEquals(2L, this.metrics.getCount("visibility.events"));
    }

    @Test
    public void testRlsAdmitsOwnerAndRedactsColumns() throws IOException {
        when(this.catalog.describe(NoteFixtures.NOTE, NoteFixtures.ROLE)).thenReturn(NoteFixtures.descriptor(true));
        when(this.registry.listSubscriptions(NoteFixtures.NOTE)).thenReturn(Arrays.asList(
                new Subscription(1L, ALICE, NoteFixtures.NOTE),
                new Subscription(2L, BOB, NoteFixtures.NOTE)
        ));

        VisibilityResult result = this.engine.apply(NoteFixtures.insert(1, ALICE, "bbb"));

        assertTrue(result.isRlsEnabled());
        assertEquals(Collections.singleton(ALICE), result.getVisibleSubscribers());
        assertFalse(result.getEvent().getRecord().containsKey("dummy"));
        assertFalse(result.hasErrors());
    }

    @Test
    public void testUpdateIsEvaluatedOnNewRecord() throws IOException {
        when(this.catalog.describe(NoteFixtures.NOTE, NoteFixtures.ROLE)).thenReturn(NoteFixtures.descriptor(true));
        when(this.registry.listSubscriptions(NoteFixtures.NOTE)).thenReturn(Arrays.asList(
                new Subscription(1L, ALICE, NoteFixtures.NOTE, Collections.singletonList(new UserDefinedFilter("id", FilterOperator.EQ, "99"))),
                new Subscription(2L, BOB, NoteFixtures.NOTE)
        ));

        VisibilityResult result = this.engine.apply(NoteFixtures.update(1, 99, ALICE, "bbb"));
        ChangeEvent event = result.getEvent();

        assertEquals(99L, event.getRecord().get("id"));
        assertEquals(1L, event.getOldRecord().get("id"));
        assertEquals(Collections.singleton(ALICE), result.getVisibleSubscribers());
    }

    @Test
    public void testDeletePolicies() throws IOException {
        when(this.catalog.describe(NoteFixtures.NOTE, NoteFixtures.ROLE)).thenReturn(NoteFixtures.descriptor(true));
        when(this.registry.listSubscriptions(NoteFixtures.NOTE)).thenReturn(Arrays.asList(
                new Subscription(1L, ALICE, NoteFixtures.NOTE),
                new Subscription(2L, BOB, NoteFixtures.NOTE, Collections.singletonList(new UserDefinedFilter("body", FilterOperator.EQ, "bbb")))
        ));

        assertTrue(this.engine.apply(NoteFixtures.delete(4)).getVisibleSubscribers().isEmpty());

        Map<String, Object> configuration = new HashMap<>();
        configuration.put(RlsVisibilityEvaluator.Configuration.DELETE_ADMISSION, "ADMIT_ALL");

        try (VisibilityEngine admitAll = this.engine(configuration)) {
            assertEquals(new HashSet<>(Arrays.asList(ALICE, BOB)), admitAll.apply(NoteFixtures.delete(4)).getVisibleSubscribers());
        }

        configuration.put(FilterEvaluator.Configuration.DELETE_FILTER_MODE, "EXCLUDE");

        try (VisibilityEngine exclude = this.engine(configuration)) {
            assertEquals(Collections.singleton(ALICE), exclude.apply(NoteFixtures.delete(4)).getVisibleSubscribers());
        }
    }

    @Test
    public void testTruncateReachesEverySubscriber() throws IOException {
        when(this.catalog.describe(NoteFixtures.NOTE, NoteFixtures.ROLE)).thenReturn(NoteFixtures.descriptor(true));
        when(this.registry.listSubscriptions(NoteFixtures.NOTE)).thenReturn(Arrays.asList(
                new Subscription(1L, ALICE, NoteFixtures.NOTE, Collections.singletonList(new UserDefinedFilter("body", FilterOperator.EQ, "zzz"))),
                new Subscription(2L, BOB, NoteFixtures.NOTE)
        ));

        assertEquals(new HashSet<>(Arrays.asList(ALICE, BOB)), this.engine.apply(NoteFixtures.truncate()).getVisibleSubscribers());
    }

    @Test
    public void testUnknownEntityAdmitsNobody() throws IOException {
        when(this.registry.listSubscriptions(NoteFixtures.NOTE)).thenReturn(Collections.singletonList(new Subscription(1L, ALICE, NoteFixtures.NOTE)));

        VisibilityResult result = this.engine.apply(NoteFixtures.insert(1, ALICE, "bbb"));

        assertTrue(result.getVisibleSubscribers().isEmpty());
        assertTrue(result.getEvent().getColumns().isEmpty());
        assertEquals(VisibilityError.Kind.REDACTION, result.getErrors().get(0).getKind());
        assertEquals(1L, this.metrics.getCount("visibility.errors.redaction"));
    }

    @Test(expected = IOException.class)
    public void testCatalogFailureFailsTheChange() throws IOException {
        when(this.catalog.describe(NoteFixtures.NOTE, NoteFixtures.ROLE)).thenThrow(new IOException("catalog unavailable"));

        this.engine.apply(NoteFixtures.insert(1, ALICE, "bbb"));
    }
}
