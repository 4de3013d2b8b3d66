package com.booking.realtime.visibility;

import com.booking.realtime.model.event.ChangeEvent;
import com.booking.realtime.model.event.EntityName;
import com.booking.realtime.model.subscription.Subscription;
import com.booking.realtime.model.visibility.VisibilityError;

import org.junit.After;
import org.junit.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

public class RlsVisibilityEvaluatorTest {
    private static final UUID ALICE = UUID.fromString("11111111-1111-1111-1111-111111111111");
    private static final UUID BOB = UUID.fromString("22222222-2222-2222-2222-222222222222");

    private final List<RlsVisibilityEvaluator> evaluators = new ArrayList<>();

    private RlsVisibilityEvaluator evaluator(RowSecurityAdmission admission, int shardSize, long timeout, DeleteAdmission deleteAdmission) {
        RlsVisibilityEvaluator evaluator = new RlsVisibilityEvaluator(admission, Executors.newFixedThreadPool(2), shardSize, timeout, deleteAdmission);
        this.evaluators.add(evaluator);
        return evaluator;
    }

    private static List<Subscription> subscriptions(UUID... subscribers) {
        List<Subscription> subscriptions = new ArrayList<>();

        for (int index = 0; index < subscribers.length; index++) {
            subscriptions.add(new Subscription(index, subscribers[index], NoteFixtures.NOTE));
        }

        return subscriptions;
    }

    @After
    public void tearDown() {
        for (RlsVisibilityEvaluator evaluator : this.evaluators) {
            evaluator.close();
        }
    }

    @Test
    public void testOwnerOnlySeesOwnNote() {
        NoteFixtures.OwnershipAdmission admission = new NoteFixtures.OwnershipAdmission();
        List<VisibilityError> errors = new ArrayList<>();

        Set<UUID> admitted = this.evaluator(admission, 1000, 5000, DeleteAdmission.EVALUATE)
                .evaluate(NoteFixtures.insert(1, ALICE, "bbb"), true, subscriptions(ALICE, BOB), errors);

        assertEquals(Collections.singleton(ALICE), admitted);
        assertTrue(errors.isEmpty());
        assertEquals(1, admission.getCalls());
    }

    @Test
    public void testEveryOwnerSeesExactlyOwnRow() {
        int owners = 250;
        List<UUID> identities = new ArrayList<>();

        for (int index = 0; index < owners; index++) {
            identities.add(UUID.randomUUID());
        }

        NoteFixtures.OwnershipAdmission admission = new NoteFixtures.OwnershipAdmission();
        RlsVisibilityEvaluator evaluator = this.evaluator(admission, 100, 5000, DeleteAdmission.EVALUATE);
        List<Subscription> subscriptions = subscriptions(identities.toArray(new UUID[0]));
        Set<UUID> seen = new HashSet<>();

        for (int index = 0; index < owners; index++) {
            Set<UUID> admitted = evaluator.evaluate(NoteFixtures.insert(index, identities.get(index), "bbb"), true, subscriptions, new ArrayList<>());

            assertEquals(Collections.singleton(identities.get(index)), admitted);
            seen.addAll(admitted);
        }

        assertEquals(owners, seen.size());
        // three shards per event, never one call per subscriber
        assertEquals(3 * owners, admission.getCalls());
    }

    @Test
    public void testDisabledRlsAndTruncateAdmitEverySubscriber() throws IOException {
        RowSecurityAdmission admission = mock(RowSecurityAdmission.class);
        RlsVisibilityEvaluator evaluator = this.evaluator(admission, 1000, 5000, DeleteAdmission.EVALUATE);
        Set<UUID> everyone = new HashSet<>(Arrays.asList(ALICE, BOB));

        assertEquals(everyone, evaluator.evaluate(NoteFixtures.insert(1, ALICE, "bbb"), false, subscriptions(ALICE, BOB), new ArrayList<>()));
        assertEquals(everyone, evaluator.evaluate(NoteFixtures.truncate(), true, subscriptions(ALICE, BOB), new ArrayList<>()));

        verify(admission, never()).admits(any(EntityName.class), any(), any(Collection.class));
    }

    @Test
    public void testDeleteAdmissionPolicies() {
        ChangeEvent delete = NoteFixtures.delete(4);

        Set<UUID> evaluated = this.evaluator(new NoteFixtures.OwnershipAdmission(), 1000, 5000, DeleteAdmission.EVALUATE)
                .evaluate(delete, true, subscriptions(ALICE, BOB), new ArrayList<>());
        Set<UUID> admittedAll = this.evaluator(new NoteFixtures.OwnershipAdmission(), 1000, 5000, DeleteAdmission.ADMIT_ALL)
                .evaluate(delete, true, subscriptions(ALICE, BOB), new ArrayList<>());

        // the identity columns do not carry the owner
        assertTrue(evaluated.isEmpty());
        assertEquals(new HashSet<>(Arrays.asList(ALICE, BOB)), admittedAll);
    }

    @Test
    public void testFailingShardExcludesOnlyItsSubscribers() {
        RowSecurityAdmission admission = (entity, row, identities) -> {
            if (identities.contains(BOB)) {
                throw new IOException("connection reset");
            }

            return new LinkedHashSet<>(identities);
        };

        List<VisibilityError> errors = new ArrayList<>();
        Set<UUID> admitted = this.evaluator(admission, 1, 5000, DeleteAdmission.EVALUATE)
                .evaluate(NoteFixtures.insert(1, ALICE, "bbb"), true, subscriptions(ALICE, BOB), errors);

        assertEquals(Collections.singleton(ALICE), admitted);
        assertEquals(1, errors.size());
        assertEquals(VisibilityError.Kind.VISIBILITY, errors.get(0).getKind());
        assertEquals(Collections.singleton(BOB), errors.get(0).getSubscribers());
        assertTrue(errors.get(0).getMessage().contains("connection reset"));
    }

    @Test
    public void testStuckShardTimesOut() {
        CountDownLatch release = new CountDownLatch(1);
        RowSecurityAdmission admission = (entity, row, identities) -> {
            try {
                release.await();
            } catch (InterruptedException exception) {
                Thread.currentThread().interrupt();
            }

            return new LinkedHashSet<>(identities);
        };

        List<VisibilityError> errors = new ArrayList<>();

        try {
            Set<UUID> admitted = this.evaluator(admission, 1000, 50, DeleteAdmission.EVALUATE)
                    .evaluate(NoteFixtures.insert(1, ALICE, "bbb"), true, subscriptions(ALICE, BOB), errors);

            assertTrue(admitted.isEmpty());
            assertEquals(1, errors.size());
            assertEquals(new HashSet<>(Arrays.asList(ALICE, BOB)), errors.get(0).getSubscribers());
        } finally {
            release.countDown();
        }
    }

    @Test
    public void testAdmissionCannotWidenTheRequestedSet() {
        UUID stranger = UUID.randomUUID();
        RowSecurityAdmission admission = new RowSecurityAdmission() {
            @Override
            public Set<UUID> admits(EntityName entity, Map<String, Object> row, Collection<UUID> identities) {
                Set<UUID> admitted = new LinkedHashSet<>(identities);
                admitted.add(stranger);
                return admitted;
            }
        };

        Set<UUID> admitted = this.evaluator(admission, 1000, 5000, DeleteAdmission.EVALUATE)
                .evaluate(NoteFixtures.insert(1, ALICE, "bbb"), true, subscriptions(ALICE), new ArrayList<>());

        assertEquals(Collections.singleton(ALICE), admitted);
    }

    @Test
    public void testSingleIdentityConvenience() throws IOException {
        NoteFixtures.OwnershipAdmission admission = new NoteFixtures.OwnershipAdmission();
        Map<String, Object> row = NoteFixtures.note(1, ALICE, "bbb");

        assertTrue(admission.admits(NoteFixtures.NOTE, row, ALICE));
        assertTrue(!admission.admits(NoteFixtures.NOTE, row, BOB));
    }

    @Test
    public void testNoSubscribersNoAdmission() {
        NoteFixtures.OwnershipAdmission admission = new NoteFixtures.OwnershipAdmission();

        assertTrue(this.evaluator(admission, 1000, 5000, DeleteAdmission.EVALUATE)
                .evaluate(NoteFixtures.insert(1, ALICE, "bbb"), true, Collections.emptyList(), new ArrayList<>()).isEmpty());
        assertEquals(0, admission.getCalls());
    }
}
