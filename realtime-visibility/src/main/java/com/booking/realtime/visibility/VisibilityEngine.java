package com.booking.realtime.visibility;

import com.booking.realtime.commons.metrics.Metrics;
import com.booking.realtime.model.event.ChangeEvent;
import com.booking.realtime.model.event.ChangeEventType;
import com.booking.realtime.model.event.EntityName;
import com.booking.realtime.model.security.TableSecurityDescriptor;
import com.booking.realtime.model.subscription.Subscription;
import com.booking.realtime.model.visibility.VisibilityError;
import com.booking.realtime.model.visibility.VisibilityResult;
import com.booking.realtime.visibility.filter.FilterEvaluator;
import com.codahale.metrics.Timer;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Runs one decoded change through column redaction, row level security and subscriber
 * filters, in that order, and produces the {@link VisibilityResult} handed to dispatch.
 * <p>
 * Failures that concern some subscribers only are reported inside the result. Failures of the
 * registry or of the catalog propagate as {@link IOException} and fail the whole change.
 */
public class VisibilityEngine implements Closeable {
    private static final Logger LOG = LogManager.getLogger(VisibilityEngine.class);

    public interface Configuration {
        String ROLE = "visibility.role";
    }

    private final SubscriptionRegistry registry;
    private final TableSecurityCatalog catalog;
    private final ColumnRedactor redactor;
    private final RlsVisibilityEvaluator rlsEvaluator;
    private final FilterEvaluator filterEvaluator;
    private final Metrics<?> metrics;

    public VisibilityEngine(SubscriptionRegistry registry, TableSecurityCatalog catalog, ColumnRedactor redactor, RlsVisibilityEvaluator rlsEvaluator, FilterEvaluator filterEvaluator, Metrics<?> metrics) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.redactor = Objects.requireNonNull(redactor, "redactor");
        this.rlsEvaluator = Objects.requireNonNull(rlsEvaluator, "rlsEvaluator");
        this.filterEvaluator = Objects.requireNonNull(filterEvaluator, "filterEvaluator");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public VisibilityResult apply(ChangeEvent event) throws IOException {
        try (Timer.Context ignored = this.metrics.timer("visibility.apply").time()) {
            EntityName entity = event.getEntity();
            List<VisibilityError> errors = new ArrayList<>();

            TableSecurityDescriptor descriptor = this.catalog.describe(entity, this.redactor.getRole());
            ChangeEvent redacted = this.redactor.redact(event, descriptor, errors);
            List<Subscription> subscriptions = this.registry.listSubscriptions(entity);

            Set<UUID> visible;
            boolean rlsEnabled;

            if (descriptor == null && event.getType() != ChangeEventType.TRUNCATE) {
                // nothing is known about the entity's policies
                rlsEnabled = true;
                visible = Collections.emptySet();
            } else {
                rlsEnabled = descriptor != null && descriptor.isRlsEnabled();

                Set<UUID> admitted = this.rlsEvaluator.evaluate(redacted, rlsEnabled, subscriptions, errors);

                visible = this.filterEvaluator.evaluate(redacted, admitted, subscriptions, errors);
            }

            this.count(errors, visible);

            VisibilityEngine.LOG.debug(String.format(
                    "%s on %s: %d subscriptions, %d visible, %d errors",
                    event.getType(), entity, subscriptions.size(), visible.size(), errors.size()
            ));

            return new VisibilityResult(redacted, rlsEnabled, visible, errors);
        }
    }

    private void count(List<VisibilityError> errors, Set<UUID> visible) {
        this.metrics.incrementCounter("visibility.events", 1L);
        this.metrics.incrementCounter("visibility.subscribers.visible", visible.size());

        for (VisibilityError error : errors) {
            this.metrics.incrementCounter(
                    String.format("visibility.errors.%s", error.getKind().name().toLowerCase(Locale.ROOT)), 1L
            );
        }
    }

    @Override
    public void close() throws IOException {
        this.rlsEvaluator.close();
        this.registry.close();
        this.catalog.close();
    }

    public static VisibilityEngine build(Map<String, Object> configuration, SubscriptionRegistry registry, TableSecurityCatalog catalog, RowSecurityAdmission admission, Metrics<?> metrics) {
        String role = configuration.getOrDefault(Configuration.ROLE, "authenticated").toString();

        return new VisibilityEngine(
                registry,
                catalog,
                new ColumnRedactor(role),
                RlsVisibilityEvaluator.build(configuration, admission),
                new FilterEvaluator(configuration),
                metrics
        );
    }
}
