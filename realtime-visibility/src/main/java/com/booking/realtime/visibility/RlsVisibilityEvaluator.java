package com.booking.realtime.visibility;

import com.booking.realtime.model.event.ChangeEvent;
import com.booking.realtime.model.event.ChangeEventType;
import com.booking.realtime.model.subscription.Subscription;
import com.booking.realtime.model.visibility.VisibilityError;
import com.google.common.collect.Lists;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Decides which subscribers of an entity pass row level security for one event.
 * <p>
 * Distinct subscriber identities are split into shards and every shard is answered by a single
 * batched {@link RowSecurityAdmission} call on a bounded worker pool. A shard that fails or
 * does not finish before the deadline excludes its identities and is reported as one
 * {@link VisibilityError.Kind#VISIBILITY} error.
 */
public class RlsVisibilityEvaluator implements Closeable {
    private static final Logger LOG = LogManager.getLogger(RlsVisibilityEvaluator.class);

    public interface Configuration {
        String SHARD_SIZE = "visibility.rls.shard.size";
        String THREADS = "visibility.rls.threads";
        String TIMEOUT = "visibility.rls.timeout.ms";
        String DELETE_ADMISSION = "visibility.delete.admission";
    }

    private final RowSecurityAdmission admission;
    private final ExecutorService executor;
    private final int shardSize;
    private final long timeoutMillis;
    private final DeleteAdmission deleteAdmission;

    public RlsVisibilityEvaluator(RowSecurityAdmission admission, ExecutorService executor, int shardSize, long timeoutMillis, DeleteAdmission deleteAdmission) {
        if (shardSize < 1) {
            throw new IllegalArgumentException(String.format("shard size must be positive: %d", shardSize));
        }

        this.admission = Objects.requireNonNull(admission, "admission");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.shardSize = shardSize;
        this.timeoutMillis = timeoutMillis;
        this.deleteAdmission = Objects.requireNonNull(deleteAdmission, "deleteAdmission");
    }

    public Set<UUID> evaluate(ChangeEvent event, boolean rlsEnabled, Collection<Subscription> subscriptions, List<VisibilityError> errors) {
        Set<UUID> identities = new LinkedHashSet<>();

        for (Subscription subscription : subscriptions) {
            identities.add(subscription.getUserId());
        }

        if (identities.isEmpty()) {
            return Collections.emptySet();
        }

        if (event.getType() == ChangeEventType.TRUNCATE || !rlsEnabled) {
            return identities;
        }

        if (event.getType() == ChangeEventType.DELETE && this.deleteAdmission == DeleteAdmission.ADMIT_ALL) {
            return identities;
        }

        return this.admit(event, identities, errors);
    }

    private Set<UUID> admit(ChangeEvent event, Set<UUID> identities, List<VisibilityError> errors) {
        Map<String, Object> row = event.getTargetRow();
        List<List<UUID>> shards = Lists.partition(new ArrayList<>(identities), this.shardSize);
        List<Future<Set<UUID>>> futures = new ArrayList<>(shards.size());

        for (List<UUID> shard : shards) {
            try {
                futures.add(this.executor.submit(() -> this.admission.admits(event.getEntity(), row, shard)));
            } catch (RejectedExecutionException exception) {
                futures.add(null);
            }
        }

        Set<UUID> admitted = new LinkedHashSet<>();
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(this.timeoutMillis);
        boolean interrupted = false;

        for (int index = 0; index < shards.size(); index++) {
            List<UUID> shard = shards.get(index);
            Future<Set<UUID>> future = futures.get(index);

            if (future == null) {
                this.reject(event, shard, "admission worker pool rejected the shard", errors);
                continue;
            }

            if (interrupted) {
                future.cancel(true);
                this.reject(event, shard, "evaluation interrupted", errors);
                continue;
            }

            try {
                Set<UUID> result = future.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);

                if (result != null) {
                    for (UUID identity : shard) {
                        if (result.contains(identity)) {
                            admitted.add(identity);
                        }
                    }
                }
            } catch (TimeoutException exception) {
                future.cancel(true);
                this.reject(event, shard, String.format("admission timed out after %d ms", this.timeoutMillis), errors);
            } catch (ExecutionException exception) {
                Throwable cause = (exception.getCause() != null) ? exception.getCause() : exception;
                RlsVisibilityEvaluator.LOG.warn(String.format("admission failed for %s", event.getEntity()), cause);
                this.reject(event, shard, String.format("admission failed: %s", cause.getMessage()), errors);
            } catch (InterruptedException exception) {
                interrupted = true;
                future.cancel(true);
                this.reject(event, shard, "evaluation interrupted", errors);
            }
        }

        if (interrupted) {
            Thread.currentThread().interrupt();
        }

        return admitted;
    }

    private void reject(ChangeEvent event, List<UUID> shard, String message, List<VisibilityError> errors) {
        RlsVisibilityEvaluator.LOG.warn(String.format("%s: excluding %d subscribers of %s", message, shard.size(), event.getEntity()));
        errors.add(VisibilityError.visibility(shard, message));
    }

    @Override
    public void close() {
        this.executor.shutdown();

        try {
            if (!this.executor.awaitTermination(this.timeoutMillis, TimeUnit.MILLISECONDS)) {
                this.executor.shutdownNow();
            }
        } catch (InterruptedException exception) {
            this.executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public static RlsVisibilityEvaluator build(Map<String, Object> configuration, RowSecurityAdmission admission) {
        int threads = Integer.parseInt(configuration.getOrDefault(Configuration.THREADS, "4").toString());
        int shardSize = Integer.parseInt(configuration.getOrDefault(Configuration.SHARD_SIZE, "1000").toString());
        long timeout = Long.parseLong(configuration.getOrDefault(Configuration.TIMEOUT, "5000").toString());
        DeleteAdmission deleteAdmission = DeleteAdmission.valueOf(
                configuration.getOrDefault(Configuration.DELETE_ADMISSION, DeleteAdmission.EVALUATE.name()).toString()
        );

        ExecutorService executor = Executors.newFixedThreadPool(
                threads,
                new ThreadFactoryBuilder().setNameFormat("rls-admission-%d").setDaemon(true).build()
        );

        return new RlsVisibilityEvaluator(admission, executor, shardSize, timeout, deleteAdmission);
    }
}
