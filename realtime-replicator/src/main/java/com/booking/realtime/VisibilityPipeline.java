package com.booking.realtime;

import com.booking.realtime.commons.checkpoint.Checkpoint;
import com.booking.realtime.commons.checkpoint.CheckpointStorage;
import com.booking.realtime.commons.checkpoint.StreamPosition;
import com.booking.realtime.commons.metrics.Metrics;
import com.booking.realtime.decoder.ChangeDecoder;
import com.booking.realtime.decoder.DecodeException;
import com.booking.realtime.dispatcher.Dispatcher;
import com.booking.realtime.model.event.ChangeEvent;
import com.booking.realtime.model.visibility.VisibilityResult;
import com.booking.realtime.stream.ChangeSeeker;
import com.booking.realtime.stream.PendingChange;
import com.booking.realtime.stream.StreamCursor;
import com.booking.realtime.stream.publication.PublicationFilter;
import com.booking.realtime.visibility.VisibilityEngine;

import com.codahale.metrics.Gauge;
import com.codahale.metrics.Timer;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single sequential reader of the change stream.
 *
 * Every poll peeks a batch, drops what was dispatched before a restart and what the
 * publication does not capture, then decodes, evaluates and dispatches the rest in commit
 * order. The cursor is advanced only through changes the dispatcher accepted: a decode
 * failure, an evaluation failure or a refusal stalls the stream at the failing change, which
 * is retried on the next poll.
 */
public class VisibilityPipeline {
    private static final Logger LOG = LogManager.getLogger(VisibilityPipeline.class);

    public interface Configuration {
        String BATCH_SIZE = "pipeline.batch.size";
        String RETRY_INTERVAL = "pipeline.retry.interval.ms";
        String IDLE_INTERVAL = "pipeline.idle.interval.ms";
        String CHECKPOINT_PATH = CheckpointStorage.Configuration.PATH;
    }

    public enum Outcome {
        IDLE,
        PROGRESS,
        STALLED
    }

    private static final String METRIC_RECEIVED = "pipeline.changes.received";
    private static final String METRIC_SKIPPED = "pipeline.changes.skipped";
    private static final String METRIC_DISPATCHED = "pipeline.changes.dispatched";
    private static final String METRIC_DECODE_ERRORS = "pipeline.errors.decode";
    private static final String METRIC_EVALUATION_ERRORS = "pipeline.errors.evaluation";
    private static final String METRIC_REFUSED = "pipeline.errors.refused";
    private static final String METRIC_STREAM_ERRORS = "pipeline.errors.stream";
    private static final String METRIC_DELAY = "pipeline.delay";
    private static final String METRIC_POLL = "pipeline.poll";

    private final StreamCursor cursor;
    private final ChangeDecoder decoder;
    private final VisibilityEngine engine;
    private final Dispatcher dispatcher;
    private final CheckpointStorage checkpointStorage;
    private final String checkpointPath;
    private final Metrics<?> metrics;
    private final int batchSize;
    private final long retryIntervalMillis;
    private final long idleIntervalMillis;
    private final ChangeSeeker seeker;
    private final AtomicLong lastCommitMillis;
    private final AtomicBoolean running;
    private final ExecutorService executor;

    public VisibilityPipeline(StreamCursor cursor, ChangeDecoder decoder, VisibilityEngine engine, Dispatcher dispatcher, CheckpointStorage checkpointStorage, String checkpointPath, Metrics<?> metrics, int batchSize, long retryIntervalMillis, long idleIntervalMillis) throws IOException {
        if (batchSize <= 0) {
            throw new IllegalArgumentException(String.format("%s must be positive: %d", Configuration.BATCH_SIZE, batchSize));
        }

        this.cursor = cursor;
        this.decoder = decoder;
        this.engine = engine;
        this.dispatcher = dispatcher;
        this.checkpointStorage = checkpointStorage;
        this.checkpointPath = Objects.requireNonNull(checkpointPath, String.format("Configuration required: %s", Configuration.CHECKPOINT_PATH));
        this.metrics = metrics;
        this.batchSize = batchSize;
        this.retryIntervalMillis = retryIntervalMillis;
        this.idleIntervalMillis = idleIntervalMillis;
        this.lastCommitMillis = new AtomicLong(0L);
        this.running = new AtomicBoolean(false);
        this.executor = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder().setNameFormat("visibility-pipeline-%d").build());

        Checkpoint checkpoint = this.checkpointStorage.loadCheckpoint(this.checkpointPath);

        if (checkpoint != null) {
            this.lastCommitMillis.set(checkpoint.getTimestamp());
        }

        this.seeker = new ChangeSeeker(checkpoint);

        this.metrics.register(VisibilityPipeline.METRIC_DELAY, (Gauge<Long>) () -> {
            long lastCommit = this.lastCommitMillis.get();
            return (lastCommit > 0L) ? (System.currentTimeMillis() - lastCommit) : 0L;
        });
    }

    /**
     * Handles at most one batch of pending changes.
     */
    public Outcome poll() throws IOException {
        try (Timer.Context ignored = this.metrics.timer(VisibilityPipeline.METRIC_POLL).time()) {
            List<PendingChange> changes = this.cursor.peek(this.batchSize);

            if (changes.isEmpty()) {
                return Outcome.IDLE;
            }

            this.metrics.incrementCounter(VisibilityPipeline.METRIC_RECEIVED, changes.size());

            List<PendingChange> fresh = this.seeker.apply(changes);
            PublicationFilter publicationFilter = new PublicationFilter(this.cursor.getPublication());

            StreamPosition acknowledged = null;
            Checkpoint dispatched = null;
            boolean stalled = false;

            for (PendingChange change : changes) {
                if (!fresh.contains(change)) {
                    acknowledged = change.getPosition();
                    continue;
                }

                if (!publicationFilter.test(change)) {
                    this.metrics.incrementCounter(VisibilityPipeline.METRIC_SKIPPED, 1L);
                    acknowledged = change.getPosition();
                    continue;
                }

                ChangeEvent event = this.decode(change);

                if (event == null) {
                    stalled = true;
                    break;
                }

                if (!this.dispatch(change, event)) {
                    stalled = true;
                    break;
                }

                this.metrics.incrementCounter(VisibilityPipeline.METRIC_DISPATCHED, 1L);

                dispatched = new Checkpoint(change.getPosition(), event.getCommitTimestamp().toInstant().toEpochMilli());
                acknowledged = change.getPosition();
            }

            if (dispatched != null) {
                this.checkpointStorage.saveCheckpoint(this.checkpointPath, dispatched);
                this.seeker.seek(dispatched);
                this.lastCommitMillis.set(dispatched.getTimestamp());
            }

            if (acknowledged != null) {
                this.cursor.advance(acknowledged);
            }

            return stalled ? Outcome.STALLED : Outcome.PROGRESS;
        }
    }

    private ChangeEvent decode(PendingChange change) {
        try {
            return this.decoder.decode(change.getData());
        } catch (DecodeException exception) {
            this.metrics.incrementCounter(VisibilityPipeline.METRIC_DECODE_ERRORS, 1L);
            this.metrics.incrementCounter(String.format("%s.%s", VisibilityPipeline.METRIC_DECODE_ERRORS, exception.getReason().name().toLowerCase(Locale.ROOT)), 1L);

            VisibilityPipeline.LOG.error(String.format("cannot decode change at %s (%s, field %s): %s", change.getPosition(), exception.getReason(), exception.getField(), exception.getMessage()), exception);

            return null;
        }
    }

    private boolean dispatch(PendingChange change, ChangeEvent event) {
        VisibilityResult result;

        try {
            result = this.engine.apply(event);
        } catch (IOException | UncheckedIOException exception) {
            this.metrics.incrementCounter(VisibilityPipeline.METRIC_EVALUATION_ERRORS, 1L);

            VisibilityPipeline.LOG.error(String.format("cannot evaluate change at %s", change.getPosition()), exception);

            return false;
        }

        Boolean accepted;

        try {
            accepted = this.dispatcher.apply(result);
        } catch (UncheckedIOException exception) {
            VisibilityPipeline.LOG.error(String.format("error dispatching change at %s", change.getPosition()), exception);

            accepted = false;
        }

        if (!Boolean.TRUE.equals(accepted)) {
            this.metrics.incrementCounter(VisibilityPipeline.METRIC_REFUSED, 1L);

            VisibilityPipeline.LOG.warn(String.format("dispatcher refused change at %s", change.getPosition()));

            return false;
        }

        return true;
    }

    /**
     * Polls until stopped, pausing after an empty batch and before retrying a stalled one.
     */
    public void run() {
        while (this.running.get()) {
            Outcome outcome;

            try {
                outcome = this.poll();
            } catch (IOException | UncheckedIOException exception) {
                this.metrics.incrementCounter(VisibilityPipeline.METRIC_STREAM_ERRORS, 1L);

                VisibilityPipeline.LOG.error("error reading the change stream", exception);

                outcome = Outcome.STALLED;
            }

            try {
                if (outcome == Outcome.STALLED) {
                    Thread.sleep(this.retryIntervalMillis);
                } else if (outcome == Outcome.IDLE) {
                    Thread.sleep(this.idleIntervalMillis);
                }
            } catch (InterruptedException exception) {
                VisibilityPipeline.LOG.info("pipeline interrupted");
                Thread.currentThread().interrupt();
                this.running.set(false);
            }
        }
    }

    public void start() {
        if (this.running.compareAndSet(false, true)) {
            VisibilityPipeline.LOG.info("starting pipeline");
            this.executor.submit(this::run);
        }
    }

    public void stop() {
        VisibilityPipeline.LOG.info("stopping pipeline");

        this.running.set(false);
        this.executor.shutdownNow();
    }

    public boolean wait(long timeout, TimeUnit unit) throws InterruptedException {
        return this.executor.awaitTermination(timeout, unit);
    }

    public boolean isRunning() {
        return this.running.get();
    }

    public static VisibilityPipeline build(Map<String, Object> configuration, StreamCursor cursor, VisibilityEngine engine, Dispatcher dispatcher, CheckpointStorage checkpointStorage, Metrics<?> metrics) throws IOException {
        Object checkpointPath = configuration.get(Configuration.CHECKPOINT_PATH);

        Objects.requireNonNull(checkpointPath, String.format("Configuration required: %s", Configuration.CHECKPOINT_PATH));

        int batchSize = Integer.parseInt(configuration.getOrDefault(Configuration.BATCH_SIZE, "100").toString());
        long retryInterval = Long.parseLong(configuration.getOrDefault(Configuration.RETRY_INTERVAL, "1000").toString());
        long idleInterval = Long.parseLong(configuration.getOrDefault(Configuration.IDLE_INTERVAL, "200").toString());

        return new VisibilityPipeline(cursor, new ChangeDecoder(), engine, dispatcher, checkpointStorage, checkpointPath.toString(), metrics, batchSize, retryInterval, idleInterval);
    }
}
