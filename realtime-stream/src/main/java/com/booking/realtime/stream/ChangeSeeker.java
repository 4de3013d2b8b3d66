package com.booking.realtime.stream;

import com.booking.realtime.commons.checkpoint.Checkpoint;
import com.booking.realtime.commons.checkpoint.StreamPosition;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Drops redelivered changes that were already dispatched before a restart, i.e. changes at or
 * before the last dispatched checkpoint.
 */
public class ChangeSeeker implements Function<List<PendingChange>, List<PendingChange>> {
    private static final Logger LOG = LogManager.getLogger(ChangeSeeker.class);

    private StreamPosition dispatched;

    public ChangeSeeker(Checkpoint checkpoint) {
        this.seek(checkpoint);
    }

    public void seek(Checkpoint checkpoint) {
        this.dispatched = (checkpoint != null) ? checkpoint.getPosition() : null;

        if (this.dispatched != null) {
            ChangeSeeker.LOG.info(String.format("seeking past %s", this.dispatched));
        }
    }

    @Override
    public List<PendingChange> apply(List<PendingChange> changes) {
        if (this.dispatched == null) {
            return changes;
        }

        List<PendingChange> sought = new ArrayList<>(changes.size());

        for (PendingChange change : changes) {
            if (change.getPosition().isAfter(this.dispatched)) {
                sought.add(change);
            } else {
                ChangeSeeker.LOG.debug(String.format("skipping already dispatched change at %s", change.getPosition()));
            }
        }

        return sought;
    }
}
