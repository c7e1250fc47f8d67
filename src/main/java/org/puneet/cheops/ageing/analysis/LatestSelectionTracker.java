package org.puneet.cheops.ageing.analysis;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Last-selection-wins bookkeeping for superseded computations.
 *
 * <p>Each new selection takes a ticket. A completed result is published only if its ticket is
 * still the most recent one; results of superseded selections are dropped. No cancellation is
 * signalled to the computation itself.</p>
 *
 * @param <R> result type
 * @author CHEOPS Ageing Monitoring Framework
 * @version 1.0.0
 * @since 2025-09-02
 */
public class LatestSelectionTracker<R> {

    private final AtomicLong lastIssued = new AtomicLong();
    private final Object lock = new Object();

    private long publishedTicket;
    private R latest;

    /**
     * @return a ticket that supersedes every earlier one
     */
    public long nextTicket() {
        return lastIssued.incrementAndGet();
    }

    public boolean isCurrent(long ticket) {
        return ticket == lastIssued.get();
    }

    /**
     * @return true if the result was accepted, false if a newer selection exists
     */
    public boolean publish(long ticket, R result) {
        synchronized (lock) {
            if (!isCurrent(ticket) || ticket <= publishedTicket) {
                return false;
            }
            publishedTicket = ticket;
            latest = result;
            return true;
        }
    }

    public Optional<R> getLatest() {
        synchronized (lock) {
            return Optional.ofNullable(latest);
        }
    }
}
