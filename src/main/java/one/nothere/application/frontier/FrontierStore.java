package one.nothere.application.frontier;

import java.util.Optional;

/**
 * FIFO queue of normalized URLs with a companion membership set.
 *
 * <p>Membership is recorded on admission and never released by {@link #poll()},
 * so a URL is admitted at most once per store lifetime unless {@link #clear()} is called.</p>
 */
public interface FrontierStore {

    /**
     * Records membership and appends the URL to the queue as one atomic step.
     *
     * @return false when the URL was already a member
     */
    boolean offer(String normalizedUrl);

    /**
     * Removes and returns the oldest queued URL.
     */
    Optional<String> poll();

    boolean isMember(String normalizedUrl);

    long queueSize();

    long memberCount();

    /**
     * Empties both the queue and the membership set.
     */
    void clear();
}
