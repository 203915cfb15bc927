package one.nothere.application.frontier;

import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.LinkedBlockingQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Process-local frontier.
 * <p>
 * Features:
 * - Idempotent admission via {@link ConcurrentHashMap#putIfAbsent}
 * - FIFO order via {@link LinkedBlockingQueue}
 * - Non-blocking poll; an empty queue means the frontier is exhausted
 */
@Component
@ConditionalOnProperty(prefix = "crawler.frontier", name = "store", havingValue = "memory")
@Slf4j
public class InMemoryFrontierStore implements FrontierStore {

    private final ConcurrentMap<String, Boolean> members = new ConcurrentHashMap<>();
    private final BlockingQueue<String> queue = new LinkedBlockingQueue<>();

    @Override
    public boolean offer(String normalizedUrl) {
        if (members.putIfAbsent(normalizedUrl, Boolean.TRUE) != null) {
            log.debug("URL already in frontier: {}", normalizedUrl);
            return false;
        }
        if (!queue.offer(normalizedUrl)) {
            members.remove(normalizedUrl);
            log.error("Failed to enqueue URL (queue full?): {}", normalizedUrl);
            return false;
        }
        return true;
    }

    @Override
    public Optional<String> poll() {
        return Optional.ofNullable(queue.poll());
    }

    @Override
    public boolean isMember(String normalizedUrl) {
        return members.containsKey(normalizedUrl);
    }

    @Override
    public long queueSize() {
        return queue.size();
    }

    @Override
    public long memberCount() {
        return members.size();
    }

    @Override
    public void clear() {
        queue.clear();
        members.clear();
    }
}
