package one.nothere.application.frontier;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class InMemoryFrontierStoreTest {

    private final InMemoryFrontierStore store = new InMemoryFrontierStore();

    @Test
    void should_ReturnUrlsInAdmissionOrder() {
        store.offer("https://a.example/");
        store.offer("https://b.example/");
        store.offer("https://c.example/");

        assertThat(store.poll()).contains("https://a.example/");
        assertThat(store.poll()).contains("https://b.example/");
        assertThat(store.poll()).contains("https://c.example/");
        assertThat(store.poll()).isEmpty();
    }

    @Test
    void should_AdmitUrlOnlyOnce_EvenAfterItWasPolled() {
        assertThat(store.offer("https://a.example/")).isTrue();
        assertThat(store.offer("https://a.example/")).isFalse();

        store.poll();

        assertThat(store.offer("https://a.example/")).isFalse();
        assertThat(store.isMember("https://a.example/")).isTrue();
        assertThat(store.queueSize()).isZero();
        assertThat(store.memberCount()).isEqualTo(1);
    }

    @Test
    void should_ForgetMembership_When_Cleared() {
        store.offer("https://a.example/");
        store.offer("https://b.example/");

        store.clear();

        assertThat(store.queueSize()).isZero();
        assertThat(store.memberCount()).isZero();
        assertThat(store.offer("https://a.example/")).isTrue();
    }

    @Test
    void should_AdmitEachUrlOnce_When_OfferedConcurrently() throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        AtomicInteger admitted = new AtomicInteger();
        for (int i = 0; i < 400; i++) {
            String url = "https://example.com/" + (i % 50);
            executor.submit(() -> {
                if (store.offer(url)) {
                    admitted.incrementAndGet();
                }
            });
        }
        executor.shutdown();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(admitted.get()).isEqualTo(50);
        List<String> drained = new ArrayList<>();
        Optional<String> next;
        while ((next = store.poll()).isPresent()) {
            drained.add(next.get());
        }
        assertThat(drained).hasSize(50).doesNotHaveDuplicates();
    }
}
