package io.github.drompincen.webdeck.runtime.cancel;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class CancellationTokenTest {

    @Test
    void onlyFirstCancelFlipsToken() {
        CancellationToken token = new CancellationToken("r1", Instant.now());

        assertThat(token.cancel()).isTrue();
        assertThat(token.cancel()).isFalse();
        assertThat(token.isCancelled()).isTrue();
    }

    @Test
    void callbackRegisteredAfterCancelRunsImmediately() {
        CancellationToken token = new CancellationToken("r1", Instant.now());
        token.cancel();
        List<String> calls = new ArrayList<>();

        token.onCancel(() -> calls.add("late"));

        assertThat(calls).containsExactly("late");
    }

    @Test
    void failingCallbackDoesNotStopOthers() {
        CancellationToken token = new CancellationToken("r1", Instant.now());
        List<String> calls = new ArrayList<>();
        token.onCancel(() -> { throw new IllegalStateException("boom"); });
        token.onCancel(() -> calls.add("second"));

        token.cancel();

        assertThat(calls).containsExactly("second");
    }

    @Test
    void concurrentCancelRunsEachCallbackOnce() throws Exception {
        CancellationToken token = new CancellationToken("r1", Instant.now());
        AtomicInteger calls = new AtomicInteger();
        AtomicInteger winners = new AtomicInteger();
        token.onCancel(calls::incrementAndGet);

        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch go = new CountDownLatch(1);
        for (int i = 0; i < 8; i++) {
            pool.submit(() -> {
                go.await();
                if (token.cancel()) {
                    winners.incrementAndGet();
                }
                return null;
            });
        }
        go.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        assertThat(winners.get()).isEqualTo(1);
        assertThat(calls.get()).isEqualTo(1);
    }
}
