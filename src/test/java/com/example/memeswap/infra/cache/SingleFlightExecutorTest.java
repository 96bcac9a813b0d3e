package com.example.memeswap.infra.cache;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SingleFlightExecutorTest {

    private final ExecutorService executor = Executors.newCachedThreadPool();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void concurrentCallersShareOneExecution() throws Exception {
        SingleFlightExecutor flights = new SingleFlightExecutor(executor);
        AtomicInteger runs = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);

        List<SingleFlightExecutor.Flight<String>> joined = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            joined.add(flights.execute("k", () -> {
                runs.incrementAndGet();
                release.await();
                return "done";
            }));
        }
        assertThat(flights.isInFlight("k")).isTrue();
        release.countDown();

        for (SingleFlightExecutor.Flight<String> f : joined) {
            assertThat(f.future().get(5, TimeUnit.SECONDS)).isEqualTo("done");
        }
        assertThat(runs.get()).isEqualTo(1);
        assertThat(joined).filteredOn(SingleFlightExecutor.Flight::leader).hasSize(1);
    }

    @Test
    void keyIsFreedAfterCompletion() throws Exception {
        SingleFlightExecutor flights = new SingleFlightExecutor(executor);
        AtomicInteger runs = new AtomicInteger();

        flights.execute("k", runs::incrementAndGet).future().get(5, TimeUnit.SECONDS);
        awaitIdle(flights, "k");
        flights.execute("k", runs::incrementAndGet).future().get(5, TimeUnit.SECONDS);

        assertThat(runs.get()).isEqualTo(2);
    }

    @Test
    void failurePropagatesAndAllowsRetry() throws Exception {
        SingleFlightExecutor flights = new SingleFlightExecutor(executor);

        SingleFlightExecutor.Flight<String> failed = flights.execute("k", () -> {
            throw new IllegalStateException("boom");
        });
        assertThatThrownBy(() -> failed.future().get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasRootCauseMessage("boom");
        awaitIdle(flights, "k");

        assertThat(flights.execute("k", () -> "ok").future().get(5, TimeUnit.SECONDS)).isEqualTo("ok");
    }

    @Test
    void abandoningAFlightDoesNotStopIt() throws Exception {
        SingleFlightExecutor flights = new SingleFlightExecutor(executor);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch finished = new CountDownLatch(1);

        SingleFlightExecutor.Flight<String> leader = flights.execute("k", () -> {
            release.await();
            finished.countDown();
            return "v";
        });
        SingleFlightExecutor.Flight<String> joiner = flights.execute("k", () -> "never");

        leader.future().cancel(true);
        joiner.future().cancel(true);
        release.countDown();

        assertThat(finished.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void completionCallbackStartsAFreshFlight() throws Exception {
        SingleFlightExecutor flights = new SingleFlightExecutor(executor);
        CountDownLatch release = new CountDownLatch(1);
        CompletableFuture<Boolean> followUpLeader = new CompletableFuture<>();

        SingleFlightExecutor.Flight<String> first = flights.execute("k", () -> {
            release.await();
            return "first";
        });
        first.future().whenComplete((v, ex) ->
                followUpLeader.complete(flights.execute("k", () -> "second").leader()));
        release.countDown();

        assertThat(followUpLeader.get(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void differentKeysRunIndependently() throws Exception {
        SingleFlightExecutor flights = new SingleFlightExecutor(executor);

        assertThat(flights.execute("a", () -> 1).future().get(5, TimeUnit.SECONDS)).isEqualTo(1);
        assertThat(flights.execute("b", () -> 2).future().get(5, TimeUnit.SECONDS)).isEqualTo(2);
    }

    private static void awaitIdle(SingleFlightExecutor flights, String key) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (flights.isInFlight(key) && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
    }
}
