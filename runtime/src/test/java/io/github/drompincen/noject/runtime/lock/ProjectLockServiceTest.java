package io.github.drompincen.noject.runtime.lock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProjectLockServiceTest {

    private ProjectLockService lockService;

    @BeforeEach
    void setUp() {
        lockService = new ProjectLockService();
    }

    @Test
    void sameProjectRunsOneAtATime() throws Exception {
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(6);
        List<Future<Integer>> futures = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            futures.add(pool.submit(() -> lockService.withLock("p1", () -> {
                int seen = maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                Thread.yield();
                inside.decrementAndGet();
                return seen;
            })));
        }
        for (Future<Integer> f : futures) {
            f.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertThat(maxInside.get()).isEqualTo(1);
    }

    @Test
    void differentProjectsDoNotBlockEachOther() throws Exception {
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        Future<Boolean> holder = pool.submit(() -> lockService.withLock("p1", () -> {
            holding.countDown();
            try {
                return release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }));
        assertThat(holding.await(5, TimeUnit.SECONDS)).isTrue();

        String result = lockService.withLock("p2", () -> "done");

        assertThat(result).isEqualTo("done");
        assertThat(lockService.isLocked("p1")).isTrue();
        release.countDown();
        assertThat(holder.get(5, TimeUnit.SECONDS)).isTrue();
        pool.shutdown();
        assertThat(lockService.isLocked("p1")).isFalse();
    }

    @Test
    void lockIsReentrantForTheHoldingThread() {
        int value = lockService.withLock("p1", () -> lockService.withLock("p1", () -> 3));

        assertThat(value).isEqualTo(3);
        assertThat(lockService.isLocked("p1")).isFalse();
    }

    @Test
    void releasesLockWhenActionThrows() {
        assertThatThrownBy(() -> lockService.withLock("p1", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class).hasMessage("boom");

        assertThat(lockService.isLocked("p1")).isFalse();
    }

    @Test
    void evictDropsIdleLocks() {
        lockService.withLock("p1", () -> 1);
        lockService.withLock("p2", () -> 2);
        assertThat(lockService.trackedProjects()).isEqualTo(2);

        lockService.evict("p1");
        lockService.evict("unknown");

        assertThat(lockService.trackedProjects()).isEqualTo(1);
        assertThat(lockService.isLocked("p1")).isFalse();
    }

    @Test
    void evictKeepsHeldLock() {
        lockService.withLock("p1", () -> {
            lockService.evict("p1");
            return null;
        });

        assertThat(lockService.trackedProjects()).isEqualTo(1);
    }
}
