package io.github.drompincen.restochat.runtime.lock;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadLockServiceTest {

    private final ThreadLockService locks = new ThreadLockService();

    @Test
    void secondCallerTimesOutWhileFirstHoldsThread() throws Exception {
        assertThat(locks.tryAcquire("t1", Duration.ofMillis(100))).isTrue();

        boolean other = CompletableFuture.supplyAsync(() -> locks.tryAcquire("t1", Duration.ofMillis(100)))
                .get(5, TimeUnit.SECONDS);

        assertThat(other).isFalse();
        assertThat(locks.isLocked("t1")).isTrue();
        locks.release("t1");
        assertThat(locks.isLocked("t1")).isFalse();
    }

    @Test
    void differentThreadsDoNotBlockEachOther() throws Exception {
        assertThat(locks.tryAcquire("t1", Duration.ofMillis(100))).isTrue();

        boolean other = CompletableFuture.supplyAsync(() -> {
            boolean acquired = locks.tryAcquire("t2", Duration.ofMillis(100));
            if (acquired) locks.release("t2");
            return acquired;
        }).get(5, TimeUnit.SECONDS);

        assertThat(other).isTrue();
        locks.release("t1");
    }

    @Test
    void waiterGetsLockOnceReleased() throws Exception {
        assertThat(locks.tryAcquire("t1", Duration.ofMillis(100))).isTrue();

        CompletableFuture<Boolean> waiter = CompletableFuture.supplyAsync(() -> {
            boolean acquired = locks.tryAcquire("t1", Duration.ofSeconds(5));
            if (acquired) locks.release("t1");
            return acquired;
        });
        Thread.sleep(50);
        locks.release("t1");

        assertThat(waiter.get(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void entriesAreDroppedWhenIdle() {
        locks.tryAcquire("t1", Duration.ofMillis(100));
        locks.tryAcquire("t2", Duration.ofMillis(100));
        assertThat(locks.trackedThreads()).isEqualTo(2);

        locks.release("t1");
        locks.release("t2");

        assertThat(locks.trackedThreads()).isZero();
    }

    @Test
    void releaseWithoutHoldingIsIgnored() {
        locks.release("unknown");

        assertThat(locks.isLocked("unknown")).isFalse();
        assertThat(locks.trackedThreads()).isZero();
    }
}
