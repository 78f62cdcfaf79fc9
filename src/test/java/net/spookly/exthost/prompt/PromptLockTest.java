package net.spookly.exthost.prompt;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import io.grpc.Context;
import net.spookly.exthost.error.OperationCancelledException;
import org.junit.jupiter.api.Test;

class PromptLockTest {
    @Test
    void onlyOneHolderAtATime() throws Exception {
        PromptLock lock = new PromptLock();
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        AtomicInteger completed = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(16);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 50; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    try (PromptLock.Release ignored = lock.acquire(Context.ROOT)) {
                        int now = active.incrementAndGet();
                        maxActive.accumulateAndGet(now, Math::max);
                        Thread.sleep(1);
                        active.decrementAndGet();
                        completed.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(50, completed.get());
        assertEquals(1, maxActive.get());
        assertFalse(lock.isHeld());
    }

    @Test
    void grantsInArrivalOrder() throws Exception {
        PromptLock lock = new PromptLock();
        PromptLock.Release first = lock.acquire(Context.ROOT);
        List<Integer> order = new CopyOnWriteArrayList<>();
        List<CompletableFuture<Void>> waiters = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            int id = i;
            waiters.add(CompletableFuture.runAsync(() -> {
                try (PromptLock.Release ignored = lock.acquire(Context.ROOT)) {
                    order.add(id);
                }
            }));
            awaitWaiting(lock, i + 1);
        }

        first.close();
        for (CompletableFuture<Void> waiter : waiters) {
            waiter.get(2, TimeUnit.SECONDS);
        }

        assertEquals(List.of(0, 1, 2), order);
    }

    @Test
    void releaseIsIdempotent() {
        PromptLock lock = new PromptLock();
        PromptLock.Release release = lock.acquire(Context.ROOT);
        release.close();
        PromptLock.Release second = lock.acquire(Context.ROOT);

        release.close();

        assertTrue(lock.isHeld());
        second.close();
        assertFalse(lock.isHeld());
    }

    @Test
    void cancelledWaiterNeverHoldsTheSlot() throws Exception {
        PromptLock lock = new PromptLock();
        PromptLock.Release holder = lock.acquire(Context.ROOT);
        Context.CancellableContext context = Context.current().withCancellation();

        CompletableFuture<PromptLock.Release> waiter = CompletableFuture.supplyAsync(() -> lock.acquire(context));
        awaitWaiting(lock, 1);
        context.cancel(null);

        ExecutionException failure = assertThrows(ExecutionException.class, () -> waiter.get(2, TimeUnit.SECONDS));
        assertInstanceOf(OperationCancelledException.class, failure.getCause());
        assertEquals(0, lock.waiting());

        holder.close();
        assertFalse(lock.isHeld());
        lock.acquire(Context.ROOT).close();
    }

    @Test
    void alreadyCancelledContextFailsFast() {
        PromptLock lock = new PromptLock();
        Context.CancellableContext context = Context.current().withCancellation();
        context.cancel(null);

        assertThrows(OperationCancelledException.class, () -> lock.acquire(context));
        assertFalse(lock.isHeld());
    }

    private static void awaitWaiting(PromptLock lock, int expected) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (lock.waiting() < expected) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("expected " + expected + " waiter(s)");
            }
            Thread.sleep(5);
        }
    }
}
