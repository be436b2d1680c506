package flowescrow.escrow.service;

import flowescrow.escrow.model.EscrowError;
import flowescrow.escrow.model.EscrowException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class ReentrancyGuardTest {

    private final ReentrancyGuard guard = new ReentrancyGuard();

    @Test
    void nestedEnterIsRejected() {
        try (ReentrancyGuard.Scope ignored = guard.enter()) {
            assertTrue(guard.isEntered());
            EscrowException e = assertThrows(EscrowException.class, guard::enter);
            assertEquals(EscrowError.REENTRANT_CALL, e.error());
            // the rejected attempt must not release the outer hold
            assertTrue(guard.isEntered());
        }
        assertFalse(guard.isEntered());
    }

    @Test
    void releasedOnException() {
        assertThrows(IllegalStateException.class, () -> {
            try (ReentrancyGuard.Scope ignored = guard.enter()) {
                throw new IllegalStateException("boom");
            }
        });
        assertFalse(guard.isEntered());

        try (ReentrancyGuard.Scope ignored = guard.enter()) {
            assertTrue(guard.isEntered());
        }
    }

    @Test
    void closeIsIdempotent() {
        ReentrancyGuard.Scope scope = guard.enter();
        scope.close();
        scope.close();
        assertFalse(guard.isEntered());
    }

    @Test
    void otherThreadsWaitInsteadOfFailing() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean secondEntered = new AtomicBoolean();

        Thread first = new Thread(() -> {
            try (ReentrancyGuard.Scope ignored = guard.enter()) {
                entered.countDown();
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        first.start();
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        Thread second = new Thread(() -> {
            try (ReentrancyGuard.Scope ignored = guard.enter()) {
                secondEntered.set(true);
            }
        });
        second.start();
        second.join(200);
        assertFalse(secondEntered.get());

        release.countDown();
        second.join(5_000);
        first.join(5_000);
        assertTrue(secondEntered.get());
    }
}
