package flowescrow.escrow.service;

import flowescrow.escrow.model.EscrowError;
import flowescrow.escrow.model.EscrowException;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Non-reentrant execution lock held for the whole of each mutating escrow operation.
 * <p>
 * Calls from different threads are serialized in arrival order. A nested call on a thread
 * that already holds the lock (for example from inside an asset transfer) is rejected with
 * {@link EscrowError#REENTRANT_CALL} instead of being let through.
 *
 * <pre>
 * try (ReentrancyGuard.Scope ignored = guard.enter()) {
 *     // validate, mutate, transfer, record
 * }
 * </pre>
 */
public final class ReentrancyGuard {

    private final ReentrantLock lock = new ReentrantLock(true);

    /**
     * Held lock, released by {@link #close()} on every exit path.
     */
    public final class Scope implements AutoCloseable {
        private boolean released;

        private Scope() {
        }

        @Override
        public void close() {
            if (!released) {
                released = true;
                lock.unlock();
            }
        }
    }

    /**
     * Acquire the lock, waiting for operations on other threads to finish.
     *
     * @throws EscrowException with {@code REENTRANT_CALL} if this thread is already inside an operation
     */
    public Scope enter() {
        if (lock.isHeldByCurrentThread()) {
            throw new EscrowException(EscrowError.REENTRANT_CALL, "nested call into a mutating operation");
        }
        lock.lock();
        return new Scope();
    }

    /** True while the current thread is inside a guarded operation */
    public boolean isEntered() {
        return lock.isHeldByCurrentThread();
    }
}
