package oneshot;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The single cell shared by a {@link Promise} and its {@link Future}.
 *
 * <p>Holds either a value or a failure once {@code ready} is set. {@code ready} goes from
 * {@code false} to {@code true} exactly once and never back. All fields are guarded by
 * {@link #lock}; readers park on {@link #readyCondition} until a writer signals it.
 *
 * @param <T> the type of the value
 * @since 0.1.0
 */
final class SharedState<T> {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition readyCondition = lock.newCondition();

    private T value;
    // null is a legal value, so presence is tracked separately
    private boolean hasValue;
    private Throwable failure;
    private boolean ready;

    void writeValue(T v) {
        lock.lock();
        try {
            checkNotReady();
            value = v;
            hasValue = true;
            markReady();
        } finally {
            lock.unlock();
        }
    }

    void writeFailure(Throwable t) {
        if (t == null) {
            throw new IllegalArgumentException("failure must not be null");
        }
        lock.lock();
        try {
            checkNotReady();
            failure = t;
            markReady();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Like {@link #writeFailure(Throwable)}, but reports an outcome that is already in place
     * by returning {@code false}.
     */
    boolean tryWriteFailure(Throwable t) {
        lock.lock();
        try {
            if (ready) {
                return false;
            }
            failure = t;
            markReady();
            return true;
        } finally {
            lock.unlock();
        }
    }

    T read() throws InterruptedException {
        lock.lock();
        try {
            awaitReady();
            if (failure != null) {
                rethrow(failure);
            }
            if (!hasValue) {
                throw new FutureException(FutureErrorCode.INTERNAL_INCONSISTENCY);
            }
            return value;
        } finally {
            lock.unlock();
        }
    }

    boolean pollReady() {
        lock.lock();
        try {
            return ready;
        } finally {
            lock.unlock();
        }
    }

    void blockUntilReady() throws InterruptedException {
        lock.lock();
        try {
            awaitReady();
        } finally {
            lock.unlock();
        }
    }

    private void awaitReady() throws InterruptedException {
        while (!ready) {
            readyCondition.await();
        }
    }

    private void checkNotReady() {
        if (ready) {
            throw new FutureException(FutureErrorCode.PROMISE_ALREADY_SATISFIED);
        }
    }

    private void markReady() {
        ready = true;
        readyCondition.signalAll();
    }

    private static void rethrow(Throwable e) {
        if (e instanceof RuntimeException) {
            throw (RuntimeException) e;
        } else if (e instanceof Error) {
            throw (Error) e;
        } else {
            throw new IllegalStateException("Execution failed", e);
        }
    }
}
