package oneshot;

import java.lang.ref.Cleaner;
import java.lang.ref.Reference;
import java.util.concurrent.Callable;

/**
 * The write side of a one-shot handoff: the single capability to put a value or a failure
 * into a shared state that a {@link Future} observes.
 *
 * <h2>Usage Examples</h2>
 *
 * <pre>{@code
 * Promise<Integer> promise = new Promise<>();
 * Future<Integer> future = promise.getFuture();
 *
 * Promise<Integer> producer = promise.transfer();
 * new Thread(() -> {
 *     try (Promise<Integer> p = producer) {
 *         p.setValue(42);
 *     }
 * }).start();
 *
 * int answer = future.get(); // 42
 * }</pre>
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>At most one outcome is ever written. A second {@link #setValue(Object)} or
 *       {@link #setFailure(Throwable)} fails with {@link FutureErrorCode#PROMISE_ALREADY_SATISFIED}
 *       and the first outcome stays in place.</li>
 *   <li>At most one {@link Future} is issued per promise.</li>
 *   <li>A promise has a single owner. {@link #transfer()} hands ownership to a new promise and
 *       leaves this one empty; every later operation on the empty promise fails with
 *       {@link FutureErrorCode#NO_STATE}.</li>
 *   <li>A promise that is {@linkplain #close() closed} without writing, after its future was
 *       issued, breaks: the future observes {@link FutureErrorCode#BROKEN_PROMISE}. With
 *       {@link Options#isDetectAbandonment()} on, the same happens when the promise becomes
 *       unreachable without being closed, whenever the garbage collector notices.</li>
 * </ul>
 *
 * <p>A promise is not safe for concurrent use by multiple threads. Hand it over with
 * {@link #transfer()} instead of sharing it.
 *
 * @param <T> the type of the value
 * @since 0.1.0
 */
public final class Promise<T> implements AutoCloseable {

    private static final Cleaner CLEANER = Cleaner.create();

    private final Options options;

    /**
     * {@code null} once this promise has been transferred or closed.
     */
    private Guard<T> guard;

    private Cleaner.Cleanable cleanable;

    /**
     * Creates a new promise with default options.
     */
    public Promise() {
        this(Options.DEFAULT);
    }

    /**
     * Creates a new promise with the specified options.
     *
     * @param options the options to use for this promise
     */
    public Promise(Options options) {
        this(options, new Guard<>(new SharedState<>()));
    }

    private Promise(Options options, Guard<T> guard) {
        if (options == null) {
            throw new IllegalArgumentException("options must not be null");
        }
        this.options = options;
        this.guard = guard;
        if (options.isDetectAbandonment()) {
            this.cleanable = CLEANER.register(this, guard);
        }
    }

    /**
     * Issues the future bound to this promise's state.
     *
     * @return the future
     * @throws FutureException with {@link FutureErrorCode#FUTURE_ALREADY_RETRIEVED} if a future was
     *                         already issued, or {@link FutureErrorCode#NO_STATE} if this promise is empty
     */
    public Future<T> getFuture() {
        try {
            Guard<T> g = requireGuard();
            if (g.futureIssued) {
                throw new FutureException(FutureErrorCode.FUTURE_ALREADY_RETRIEVED);
            }
            g.futureIssued = true;
            return new Future<>(g.state);
        } finally {
            Reference.reachabilityFence(this);
        }
    }

    /**
     * Writes the value and wakes the future's readers.
     *
     * @param value the value, may be {@code null}
     * @throws FutureException with {@link FutureErrorCode#PROMISE_ALREADY_SATISFIED} if an outcome was
     *                         already written, or {@link FutureErrorCode#NO_STATE} if this promise is empty
     */
    public void setValue(T value) {
        try {
            requireGuard().state.writeValue(value);
        } finally {
            Reference.reachabilityFence(this);
        }
    }

    /**
     * Writes the failure and wakes the future's readers, who receive it from {@link Future#get()}.
     *
     * @param failure the failure. Must not be {@code null}.
     * @throws IllegalArgumentException if {@code failure} is {@code null}
     * @throws FutureException          with {@link FutureErrorCode#PROMISE_ALREADY_SATISFIED} if an
     *                                  outcome was already written, or {@link FutureErrorCode#NO_STATE}
     *                                  if this promise is empty
     */
    public void setFailure(Throwable failure) {
        try {
            requireGuard().state.writeFailure(failure);
        } finally {
            Reference.reachabilityFence(this);
        }
    }

    /**
     * Runs {@code callable} on the calling thread and writes what it returns, or what it throws.
     *
     * <p>An {@link InterruptedException} thrown by the callable is written as the failure and the
     * interrupt status of the calling thread is restored.
     *
     * @param callable the operation producing the value. Must not be {@code null}.
     * @throws IllegalArgumentException if {@code callable} is {@code null}
     * @throws FutureException          with {@link FutureErrorCode#PROMISE_ALREADY_SATISFIED} if an
     *                                  outcome was already written, or {@link FutureErrorCode#NO_STATE}
     *                                  if this promise is empty. The callable is not run in either case.
     */
    public void complete(Callable<? extends T> callable) {
        if (callable == null) {
            throw new IllegalArgumentException("callable must not be null");
        }
        try {
            SharedState<T> state = requireGuard().state;
            if (state.pollReady()) {
                throw new FutureException(FutureErrorCode.PROMISE_ALREADY_SATISFIED);
            }

            T value;
            try {
                value = callable.call();
            } catch (Throwable e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                state.writeFailure(e);
                return;
            }
            state.writeValue(value);
        } finally {
            // the cleaner must not break this promise while the callable runs
            Reference.reachabilityFence(this);
        }
    }

    /**
     * Hands this promise's state, and the right to write it, to a new promise.
     * This promise is left empty.
     *
     * @return the promise now owning the state
     * @throws FutureException with {@link FutureErrorCode#NO_STATE} if this promise is already empty
     */
    public Promise<T> transfer() {
        try {
            Guard<T> g = requireGuard();
            Guard<T> moved = new Guard<>(g.state);
            moved.futureIssued = g.futureIssued;

            g.state = null;
            release();
            return new Promise<>(options, moved);
        } finally {
            Reference.reachabilityFence(this);
        }
    }

    /**
     * @return {@code true} if this promise still owns a state
     */
    public boolean isValid() {
        return guard != null;
    }

    /**
     * Releases this promise. If its future was issued and no outcome was written, the future
     * observes a {@link FutureException} with {@link FutureErrorCode#BROKEN_PROMISE}.
     *
     * <p>Does nothing on an empty promise. The promise is empty afterwards.
     */
    @Override
    public void close() {
        if (guard != null) {
            release();
        }
    }

    private void release() {
        Guard<T> g = guard;
        guard = null;
        if (cleanable != null) {
            // runs the guard at most once, whether here or from the cleaner thread
            cleanable.clean();
            cleanable = null;
        } else {
            g.run();
        }
    }

    private Guard<T> requireGuard() {
        Guard<T> g = guard;
        if (g == null) {
            throw new FutureException(FutureErrorCode.NO_STATE);
        }
        return g;
    }

    /**
     * Teardown of a promise. Must not reference the promise itself, or the cleaner would never
     * see it become unreachable.
     */
    private static final class Guard<T> implements Runnable {

        private volatile SharedState<T> state;
        private volatile boolean futureIssued;

        Guard(SharedState<T> state) {
            this.state = state;
        }

        @Override
        public void run() {
            SharedState<T> s = state;
            state = null;
            // no future, no reader to wake
            if (s != null && futureIssued) {
                s.tryWriteFailure(new FutureException(FutureErrorCode.BROKEN_PROMISE));
            }
        }
    }

    /**
     * Configuration options for Promise behavior.
     *
     * @since 0.1.0
     */
    public static final class Options {
        /**
         * Default options.
         */
        public static final Options DEFAULT =
                Options.builder().detectAbandonment(true).build();

        /**
         * Whether to break a promise that becomes unreachable without being closed.
         *
         * <p> If {@code true}, each promise registers with a {@link Cleaner}, and a promise that is
         * garbage collected without having written breaks its future just as {@link Promise#close()}
         * would. When that happens depends on the garbage collector.
         *
         * <p> If {@code false}, only an explicit {@link Promise#close()} breaks the promise, and a
         * reader of a forgotten promise waits forever.
         *
         * <p>Default is {@code true}.
         */
        private final boolean detectAbandonment;

        Options(OptionsBuilder builder) {
            this.detectAbandonment = builder.detectAbandonment;
        }

        public static OptionsBuilder builder() {
            return new OptionsBuilder();
        }

        public boolean isDetectAbandonment() {
            return this.detectAbandonment;
        }

        public OptionsBuilder toBuilder() {
            return new OptionsBuilder().detectAbandonment(this.detectAbandonment);
        }

        public static class OptionsBuilder {
            private boolean detectAbandonment;

            OptionsBuilder() {}

            public OptionsBuilder detectAbandonment(boolean detectAbandonment) {
                this.detectAbandonment = detectAbandonment;
                return this;
            }

            public Options build() {
                return new Options(this);
            }

            public String toString() {
                return "Promise.Options.OptionsBuilder(detectAbandonment=" + this.detectAbandonment + ")";
            }
        }
    }
}
