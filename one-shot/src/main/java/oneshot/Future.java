package oneshot;

/**
 * The read side of a one-shot handoff, obtained from {@link Promise#getFuture()}.
 *
 * <p>A future observes the outcome its promise writes: {@link #isReady()} peeks,
 * {@link #await()} parks until the outcome is in place, and {@link #get()} parks and then
 * returns the value or throws the failure. Reading does not consume the outcome, so
 * {@link #get()} may be called any number of times and always observes the same result.
 *
 * <p>There are no timed waits. A reader stays parked until the promise writes, or until
 * the promise is closed (or collected) without writing, in which case the reader observes
 * a {@link FutureErrorCode#BROKEN_PROMISE} failure.
 *
 * <pre>{@code
 * Promise<User> promise = new Promise<>();
 * Future<User> future = promise.getFuture();
 * executor.execute(() -> {
 *     try (Promise<User> p = promise) {
 *         p.complete(() -> database.findUserById(userId));
 *     }
 * });
 * User user = future.get();
 * }</pre>
 *
 * @param <T> the type of the value
 * @since 0.1.0
 */
public final class Future<T> {

    private final SharedState<T> state;

    /**
     * Creates a future that is not bound to any promise. Every blocking operation on it
     * fails with {@link FutureErrorCode#NO_STATE}.
     */
    public Future() {
        this(null);
    }

    Future(SharedState<T> state) {
        this.state = state;
    }

    /**
     * Waits until the promise writes an outcome and returns it.
     *
     * @return the value written by the promise, possibly {@code null}
     * @throws FutureException          with {@link FutureErrorCode#NO_STATE} if this future holds no state,
     *                                  or {@link FutureErrorCode#BROKEN_PROMISE} if the promise was abandoned
     * @throws RuntimeException         the failure written by the promise, rethrown as is
     * @throws Error                    the failure written by the promise, rethrown as is
     * @throws IllegalStateException    wrapping a checked failure written by the promise; its cause is
     *                                  always the instance passed to {@link Promise#setFailure(Throwable)}
     * @throws InterruptedException     if the calling thread is interrupted while waiting
     */
    public T get() throws InterruptedException {
        return requireState().read();
    }

    /**
     * @return {@code true} if the promise has written an outcome; {@code false} otherwise,
     * including when this future holds no state
     */
    public boolean isReady() {
        return state != null && state.pollReady();
    }

    /**
     * Waits until the promise writes an outcome, without inspecting it.
     *
     * @throws FutureException      with {@link FutureErrorCode#NO_STATE} if this future holds no state
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public void await() throws InterruptedException {
        requireState().blockUntilReady();
    }

    /**
     * @return {@code true} if this future is bound to a promise's state
     */
    public boolean isValid() {
        return state != null;
    }

    private SharedState<T> requireState() {
        if (state == null) {
            throw new FutureException(FutureErrorCode.NO_STATE);
        }
        return state;
    }
}
