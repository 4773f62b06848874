package oneshot;

/**
 * Kinds of misuse and failure reported by {@link Promise} and {@link Future}.
 *
 * @since 0.1.0
 */
public enum FutureErrorCode {
    /**
     * A second value or failure was written to a promise that already holds an outcome.
     */
    PROMISE_ALREADY_SATISFIED("Promise already satisfied"),
    /**
     * A second future was requested from a promise that already issued one.
     */
    FUTURE_ALREADY_RETRIEVED("Future already retrieved"),
    /**
     * The handle was transferred away, closed, or never had state.
     */
    NO_STATE("No associated state"),
    /**
     * The promise was abandoned before it wrote an outcome.
     */
    BROKEN_PROMISE("Broken promise"),
    /**
     * The state became ready without a value or a failure. Should never happen.
     */
    INTERNAL_INCONSISTENCY("Internal error: state ready but no value or failure");

    private final String message;

    FutureErrorCode(String message) {
        this.message = message;
    }

    /**
     * @return the default message used for exceptions of this kind
     */
    public String message() {
        return message;
    }
}
