package oneshot;

import lombok.Getter;

/**
 * Thrown when a {@link Promise} or {@link Future} is misused, or delivered to the reader
 * when the promise was abandoned ({@link FutureErrorCode#BROKEN_PROMISE}).
 *
 * @since 0.1.0
 */
@Getter
public class FutureException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    /**
     * The kind of failure.
     */
    private final FutureErrorCode code;

    public FutureException(FutureErrorCode code) {
        super(code.message());
        this.code = code;
    }
}
