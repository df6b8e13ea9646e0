package livepolls.websockets.exception;

/**
 * Base type for failures that are reported back to the caller as-is.
 */
public abstract class PollException extends RuntimeException {

    protected PollException(String message) {
        super(message);
    }

    protected PollException(String message, Throwable cause) {
        super(message, cause);
    }
}
