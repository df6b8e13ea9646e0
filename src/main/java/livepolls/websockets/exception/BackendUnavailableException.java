package livepolls.websockets.exception;

/**
 * Redis could not be reached, or kept failing after the retries allowed for the call.
 */
public class BackendUnavailableException extends PollException {

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
