package livepolls.websockets.exception;

public class InvalidPollException extends PollException {

    public InvalidPollException(String message) {
        super(message);
    }
}
