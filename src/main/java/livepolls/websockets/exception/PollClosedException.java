package livepolls.websockets.exception;

public class PollClosedException extends PollException {

    private final String pollId;

    public PollClosedException(String pollId) {
        super("Poll is closed");
        this.pollId = pollId;
    }

    public String getPollId() {
        return pollId;
    }
}
