package livepolls.websockets.exception;

public class PollNotFoundException extends PollException {

    private final String pollId;

    public PollNotFoundException(String pollId) {
        super("Poll not found");
        this.pollId = pollId;
    }

    public String getPollId() {
        return pollId;
    }
}
