package livepolls.websockets.exception;

public class OptionNotFoundException extends PollException {

    private final String pollId;
    private final String option;

    public OptionNotFoundException(String pollId, String option) {
        super("Invalid option: " + option);
        this.pollId = pollId;
        this.option = option;
    }

    public String getPollId() {
        return pollId;
    }

    public String getOption() {
        return option;
    }
}
