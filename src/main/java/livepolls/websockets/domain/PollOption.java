package livepolls.websockets.domain;

public record PollOption(
        String label,
        long count
) {
    public static PollOption empty(String label) {
        return new PollOption(label, 0);
    }
}
