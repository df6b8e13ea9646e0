package livepolls.websockets.dto;

import livepolls.websockets.domain.Poll;
import livepolls.websockets.domain.PollOption;

import java.time.Instant;
import java.util.List;

public record PollResponse(
        String pollId,
        String question,
        String description,
        List<PollOption> options,
        boolean closed,
        long totalVotes,
        Instant createdAt
) {
    public static PollResponse from(Poll poll) {
        return new PollResponse(
                poll.pollId(),
                poll.question(),
                poll.description(),
                poll.options(),
                poll.closed(),
                poll.totalVotes(),
                poll.createdAt()
        );
    }
}
