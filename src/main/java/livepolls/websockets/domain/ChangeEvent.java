package livepolls.websockets.domain;

import java.time.Instant;
import java.util.List;

/**
 * Notification carrying a poll's full current tally.
 * Events are snapshots, not deltas: a receiver that missed some of them
 * is brought up to date by the next one it gets.
 */
public record ChangeEvent(
        ChangeType type,
        String pollId,
        List<PollOption> options,
        boolean closed,
        long sequence,
        Instant timestamp
) {
    public ChangeEvent {
        options = options == null ? List.of() : List.copyOf(options);
    }

    public static ChangeEvent of(ChangeType type, Poll poll) {
        return new ChangeEvent(type, poll.pollId(), poll.options(), poll.closed(), poll.sequence(), Instant.now());
    }

    public static ChangeEvent deleted(String pollId, long sequence) {
        return new ChangeEvent(ChangeType.DELETED, pollId, List.of(), true, sequence, Instant.now());
    }
}
