package livepolls.websockets.domain;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public record Poll(
        String pollId,
        String question,
        String description,
        List<PollOption> options,
        boolean closed,
        Instant createdAt,
        long sequence
) {
    public Poll {
        options = List.copyOf(options);
    }

    public Optional<PollOption> option(String label) {
        return options.stream()
                .filter(option -> option.label().equals(label))
                .findFirst();
    }

    public long totalVotes() {
        return options.stream().mapToLong(PollOption::count).sum();
    }

    public List<String> labels() {
        return options.stream().map(PollOption::label).toList();
    }
}
