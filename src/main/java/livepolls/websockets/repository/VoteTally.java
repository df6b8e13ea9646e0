package livepolls.websockets.repository;

import java.util.Map;

/**
 * JSON reply of the tally scripts. Only {@code status} is present when the script refused the change.
 */
record VoteTally(
        String status,
        long sequence,
        boolean closed,
        Map<String, Long> counts
) {
    static final String OK = "OK";
    static final String NOT_FOUND = "NOT_FOUND";
    static final String CLOSED = "CLOSED";
    static final String OPTION_NOT_FOUND = "OPTION_NOT_FOUND";
    static final String ALREADY_CLOSED = "ALREADY_CLOSED";

    VoteTally {
        if (status == null) {
            throw new IllegalStateException("Tally script replied without a status");
        }
        counts = counts == null ? Map.of() : Map.copyOf(counts);
    }
}
