package livepolls.websockets.repository;

import livepolls.websockets.domain.ChangeEvent;
import livepolls.websockets.domain.Poll;

import java.util.Optional;
import java.util.Set;

/**
 * Shared poll state: atomic counters, poll metadata and the change channel.
 * Implementations must be safe for any number of concurrent callers.
 */
public interface PollStore {

    void savePoll(Poll poll);

    Optional<Poll> getPoll(String pollId);

    Set<String> getPollIds();

    /**
     * Adds one vote as a single atomic operation and returns the tally it produced,
     * stamped with the next sequence number of the poll.
     *
     * @throws livepolls.websockets.exception.PollNotFoundException   if the poll does not exist
     * @throws livepolls.websockets.exception.PollClosedException     if the poll is closed
     * @throws livepolls.websockets.exception.OptionNotFoundException if the poll has no such option
     */
    Poll incrementVote(String pollId, String optionLabel);

    /**
     * @return true if this call closed the poll, false if it was already closed
     * @throws livepolls.websockets.exception.PollNotFoundException if the poll does not exist
     */
    boolean markClosed(String pollId);

    /**
     * @return the sequence number assigned to the deletion
     * @throws livepolls.websockets.exception.PollNotFoundException if the poll does not exist
     */
    long deletePoll(String pollId);

    void publish(ChangeEvent event);

    boolean ping();
}
