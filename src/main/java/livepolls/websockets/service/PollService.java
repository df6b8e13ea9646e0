package livepolls.websockets.service;

import io.micrometer.core.instrument.Counter;
import livepolls.websockets.domain.ChangeEvent;
import livepolls.websockets.domain.ChangeType;
import livepolls.websockets.domain.Poll;
import livepolls.websockets.domain.PollOption;
import livepolls.websockets.exception.BackendUnavailableException;
import livepolls.websockets.exception.InvalidPollException;
import livepolls.websockets.exception.OptionNotFoundException;
import livepolls.websockets.exception.PollClosedException;
import livepolls.websockets.exception.PollNotFoundException;
import livepolls.websockets.repository.PollStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;

/**
 * Poll lifecycle and voting.
 *
 * Votes are checked against a fresh read and then applied by the store in one atomic step
 * that checks again, so a vote racing a close is rejected once the close has landed.
 * No lock is held here.
 */
@Service
public class PollService {

    private static final Logger log = LoggerFactory.getLogger(PollService.class);

    private final PollStore store;
    private final PollArchiveService archiveService;
    private final Counter votesCounter;

    public PollService(
            PollStore store,
            PollArchiveService archiveService,
            @Qualifier("votesCounter") Counter votesCounter
    ) {
        this.store = store;
        this.archiveService = archiveService;
        this.votesCounter = votesCounter;
    }

    public Poll createPoll(String question, String description, List<String> optionLabels) {
        if (question == null || question.isBlank()) {
            throw new InvalidPollException("Question is required");
        }
        if (optionLabels == null || optionLabels.isEmpty()) {
            throw new InvalidPollException("A poll needs at least one option");
        }

        Set<String> seen = new HashSet<>();
        List<PollOption> options = new ArrayList<>(optionLabels.size());
        for (String label : optionLabels) {
            if (label == null || label.isBlank()) {
                throw new InvalidPollException("Option labels must not be blank");
            }
            String trimmed = label.trim();
            if (!seen.add(trimmed)) {
                throw new InvalidPollException("Duplicate option: " + trimmed);
            }
            options.add(PollOption.empty(trimmed));
        }

        Poll poll = new Poll(
                UUID.randomUUID().toString(),
                question.trim(),
                description == null || description.isBlank() ? null : description.trim(),
                options,
                false,
                Instant.now(),
                0
        );
        store.savePoll(poll);
        publishQuietly(ChangeEvent.of(ChangeType.CREATED, poll));

        log.info("Created poll: {} with {} options", poll.pollId(), options.size());
        return poll;
    }

    /**
     * Records one vote and announces the new tally.
     *
     * @return the poll as it stood right after this vote
     */
    public Poll castVote(String pollId, String optionLabel) {
        Poll current = store.getPoll(pollId).orElseThrow(() -> new PollNotFoundException(pollId));
        if (current.closed()) {
            log.debug("Vote attempted on closed poll: {}", pollId);
            throw new PollClosedException(pollId);
        }
        if (current.option(optionLabel).isEmpty()) {
            log.debug("Vote for unknown option '{}' on poll {}", optionLabel, pollId);
            throw new OptionNotFoundException(pollId, optionLabel);
        }

        Poll updated = store.incrementVote(pollId, optionLabel);
        votesCounter.increment();
        publishQuietly(ChangeEvent.of(ChangeType.UPDATED, updated));

        log.debug("Vote recorded: poll={}, option={}, sequence={}", pollId, optionLabel, updated.sequence());
        return updated;
    }

    /**
     * Closes a poll. Closing an already closed poll returns it unchanged.
     */
    public Poll closePoll(String pollId) {
        boolean changed = store.markClosed(pollId);
        Poll poll = store.getPoll(pollId).orElseThrow(() -> new PollNotFoundException(pollId));
        if (changed) {
            publishQuietly(ChangeEvent.of(ChangeType.CLOSED, poll));
            archiveService.archive(poll);
            log.info("Poll {} closed with {} votes", pollId, poll.totalVotes());
        }
        return poll;
    }

    public Poll getPoll(String pollId) {
        return store.getPoll(pollId)
                .or(() -> archiveService.findArchived(pollId))
                .orElseThrow(() -> new PollNotFoundException(pollId));
    }

    public List<Poll> getAllPolls() {
        List<Poll> polls = new ArrayList<>();
        for (String pollId : store.getPollIds()) {
            // Ids can outlive their poll briefly while a delete is in flight
            store.getPoll(pollId).ifPresent(polls::add);
        }
        polls.sort(Comparator.comparing(Poll::createdAt));
        return polls;
    }

    public void deletePoll(String pollId) {
        Poll finalState = store.getPoll(pollId).orElseThrow(() -> new PollNotFoundException(pollId));
        long sequence = store.deletePoll(pollId);
        archiveService.archive(new Poll(
                finalState.pollId(),
                finalState.question(),
                finalState.description(),
                finalState.options(),
                true,
                finalState.createdAt(),
                sequence
        ));
        publishQuietly(ChangeEvent.deleted(pollId, sequence));

        log.info("Poll {} deleted", pollId);
    }

    /**
     * The state change behind an event is already committed when it is published, so a failed
     * publish is logged rather than reported: the next event for the poll carries the full tally.
     */
    private void publishQuietly(ChangeEvent event) {
        try {
            store.publish(event);
        } catch (BackendUnavailableException e) {
            log.warn("Could not publish {} for poll {} (sequence {}): {}",
                    event.type(), event.pollId(), event.sequence(), e.getMessage());
        }
    }
}
