package livepolls.websockets.repository;

import livepolls.websockets.BaseIntegrationTest;
import livepolls.websockets.domain.Poll;
import livepolls.websockets.domain.PollOption;
import livepolls.websockets.exception.OptionNotFoundException;
import livepolls.websockets.exception.PollClosedException;
import livepolls.websockets.exception.PollNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RedisRepository Integration Tests")
class RedisRepositoryTest extends BaseIntegrationTest {

    @Autowired
    private RedisRepository redisRepository;

    @Autowired
    private StringRedisTemplate redisTemplate;

    private String pollId;

    @BeforeEach
    void setUp() {
        pollId = UUID.randomUUID().toString();
    }

    private Poll createTestPoll() {
        Poll poll = new Poll(
                pollId,
                "Favourite colour?",
                "Pick one",
                List.of(PollOption.empty("Red"), PollOption.empty("Blue")),
                false,
                Instant.now().truncatedTo(ChronoUnit.MILLIS),
                0
        );
        redisRepository.savePoll(poll);
        return poll;
    }

    @Nested
    @DisplayName("Poll Operations")
    class PollOperations {

        @Test
        @DisplayName("Should save and retrieve a poll")
        void shouldSaveAndRetrievePoll() {
            // Given
            Poll poll = createTestPoll();

            // When
            Optional<Poll> retrieved = redisRepository.getPoll(pollId);

            // Then
            assertThat(retrieved).contains(poll);
            assertThat(redisRepository.getPollIds()).contains(pollId);
        }

        @Test
        @DisplayName("Should return empty for an unknown poll")
        void shouldReturnEmptyForUnknownPoll() {
            assertThat(redisRepository.getPoll("unknown-" + pollId)).isEmpty();
        }

        @Test
        @DisplayName("Should remove every key of a deleted poll")
        void shouldDeletePoll() {
            // Given
            createTestPoll();
            redisRepository.incrementVote(pollId, "Red");

            // When
            long sequence = redisRepository.deletePoll(pollId);

            // Then
            assertThat(sequence).isEqualTo(2);
            assertThat(redisRepository.getPoll(pollId)).isEmpty();
            assertThat(redisRepository.getPollIds()).doesNotContain(pollId);
            assertThat(redisTemplate.hasKey("votes:" + pollId)).isFalse();
            assertThat(redisTemplate.hasKey("seq:" + pollId)).isFalse();
        }

        @Test
        @DisplayName("Should fail to delete an unknown poll")
        void shouldFailToDeleteUnknownPoll() {
            assertThatThrownBy(() -> redisRepository.deletePoll(pollId))
                    .isInstanceOf(PollNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("Vote Operations")
    class VoteOperations {

        @Test
        @DisplayName("Should increment the count and the sequence together")
        void shouldIncrementVote() {
            // Given
            createTestPoll();

            // When
            Poll first = redisRepository.incrementVote(pollId, "Red");
            Poll second = redisRepository.incrementVote(pollId, "Blue");

            // Then
            assertThat(first.sequence()).isEqualTo(1);
            assertThat(second.sequence()).isEqualTo(2);
            assertThat(second.options()).containsExactly(new PollOption("Red", 1), new PollOption("Blue", 1));
        }

        @Test
        @DisplayName("Should reject unknown options and closed polls")
        void shouldRejectInvalidVotes() {
            // Given
            createTestPoll();

            // When/Then
            assertThatThrownBy(() -> redisRepository.incrementVote(pollId, "Green"))
                    .isInstanceOf(OptionNotFoundException.class);
            assertThatThrownBy(() -> redisRepository.incrementVote("unknown-" + pollId, "Red"))
                    .isInstanceOf(PollNotFoundException.class);

            redisRepository.markClosed(pollId);
            assertThatThrownBy(() -> redisRepository.incrementVote(pollId, "Red"))
                    .isInstanceOf(PollClosedException.class);
            assertThat(redisRepository.getPoll(pollId)).get().extracting(Poll::totalVotes).isEqualTo(0L);
        }

        @Test
        @DisplayName("Should count concurrent votes exactly")
        void shouldCountConcurrentVotes() throws InterruptedException {
            // Given
            createTestPoll();
            int votes = 100;
            ExecutorService executor = Executors.newFixedThreadPool(10);
            CountDownLatch latch = new CountDownLatch(votes);
            Set<Long> sequences = Collections.synchronizedSet(new HashSet<>());

            // When
            for (int i = 0; i < votes; i++) {
                String option = i % 2 == 0 ? "Red" : "Blue";
                executor.submit(() -> {
                    try {
                        sequences.add(redisRepository.incrementVote(pollId, option).sequence());
                    } finally {
                        latch.countDown();
                    }
                });
            }
            assertThat(latch.await(30, TimeUnit.SECONDS)).isTrue();
            executor.shutdown();

            // Then
            Poll poll = redisRepository.getPoll(pollId).orElseThrow();
            assertThat(poll.options()).containsExactly(new PollOption("Red", 50), new PollOption("Blue", 50));
            assertThat(poll.sequence()).isEqualTo(votes);
            assertThat(sequences).hasSize(votes);
        }
    }

    @Nested
    @DisplayName("Close Operations")
    class CloseOperations {

        @Test
        @DisplayName("Should close once and bump the sequence once")
        void shouldCloseOnce() {
            // Given
            createTestPoll();

            // When
            boolean first = redisRepository.markClosed(pollId);
            boolean second = redisRepository.markClosed(pollId);

            // Then
            assertThat(first).isTrue();
            assertThat(second).isFalse();
            Poll poll = redisRepository.getPoll(pollId).orElseThrow();
            assertThat(poll.closed()).isTrue();
            assertThat(poll.sequence()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should fail to close an unknown poll")
        void shouldFailToCloseUnknownPoll() {
            assertThatThrownBy(() -> redisRepository.markClosed(pollId))
                    .isInstanceOf(PollNotFoundException.class);
        }
    }

    @Test
    @DisplayName("Should answer ping")
    void shouldPing() {
        assertThat(redisRepository.ping()).isTrue();
    }
}
