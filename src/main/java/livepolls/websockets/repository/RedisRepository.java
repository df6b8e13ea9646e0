package livepolls.websockets.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.Retry;
import livepolls.websockets.domain.ChangeEvent;
import livepolls.websockets.domain.Poll;
import livepolls.websockets.domain.PollOption;
import livepolls.websockets.exception.BackendUnavailableException;
import livepolls.websockets.exception.OptionNotFoundException;
import livepolls.websockets.exception.PollClosedException;
import livepolls.websockets.exception.PollNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.*;
import java.util.function.Supplier;

@Repository
public class RedisRepository implements PollStore {

    private static final Logger log = LoggerFactory.getLogger(RedisRepository.class);

    public static final String EVENT_CHANNEL_PREFIX = "poll-events:";

    private static final String POLL_KEY = "poll:";
    private static final String VOTES_KEY = "votes:";
    private static final String SEQUENCE_KEY = "seq:";
    private static final String POLLS_KEY = "polls";

    private static final RedisScript<String> CAST_VOTE_SCRIPT = script("cast_vote");
    private static final RedisScript<String> CLOSE_POLL_SCRIPT = script("close_poll");
    private static final RedisScript<String> READ_TALLY_SCRIPT = script("read_tally");
    private static final RedisScript<String> DELETE_POLL_SCRIPT = script("delete_poll");

    private static final TypeReference<List<String>> LABELS_TYPE = new TypeReference<>() {
    };

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final Retry retry;

    public RedisRepository(StringRedisTemplate redis, ObjectMapper objectMapper, Retry redisRetry) {
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.retry = redisRetry;
    }

    // Poll operations

    @Override
    public void savePoll(Poll poll) {
        String pollId = poll.pollId();
        Map<String, String> counts = new LinkedHashMap<>();
        for (PollOption option : poll.options()) {
            counts.put(option.label(), Long.toString(option.count()));
        }

        Map<String, String> fields = new HashMap<>();
        fields.put("pollId", pollId);
        fields.put("question", poll.question());
        fields.put("description", poll.description() != null ? poll.description() : "");
        fields.put("options", writeJson(poll.labels()));
        fields.put("closed", poll.closed() ? "1" : "0");
        fields.put("createdAt", poll.createdAt().toString());

        once("savePoll", () -> {
            // Counters first: a poll hash is only visible once everything it points to exists
            redis.opsForHash().putAll(VOTES_KEY + pollId, counts);
            redis.opsForValue().set(SEQUENCE_KEY + pollId, Long.toString(poll.sequence()));
            redis.opsForHash().putAll(POLL_KEY + pollId, fields);
            redis.opsForSet().add(POLLS_KEY, pollId);
            return null;
        });
    }

    @Override
    public Optional<Poll> getPoll(String pollId) {
        return withRetry("getPoll", () -> {
            Map<Object, Object> fields = redis.opsForHash().entries(POLL_KEY + pollId);
            if (fields.isEmpty()) {
                return Optional.empty();
            }
            VoteTally tally = runTallyScript(READ_TALLY_SCRIPT, pollId);
            if (VoteTally.NOT_FOUND.equals(tally.status())) {
                return Optional.empty();
            }
            return Optional.of(toPoll(fields, tally));
        });
    }

    @Override
    public Set<String> getPollIds() {
        return withRetry("getPollIds", () -> {
            Set<String> ids = redis.opsForSet().members(POLLS_KEY);
            return ids != null ? ids : Set.<String>of();
        });
    }

    // Vote operations

    @Override
    public Poll incrementVote(String pollId, String optionLabel) {
        return once("incrementVote", () -> {
            Map<Object, Object> fields = redis.opsForHash().entries(POLL_KEY + pollId);
            if (fields.isEmpty()) {
                throw new PollNotFoundException(pollId);
            }

            VoteTally tally = runTallyScript(CAST_VOTE_SCRIPT, pollId, optionLabel);
            switch (tally.status()) {
                case VoteTally.OK:
                    return toPoll(fields, tally);
                case VoteTally.NOT_FOUND:
                    throw new PollNotFoundException(pollId);
                case VoteTally.CLOSED:
                    throw new PollClosedException(pollId);
                case VoteTally.OPTION_NOT_FOUND:
                    throw new OptionNotFoundException(pollId, optionLabel);
                default:
                    throw new IllegalStateException("Unexpected vote script status: " + tally.status());
            }
        });
    }

    @Override
    public boolean markClosed(String pollId) {
        VoteTally tally = withRetry("markClosed", () -> runTallyScript(CLOSE_POLL_SCRIPT, pollId));
        if (VoteTally.NOT_FOUND.equals(tally.status())) {
            throw new PollNotFoundException(pollId);
        }
        return VoteTally.OK.equals(tally.status());
    }

    @Override
    public long deletePoll(String pollId) {
        VoteTally tally = once("deletePoll", () -> readTally(redis.execute(
                DELETE_POLL_SCRIPT,
                List.of(POLL_KEY + pollId, VOTES_KEY + pollId, SEQUENCE_KEY + pollId, POLLS_KEY),
                pollId
        )));
        if (VoteTally.NOT_FOUND.equals(tally.status())) {
            throw new PollNotFoundException(pollId);
        }
        return tally.sequence();
    }

    // Change notifications

    @Override
    public void publish(ChangeEvent event) {
        String payload = writeJson(event);
        withRetry("publish", () -> redis.convertAndSend(EVENT_CHANNEL_PREFIX + event.pollId(), payload));
        log.trace("Published {} for poll {} (sequence {})", event.type(), event.pollId(), event.sequence());
    }

    @Override
    public boolean ping() {
        try {
            String reply = redis.execute((RedisCallback<String>) connection -> connection.ping());
            return "PONG".equalsIgnoreCase(reply);
        } catch (DataAccessException e) {
            log.warn("Redis ping failed: {}", e.getMessage());
            return false;
        }
    }

    private static RedisScript<String> script(String name) {
        return RedisScript.of(new ClassPathResource("scripts/" + name + ".lua"), String.class);
    }

    private VoteTally runTallyScript(RedisScript<String> script, String pollId, Object... args) {
        String reply = redis.execute(
                script,
                List.of(POLL_KEY + pollId, VOTES_KEY + pollId, SEQUENCE_KEY + pollId),
                args
        );
        return readTally(reply);
    }

    VoteTally readTally(String json) {
        if (json == null || json.isEmpty()) {
            throw new IllegalStateException("Empty reply from tally script");
        }
        try {
            return objectMapper.readValue(json, VoteTally.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable reply from tally script", e);
        }
    }

    private Poll toPoll(Map<Object, Object> fields, VoteTally tally) {
        List<String> labels = readLabels((String) fields.get("options"));
        List<PollOption> options = new ArrayList<>(labels.size());
        for (String label : labels) {
            options.add(new PollOption(label, tally.counts().getOrDefault(label, 0L)));
        }

        String description = (String) fields.get("description");
        return new Poll(
                (String) fields.get("pollId"),
                (String) fields.get("question"),
                description == null || description.isEmpty() ? null : description,
                options,
                tally.closed(),
                Instant.parse((String) fields.get("createdAt")),
                tally.sequence()
        );
    }

    private List<String> readLabels(String json) {
        try {
            return objectMapper.readValue(json, LABELS_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt option list in Redis", e);
        }
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    // Idempotent calls: retried on connection failures and timeouts
    private <T> T withRetry(String operation, Supplier<T> call) {
        try {
            return retry.executeSupplier(call);
        } catch (DataAccessException e) {
            log.error("Redis {} failed after retries", operation, e);
            throw new BackendUnavailableException("Backend unavailable during " + operation, e);
        }
    }

    private <T> T once(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            log.error("Redis {} failed", operation, e);
            throw new BackendUnavailableException("Backend unavailable during " + operation, e);
        }
    }
}
