package livepolls.websockets.service;

import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.SetOptions;
import livepolls.websockets.domain.Poll;
import livepolls.websockets.domain.PollOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ExecutionException;

/**
 * Keeps the final results of closed and deleted polls in Firestore so they can still be read
 * once Redis no longer has them. Every call is a no-op when Firebase is not configured.
 */
@Service
public class PollArchiveService {

    private static final Logger log = LoggerFactory.getLogger(PollArchiveService.class);
    private static final String POLLS_COLLECTION = "polls";

    private final Firestore firestore;

    public PollArchiveService(Optional<Firestore> archiveFirestore) {
        this.firestore = archiveFirestore.orElse(null);
    }

    public boolean isEnabled() {
        return firestore != null;
    }

    public void archive(Poll poll) {
        if (firestore == null) {
            log.debug("Firebase not configured. Skipping archive of poll {}", poll.pollId());
            return;
        }

        Map<String, Object> data = new HashMap<>();
        data.put("pollId", poll.pollId());
        data.put("question", poll.question());
        data.put("description", poll.description());
        data.put("createdAt", poll.createdAt().toString());
        data.put("archivedAt", Instant.now().toString());
        data.put("totalVotes", poll.totalVotes());

        List<Map<String, Object>> options = poll.options().stream()
                .map(option -> {
                    Map<String, Object> m = new HashMap<>();
                    m.put("label", option.label());
                    m.put("count", option.count());
                    return m;
                })
                .toList();
        data.put("options", options);

        try {
            firestore.collection(POLLS_COLLECTION)
                    .document(poll.pollId())
                    .set(data, SetOptions.merge())
                    .get();
            log.info("Poll {} archived to Firebase", poll.pollId());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while archiving poll {}", poll.pollId(), e);
        } catch (ExecutionException e) {
            log.error("Failed to archive poll {} to Firebase", poll.pollId(), e.getCause());
        }
    }

    public Optional<Poll> findArchived(String pollId) {
        if (firestore == null) {
            return Optional.empty();
        }

        try {
            DocumentSnapshot doc = firestore.collection(POLLS_COLLECTION)
                    .document(pollId)
                    .get()
                    .get();
            if (doc.exists()) {
                return Optional.of(toPoll(doc));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while reading archived poll {}", pollId, e);
        } catch (ExecutionException e) {
            log.error("Failed to fetch archived poll {} from Firebase", pollId, e.getCause());
        }
        return Optional.empty();
    }

    private Poll toPoll(DocumentSnapshot doc) {
        List<PollOption> options = new ArrayList<>();
        if (doc.get("options") instanceof List<?> list) {
            for (Object item : list) {
                if (!(item instanceof Map<?, ?> option) || !(option.get("label") instanceof String label)) {
                    log.warn("Skipping malformed option in archived poll {}", doc.getId());
                    continue;
                }
                long count = option.get("count") instanceof Number number ? number.longValue() : 0;
                options.add(new PollOption(label, count));
            }
        }

        String createdAt = doc.getString("createdAt");
        return new Poll(
                doc.getId(),
                doc.getString("question"),
                doc.getString("description"),
                options,
                true,
                createdAt != null ? Instant.parse(createdAt) : Instant.EPOCH,
                0
        );
    }
}
