package livepolls.websockets.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import livepolls.websockets.BaseIntegrationTest;
import livepolls.websockets.domain.Poll;
import livepolls.websockets.service.ConnectionRegistry;
import livepolls.websockets.service.PollService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@DisplayName("WebSocket Integration Tests")
class WebSocketIntegrationTest extends BaseIntegrationTest {

    @Autowired
    private PollService pollService;

    @Autowired
    private ConnectionRegistry registry;

    @Autowired
    private ObjectMapper objectMapper;

    private final StandardWebSocketClient client = new StandardWebSocketClient();
    private final List<WebSocketSession> openSessions = new ArrayList<>();

    private Poll poll;

    @BeforeEach
    void setUp() {
        poll = pollService.createPoll("Coffee or tea?", null, List.of("Coffee", "Tea"));
    }

    @AfterEach
    void tearDown() throws Exception {
        for (WebSocketSession session : openSessions) {
            if (session.isOpen()) {
                session.close(CloseStatus.NORMAL);
            }
        }
    }

    private Watcher connect(String path) throws Exception {
        Watcher watcher = new Watcher();
        WebSocketSession session = client.execute(watcher, "ws://localhost:" + port + path)
                .get(5, TimeUnit.SECONDS);
        openSessions.add(session);
        watcher.session = session;
        return watcher;
    }

    private class Watcher extends TextWebSocketHandler {

        private final BlockingQueue<JsonNode> received = new LinkedBlockingQueue<>();
        private WebSocketSession session;

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
            received.add(objectMapper.readTree(message.getPayload()));
        }

        JsonNode next() throws InterruptedException {
            JsonNode message = received.poll(5, TimeUnit.SECONDS);
            assertThat(message).as("message within timeout").isNotNull();
            return message;
        }

        // Skips anything else, such as late announcements of polls created earlier
        JsonNode next(String type, String pollId) throws InterruptedException {
            while (true) {
                JsonNode message = next();
                if (type.equals(message.path("type").asText())
                        && (pollId == null || pollId.equals(message.path("pollId").asText()))) {
                    return message;
                }
            }
        }

        void awaitSubscribed(String pollId) throws InterruptedException {
            next("subscribed", pollId);
        }

        void send(String payload) throws Exception {
            session.sendMessage(new TextMessage(payload));
        }
    }

    @Nested
    @DisplayName("Subscribing")
    class Subscribing {

        @Test
        @DisplayName("Should send the current state when connecting to a poll")
        void shouldSendSnapshotOnConnect() throws Exception {
            // Given
            pollService.castVote(poll.pollId(), "Tea");
            pollService.castVote(poll.pollId(), "Tea");
            Thread.sleep(200);

            // When
            Watcher watcher = connect("/ws/" + poll.pollId());

            // Then
            JsonNode snapshot = watcher.next("poll_data", poll.pollId());
            assertThat(snapshot.get("options").get(1).get("count").asLong()).isEqualTo(2);
            assertThat(snapshot.get("closed").asBoolean()).isFalse();
        }

        @Test
        @DisplayName("Should report an unknown poll")
        void shouldReportUnknownPoll() throws Exception {
            Watcher watcher = connect("/ws");

            watcher.send("{\"type\":\"subscribe\",\"pollId\":\"no-such-poll\"}");

            JsonNode reply = watcher.next("error", null);
            assertThat(reply.get("message").asText()).isEqualTo("Poll not found");
        }

        @Test
        @DisplayName("Should answer ping")
        void shouldAnswerPing() throws Exception {
            Watcher watcher = connect("/ws");

            watcher.send("{\"type\":\"ping\"}");

            JsonNode reply = watcher.next("pong", null);
            assertThat(reply.has("message")).isFalse();
        }
    }

    @Nested
    @DisplayName("Live Updates")
    class LiveUpdates {

        @Test
        @DisplayName("Should push each vote to every watcher in order")
        void shouldPushVotes() throws Exception {
            // Given
            Watcher first = connect("/ws/" + poll.pollId());
            Watcher second = connect("/ws?pollId=" + poll.pollId());
            await().atMost(Duration.ofSeconds(5))
                    .until(() -> registry.subscriberCount(poll.pollId()) == 2);
            first.awaitSubscribed(poll.pollId());
            second.awaitSubscribed(poll.pollId());

            // When
            pollService.castVote(poll.pollId(), "Coffee");
            pollService.castVote(poll.pollId(), "Coffee");

            // Then
            for (Watcher watcher : List.of(first, second)) {
                JsonNode update1 = watcher.next("poll_update", poll.pollId());
                JsonNode update2 = watcher.next("poll_update", poll.pollId());
                assertThat(update2.get("sequence").asLong()).isGreaterThan(update1.get("sequence").asLong());
                assertThat(update2.get("options").get(0).get("count").asLong()).isEqualTo(2);
            }
        }

        @Test
        @DisplayName("Should announce close and deletion to watchers")
        void shouldPushCloseAndDelete() throws Exception {
            // Given
            Watcher watcher = connect("/ws/" + poll.pollId());
            watcher.awaitSubscribed(poll.pollId());

            // When
            pollService.closePoll(poll.pollId());
            pollService.deletePoll(poll.pollId());

            // Then
            JsonNode closed = watcher.next("poll_closed", poll.pollId());
            assertThat(closed.get("closed").asBoolean()).isTrue();

            JsonNode deleted = watcher.next("poll_deleted", poll.pollId());
            assertThat(deleted.get("sequence").asLong()).isGreaterThan(closed.get("sequence").asLong());
            await().atMost(Duration.ofSeconds(5))
                    .until(() -> registry.subscriberCount(poll.pollId()) == 0);
        }

        @Test
        @DisplayName("Should not push updates of a poll the client does not watch")
        void shouldIsolatePolls() throws Exception {
            // Given
            Poll other = pollService.createPoll("Cats or dogs?", null, List.of("Cats", "Dogs"));
            Watcher watcher = connect("/ws/" + other.pollId());
            watcher.awaitSubscribed(other.pollId());

            // When
            pollService.castVote(poll.pollId(), "Tea");
            pollService.castVote(other.pollId(), "Dogs");

            // Then
            JsonNode update = watcher.next("poll_update", other.pollId());
            assertThat(update.get("options").get(1).get("count").asLong()).isEqualTo(1);
            assertThat(watcher.received)
                    .noneMatch(message -> poll.pollId().equals(message.path("pollId").asText())
                            && "poll_update".equals(message.path("type").asText()));
        }
    }

    @Test
    @DisplayName("Should forget a client once it disconnects")
    void shouldDeregisterOnDisconnect() throws Exception {
        // Given
        Watcher watcher = connect("/ws/" + poll.pollId());
        await().atMost(Duration.ofSeconds(5))
                .until(() -> registry.subscriberCount(poll.pollId()) == 1);

        // When
        watcher.session.close(CloseStatus.NORMAL);

        // Then
        await().atMost(Duration.ofSeconds(5))
                .until(() -> registry.subscriberCount(poll.pollId()) == 0);
    }
}
