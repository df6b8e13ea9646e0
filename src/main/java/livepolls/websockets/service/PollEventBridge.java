package livepolls.websockets.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import livepolls.websockets.domain.ChangeEvent;
import livepolls.websockets.repository.RedisRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.SmartLifecycle;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.PatternTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;
import org.springframework.util.backoff.ExponentialBackOff;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Relays change events published by any instance to this instance's {@link BroadcastDispatcher}.
 *
 * Starts in an early lifecycle phase so the subscription is in place before the web server
 * accepts votes. When Redis drops the subscription the container resubscribes with exponential
 * backoff; events published during the outage are lost and the next one brings watchers up to date.
 */
@Component
public class PollEventBridge implements MessageListener, SmartLifecycle, DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(PollEventBridge.class);

    static final int PHASE = 0;

    private final RedisMessageListenerContainer container;
    private final ThreadPoolTaskExecutor dispatchExecutor;
    private final ObjectMapper objectMapper;
    private final BroadcastDispatcher dispatcher;
    private final PatternTopic topic = new PatternTopic(RedisRepository.EVENT_CHANNEL_PREFIX + "*");

    private volatile boolean running;

    public PollEventBridge(
            RedisConnectionFactory connectionFactory,
            ObjectMapper objectMapper,
            BroadcastDispatcher dispatcher,
            @Value("${app.redis.subscriber.initial-backoff-ms:500}") long initialBackoffMs,
            @Value("${app.redis.subscriber.max-backoff-ms:30000}") long maxBackoffMs
    ) {
        this.objectMapper = objectMapper;
        this.dispatcher = dispatcher;

        ExponentialBackOff backOff = new ExponentialBackOff(initialBackoffMs, 2.0);
        backOff.setMaxInterval(maxBackoffMs);

        // One dispatch thread keeps events in the order Redis delivered them
        this.dispatchExecutor = new ThreadPoolTaskExecutor();
        this.dispatchExecutor.setCorePoolSize(1);
        this.dispatchExecutor.setMaxPoolSize(1);
        this.dispatchExecutor.setThreadNamePrefix("poll-events-");
        this.dispatchExecutor.initialize();

        this.container = new RedisMessageListenerContainer();
        this.container.setConnectionFactory(connectionFactory);
        this.container.setTaskExecutor(dispatchExecutor);
        this.container.setRecoveryBackoff(backOff);
        this.container.setErrorHandler(error -> log.error("Poll event listener failed", error));
        this.container.addMessageListener(this, topic);
        this.container.afterPropertiesSet();
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        ChangeEvent event;
        try {
            event = objectMapper.readValue(message.getBody(), ChangeEvent.class);
        } catch (IOException e) {
            log.warn("Skipping malformed poll event on channel {}: {}",
                    new String(message.getChannel(), StandardCharsets.UTF_8), e.getMessage());
            return;
        }
        dispatcher.dispatch(event);
    }

    @Override
    public void start() {
        container.start();
        running = true;
        log.info("Subscribed to poll events on {}", topic.getTopic());
    }

    @Override
    public void stop() {
        container.stop();
        running = false;
        log.info("Unsubscribed from poll events");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return PHASE;
    }

    @Override
    public void destroy() throws Exception {
        container.destroy();
        dispatchExecutor.shutdown();
    }
}
