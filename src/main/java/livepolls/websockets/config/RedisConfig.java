package livepolls.websockets.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

@Configuration
public class RedisConfig {

    private static final Logger log = LoggerFactory.getLogger(RedisConfig.class);

    @Value("${spring.data.redis.url:NOT_SET}")
    private String redisUrl;

    @PostConstruct
    public void logRedisConfig() {
        // Mask password for logging
        String maskedUrl = redisUrl.replaceAll("://[^:]+:([^@]+)@", "://***:***@");
        log.info("Redis URL configured: {}", maskedUrl);
    }

    @Bean
    public ObjectMapper redisObjectMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory connectionFactory) {
        return new StringRedisTemplate(connectionFactory);
    }

    /**
     * Retry policy for idempotent Redis calls. Only connection failures and timeouts are retried;
     * anything else is a bug or a data problem and fails straight away.
     */
    @Bean
    public Retry redisRetry(
            @Value("${app.redis.retry.max-attempts:3}") int maxAttempts,
            @Value("${app.redis.retry.initial-backoff-ms:100}") long initialBackoffMs,
            @Value("${app.redis.retry.multiplier:2.0}") double multiplier
    ) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(Duration.ofMillis(initialBackoffMs), multiplier))
                .retryExceptions(RedisConnectionFailureException.class, QueryTimeoutException.class)
                .build();

        Retry retry = Retry.of("redis", config);
        retry.getEventPublisher().onRetry(event -> log.warn("Retrying Redis call (attempt {}) after {}: {}",
                event.getNumberOfRetryAttempts(), event.getWaitInterval(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown error"));
        return retry;
    }
}
