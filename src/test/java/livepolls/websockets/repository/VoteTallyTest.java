package livepolls.websockets.repository;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.github.resilience4j.retry.Retry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

@DisplayName("Tally Script Reply Tests")
class VoteTallyTest {

    private RedisRepository repository;

    @BeforeEach
    void setUp() {
        JsonMapper objectMapper = JsonMapper.builder()
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
        repository = new RedisRepository(null, objectMapper, Retry.ofDefaults("test"));
    }

    @Test
    @DisplayName("Should read the counts, sequence and closed flag of a successful script")
    void shouldReadFullTally() {
        // When
        VoteTally tally = repository.readTally(
                "{\"status\":\"OK\",\"sequence\":12,\"closed\":true,\"counts\":{\"Red\":3,\"Blue\":0}}");

        // Then
        assertThat(tally.status()).isEqualTo(VoteTally.OK);
        assertThat(tally.sequence()).isEqualTo(12);
        assertThat(tally.closed()).isTrue();
        assertThat(tally.counts()).containsOnly(entry("Red", 3L), entry("Blue", 0L));
    }

    @Test
    @DisplayName("Should read a refusal that carries only a status")
    void shouldReadStatusOnly() {
        VoteTally tally = repository.readTally("{\"status\":\"OPTION_NOT_FOUND\"}");

        assertThat(tally.status()).isEqualTo(VoteTally.OPTION_NOT_FOUND);
        assertThat(tally.sequence()).isZero();
        assertThat(tally.closed()).isFalse();
        assertThat(tally.counts()).isEmpty();
    }

    @Test
    @DisplayName("Should treat an empty count object as no votes")
    void shouldReadEmptyCounts() {
        VoteTally tally = repository.readTally("{\"status\":\"OK\",\"sequence\":1,\"closed\":false,\"counts\":{}}");

        assertThat(tally.counts()).isEmpty();
    }

    @Test
    @DisplayName("Should reject replies it cannot read")
    void shouldRejectUnreadableReplies() {
        assertThatThrownBy(() -> repository.readTally(null)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> repository.readTally("[\"OK\"]")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> repository.readTally("{\"sequence\":1}")).isInstanceOf(IllegalStateException.class);
    }
}
