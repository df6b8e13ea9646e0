package livepolls.websockets.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import livepolls.websockets.service.ConnectionRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsConfig {

    @Bean
    public Gauge activeConnectionsGauge(MeterRegistry registry, ConnectionRegistry connectionRegistry) {
        return Gauge.builder("livepolls.connections.active", connectionRegistry, ConnectionRegistry::size)
                .description("Number of live WebSocket connections on this instance")
                .register(registry);
    }

    @Bean
    public Counter votesCounter(MeterRegistry registry) {
        return Counter.builder("livepolls.votes.total")
                .description("Total number of votes cast")
                .register(registry);
    }

    @Bean
    public Counter broadcastDeliveriesCounter(MeterRegistry registry) {
        return Counter.builder("livepolls.broadcast.deliveries")
                .description("Total number of change events written to connections")
                .register(registry);
    }

    @Bean
    public Counter droppedConnectionsCounter(MeterRegistry registry) {
        return Counter.builder("livepolls.connections.dropped")
                .description("Connections removed after a failed send")
                .register(registry);
    }
}
