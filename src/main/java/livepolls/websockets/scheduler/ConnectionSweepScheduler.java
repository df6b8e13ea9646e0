package livepolls.websockets.scheduler;

import livepolls.websockets.service.ConnectionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class ConnectionSweepScheduler {

    private static final Logger log = LoggerFactory.getLogger(ConnectionSweepScheduler.class);

    private final ConnectionRegistry registry;

    public ConnectionSweepScheduler(ConnectionRegistry registry) {
        this.registry = registry;
    }

    // Catches connections whose close callback never arrived
    @Scheduled(fixedRateString = "${app.websocket.sweep-interval-ms:30000}")
    public void sweepClosedConnections() {
        int removed = registry.sweepClosed();
        if (removed > 0) {
            log.info("Swept {} closed connections (remaining: {})", removed, registry.size());
        }
    }
}
