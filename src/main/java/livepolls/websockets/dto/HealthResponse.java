package livepolls.websockets.dto;

public record HealthResponse(
        String redis,
        int connections
) {}
