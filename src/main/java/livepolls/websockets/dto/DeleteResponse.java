package livepolls.websockets.dto;

public record DeleteResponse(
        String pollId
) {}
