package livepolls.websockets.dto;

import jakarta.validation.constraints.NotBlank;

public record VoteRequest(
        @NotBlank(message = "Vote option is required")
        String option
) {}
