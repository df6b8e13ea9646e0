package livepolls.websockets.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

public record PollCreateRequest(
        @NotBlank(message = "Question is required")
        @Size(max = 500, message = "Question must be at most 500 characters")
        String question,

        @Size(max = 2000, message = "Description must be at most 2000 characters")
        String description,

        @NotEmpty(message = "At least one option is required")
        @Size(max = 50, message = "A poll can have at most 50 options")
        List<@NotBlank(message = "Option labels must not be blank")
             @Size(max = 200, message = "Option labels must be at most 200 characters") String> options
) {}
