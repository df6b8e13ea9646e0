package livepolls.websockets.controller;

import jakarta.validation.Valid;
import livepolls.websockets.domain.Poll;
import livepolls.websockets.dto.ApiResponse;
import livepolls.websockets.dto.DeleteResponse;
import livepolls.websockets.dto.HealthResponse;
import livepolls.websockets.dto.PollCreateRequest;
import livepolls.websockets.dto.PollResponse;
import livepolls.websockets.dto.VoteRequest;
import livepolls.websockets.repository.PollStore;
import livepolls.websockets.service.ConnectionRegistry;
import livepolls.websockets.service.PollService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
public class PollController {

    private static final Logger log = LoggerFactory.getLogger(PollController.class);

    private final PollService pollService;
    private final PollStore store;
    private final ConnectionRegistry registry;

    public PollController(PollService pollService, PollStore store, ConnectionRegistry registry) {
        this.pollService = pollService;
        this.store = store;
        this.registry = registry;
    }

    @PostMapping("/poll")
    public ResponseEntity<ApiResponse<PollResponse>> createPoll(@Valid @RequestBody PollCreateRequest request) {
        log.info("Creating poll with {} options", request.options().size());

        Poll poll = pollService.createPoll(request.question(), request.description(), request.options());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success("Poll created", PollResponse.from(poll)));
    }

    @GetMapping("/poll")
    public ResponseEntity<ApiResponse<List<PollResponse>>> getPolls() {
        List<PollResponse> polls = pollService.getAllPolls().stream()
                .map(PollResponse::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success("Polls retrieved", polls));
    }

    @GetMapping("/poll/{pollId}")
    public ResponseEntity<ApiResponse<PollResponse>> getPoll(@PathVariable String pollId) {
        Poll poll = pollService.getPoll(pollId);
        return ResponseEntity.ok(ApiResponse.success("Poll retrieved", PollResponse.from(poll)));
    }

    @PostMapping("/poll/{pollId}/vote")
    public ResponseEntity<ApiResponse<PollResponse>> vote(
            @PathVariable String pollId,
            @Valid @RequestBody VoteRequest request
    ) {
        Poll poll = pollService.castVote(pollId, request.option());
        return ResponseEntity.ok(ApiResponse.success("Vote recorded", PollResponse.from(poll)));
    }

    @PostMapping("/poll/{pollId}/close")
    public ResponseEntity<ApiResponse<PollResponse>> closePoll(@PathVariable String pollId) {
        Poll poll = pollService.closePoll(pollId);
        return ResponseEntity.ok(ApiResponse.success("Poll closed", PollResponse.from(poll)));
    }

    @DeleteMapping("/poll/{pollId}")
    public ResponseEntity<ApiResponse<DeleteResponse>> deletePoll(@PathVariable String pollId) {
        pollService.deletePoll(pollId);
        return ResponseEntity.ok(ApiResponse.success("Poll deleted", new DeleteResponse(pollId)));
    }

    @GetMapping("/health")
    public ResponseEntity<ApiResponse<HealthResponse>> health() {
        boolean redisUp = store.ping();
        HealthResponse health = new HealthResponse(redisUp ? "connected" : "disconnected", registry.size());
        if (!redisUp) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(ApiResponse.error("Redis unavailable", health));
        }
        return ResponseEntity.ok(ApiResponse.success("Healthy", health));
    }
}
