package com.teamflow.dispatch.api;

import com.teamflow.core.coordinator.IssueBoard;
import com.teamflow.core.coordinator.TaskCoordinator;
import com.teamflow.core.model.Assignment;
import com.teamflow.core.model.Issue;
import com.teamflow.core.model.ReviewRecord;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * REST surface used by worker agents and reviewers while working an issue:
 * claim, progress, failure, completion and review.
 */
@RestController
@RequestMapping("/api/v1/issues")
public class IssueController {

    private final TaskCoordinator coordinator;
    private final IssueBoard board;

    public IssueController(TaskCoordinator coordinator, IssueBoard board) {
        this.coordinator = coordinator;
        this.board = board;
    }

    @GetMapping("/{issueId}")
    public Issue get(@PathVariable String issueId) {
        return board.get(issueId);
    }

    /**
     * POST /api/v1/issues/{id}/claim: the named agent takes the issue.
     */
    @PostMapping("/{issueId}/claim")
    public ResponseEntity<Assignment> claim(@PathVariable String issueId, @RequestBody ClaimRequest request) {
        Assignment assignment = coordinator.claimIssue(required(request.agentId(), "agentId"), issueId);
        return ResponseEntity.status(HttpStatus.CREATED).body(assignment);
    }

    @PostMapping("/{issueId}/progress")
    public Issue progress(@PathVariable String issueId, @RequestBody ProgressRequest request) {
        return coordinator.reportProgress(issueId, required(request.agentId(), "agentId"), request.note());
    }

    @PostMapping("/{issueId}/failure")
    public ResponseEntity<Void> failure(@PathVariable String issueId, @RequestBody ProgressRequest request) {
        coordinator.reportFailure(issueId, required(request.agentId(), "agentId"), request.note());
        return ResponseEntity.accepted().build();
    }

    /**
     * POST /api/v1/issues/{id}/completion: hands the work to review. 200 with the decision when
     * a blocking check already decides it, 202 while a reviewer is pending.
     */
    @PostMapping("/{issueId}/completion")
    public ResponseEntity<?> completion(@PathVariable String issueId, @RequestBody CompletionRequest request) {
        Optional<ReviewRecord> decision = coordinator.reportCompletion(issueId,
                required(request.agentId(), "agentId"), request.checks());
        return decided(issueId, decision, "AWAITING_REVIEW");
    }

    /**
     * POST /api/v1/issues/{id}/reviews: the selected reviewer's scores. 202 when another pass is requested.
     */
    @PostMapping("/{issueId}/reviews")
    public ResponseEntity<?> review(@PathVariable String issueId, @RequestBody ReviewRequest request) {
        Optional<ReviewRecord> decision = coordinator.submitReview(issueId,
                required(request.reviewerId(), "reviewerId"), request.toManualReview());
        return decided(issueId, decision, "REVIEW_RETRY_REQUESTED");
    }

    private static ResponseEntity<?> decided(String issueId, Optional<ReviewRecord> decision, String pendingStatus) {
        if (decision.isPresent()) {
            return ResponseEntity.ok(decision.get());
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("issueId", issueId);
        body.put("status", pendingStatus);
        return ResponseEntity.accepted().body(body);
    }

    private static String required(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
        return value;
    }
}
