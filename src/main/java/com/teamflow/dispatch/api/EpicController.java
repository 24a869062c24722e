package com.teamflow.dispatch.api;

import com.teamflow.core.coordinator.IssueBoard;
import com.teamflow.core.model.Epic;
import com.teamflow.core.model.EpicState;
import com.teamflow.core.model.Issue;
import com.teamflow.core.model.ProgressReport;
import com.teamflow.core.progress.ProgressAggregator;
import com.teamflow.core.teammate.TeammateService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only REST view of epics, their issues and progress.
 */
@RestController
@RequestMapping("/api/v1/epics")
public class EpicController {

    private final TeammateService teammateService;
    private final IssueBoard board;
    private final ProgressAggregator progress;

    public EpicController(TeammateService teammateService, IssueBoard board, ProgressAggregator progress) {
        this.teammateService = teammateService;
        this.board = board;
        this.progress = progress;
    }

    /**
     * GET /api/v1/epics?state=ACTIVE&amp;since=2024-01-01T00:00:00Z
     */
    @GetMapping
    public List<Epic> list(@RequestParam(required = false) EpicState state,
                           @RequestParam(required = false)
                           @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant since) {
        return teammateService.listEpics(state, since);
    }

    @GetMapping("/{epicId}")
    public ResponseEntity<Map<String, Object>> get(@PathVariable String epicId) {
        Epic epic = teammateService.getEpic(epicId);
        List<Issue> issues = board.byEpic(epicId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("epic", epic);
        body.put("issues", issues);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/{epicId}/progress")
    public ProgressReport progress(@PathVariable String epicId) {
        return progress.report(epicId);
    }
}
