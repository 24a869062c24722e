package com.teamflow.core.sync;

import com.teamflow.core.config.TeamflowProperties;
import com.teamflow.core.coordinator.IssueBoard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Pull producer for the inbound queue: lists tracker issues changed since the last poll.
 */
@Component
public class TrackerPoller {

    private static final Logger log = LoggerFactory.getLogger(TrackerPoller.class);

    private final TrackerSync trackerSync;
    private final TrackerEventNormalizer normalizer;
    private final InboundEventQueue queue;
    private final IssueBoard board;
    private final TeamflowProperties.Sync config;
    private final AtomicReference<Instant> highWater = new AtomicReference<>();

    public TrackerPoller(TrackerSync trackerSync, TrackerEventNormalizer normalizer, InboundEventQueue queue,
                         IssueBoard board, TeamflowProperties properties) {
        this.trackerSync = trackerSync;
        this.normalizer = normalizer;
        this.queue = queue;
        this.board = board;
        this.config = properties.getSync();
    }

    @Scheduled(fixedDelayString = "${teamflow.sync.poll-interval-ms:60000}")
    public void scheduledPoll() {
        if (!config.isPollEnabled() || !trackerSync.isConfigured()) {
            return;
        }
        poll(highWater.get(), null);
    }

    /**
     * Queues every issue changed since {@code since} (all issues when null).
     *
     * @param epicHint epic that new issues are filed under, nullable
     * @return one future per queued event
     */
    public List<CompletableFuture<Boolean>> poll(Instant since, String epicHint) {
        List<TrackerIssue> changed = trackerSync.listChanged(since);
        List<CompletableFuture<Boolean>> queued = new ArrayList<>(changed.size());
        for (TrackerIssue issue : changed) {
            boolean known = board.findByNumber(issue.number()).isPresent();
            queued.add(queue.submit(normalizer.fromPoll(issue, known, epicHint)));
            if (issue.updatedAt() != null) {
                highWater.accumulateAndGet(issue.updatedAt(),
                        (current, seen) -> current == null || seen.isAfter(current) ? seen : current);
            }
        }
        if (!changed.isEmpty()) {
            log.info("Queued {} tracker change(s){}", changed.size(), since == null ? "" : " since " + since);
        }
        return queued;
    }
}
