package com.teamflow.core.sync;

import com.teamflow.core.config.TeamflowProperties;
import com.teamflow.core.error.ExternalSyncFailureException;
import com.teamflow.core.metrics.TeamflowMetrics;
import com.teamflow.core.model.Issue;
import com.teamflow.core.model.IssueStatus;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Mirrors local coordination state to the issue tracker.
 * <p>
 * Writes are retried with exponential backoff. When retries run out the
 * failure is logged and counted, and the caller carries on with local state;
 * a tracker outage never blocks coordination. Issues without a tracker number
 * and an unconfigured tracker are skipped silently.
 */
@Service
public class TrackerSync {

    private static final Logger log = LoggerFactory.getLogger(TrackerSync.class);

    public static final String STATUS_LABEL_PREFIX = "status:";
    public static final String BLOCKED_LABEL = "teamflow:blocked";
    public static final String HUMAN_LABEL = "needs-human";

    private final IssueTrackerClient client;
    private final TeamflowMetrics metrics;
    private final Retry retry;
    private final ConcurrentHashMap<Integer, String> etags = new ConcurrentHashMap<>();

    @Autowired
    public TrackerSync(IssueTrackerClient client, TeamflowMetrics metrics, TeamflowProperties properties) {
        this(client, metrics, TrackerRetry.create("tracker", properties.getSync().getMaxAttempts(),
                properties.getSync().getInitialBackoff()));
    }

    public TrackerSync(IssueTrackerClient client, TeamflowMetrics metrics, Retry retry) {
        this.client = client;
        this.metrics = metrics;
        this.retry = retry;
    }

    public boolean isConfigured() {
        return client.isConfigured();
    }

    /** Sets the assignee and the in-progress status label. */
    public boolean mirrorClaim(Issue issue, String agentId) {
        return write(issue.number(), "mirror claim", n -> {
            client.setAssignees(n, List.of(agentId));
            client.addLabels(n, List.of(statusLabel(IssueStatus.IN_PROGRESS)));
        });
    }

    /** Replaces the previous status label with the one for {@code to}. */
    public boolean mirrorStatus(Issue issue, IssueStatus from, IssueStatus to) {
        return write(issue.number(), "mirror status", n -> {
            if (from != null && from != to) {
                client.removeLabel(n, statusLabel(from));
            }
            client.addLabels(n, List.of(statusLabel(to)));
        });
    }

    public boolean mirrorRelease(Issue issue) {
        return write(issue.number(), "mirror release", n -> client.setAssignees(n, List.of()));
    }

    public boolean markBlocked(Integer number, String reason) {
        return write(number, "mark blocked", n -> {
            client.addLabels(n, List.of(BLOCKED_LABEL));
            client.comment(n, "Blocked: " + reason);
        });
    }

    public boolean clearBlocked(Integer number) {
        return write(number, "clear blocked", n -> client.removeLabel(n, BLOCKED_LABEL));
    }

    public boolean escalateToHuman(Integer number, String diagnostic) {
        return write(number, "escalate to human", n -> {
            client.addLabels(n, List.of(HUMAN_LABEL));
            client.comment(n, diagnostic);
        });
    }

    public boolean comment(Integer number, String body) {
        return write(number, "comment", n -> client.comment(n, body));
    }

    /**
     * Fetches an issue only if it changed since the last fetch.
     *
     * @return the fresh issue, or empty when unchanged, unconfigured or unreachable
     */
    public Optional<TrackerIssue> fetchIfChanged(int number) {
        if (!client.isConfigured()) {
            return Optional.empty();
        }
        try {
            FetchResult<TrackerIssue> result = retry.executeSupplier(
                    () -> client.getIssue(number, etags.get(number)));
            if (result.etag() != null) {
                etags.put(number, result.etag());
            }
            return result.notModified() ? Optional.empty() : Optional.of(result.value());
        } catch (ExternalSyncFailureException e) {
            onFailure("fetch", e);
            return Optional.empty();
        }
    }

    /** Issues changed since {@code since}; empty when the tracker is unreachable. */
    public List<TrackerIssue> listChanged(Instant since) {
        if (!client.isConfigured()) {
            return List.of();
        }
        try {
            return retry.executeSupplier(() -> client.listIssues(since));
        } catch (ExternalSyncFailureException e) {
            onFailure("list", e);
            return List.of();
        }
    }

    public static String statusLabel(IssueStatus status) {
        return STATUS_LABEL_PREFIX + status.name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    @FunctionalInterface
    private interface TrackerWrite {
        void apply(int number);
    }

    private boolean write(Integer number, String operation, TrackerWrite action) {
        if (number == null || !client.isConfigured()) {
            log.debug("Skipping tracker {} (no issue number or tracker not configured)", operation);
            return false;
        }
        try {
            retry.executeRunnable(() -> action.apply(number));
            return true;
        } catch (ExternalSyncFailureException e) {
            onFailure(operation, e);
            return false;
        }
    }

    private void onFailure(String operation, ExternalSyncFailureException e) {
        metrics.recordSyncFailure(operation.replace(' ', '_'));
        log.warn("Tracker {} failed after {} attempts, continuing with local state: {}",
                operation, retry.getRetryConfig().getMaxAttempts(), e.getMessage());
    }
}
