package com.teamflow.core.sync;

import com.teamflow.core.error.ExternalSyncFailureException;

import java.time.Instant;
import java.util.List;

/**
 * Read and write access to the external issue tracker.
 * <p>
 * Every method throws {@link ExternalSyncFailureException} when the tracker
 * cannot be reached or rejects the call.
 */
public interface IssueTrackerClient {

    boolean isConfigured();

    /**
     * Issues updated at or after {@code since} (all issues when null), open and closed.
     */
    List<TrackerIssue> listIssues(Instant since);

    /**
     * Fetches one issue, sending {@code etag} (nullable) so an unchanged issue costs no body.
     */
    FetchResult<TrackerIssue> getIssue(int number, String etag);

    void setAssignees(int number, List<String> assignees);

    void addLabels(int number, List<String> labels);

    void removeLabel(int number, String label);

    void comment(int number, String body);
}
