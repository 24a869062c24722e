package com.teamflow.core.coordinator;

import com.teamflow.core.error.NotFoundException;
import com.teamflow.core.model.Issue;
import com.teamflow.core.model.IssueStatus;
import com.teamflow.core.persistence.CoordinationRepository;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Live table of issues across all epics. Each change is an atomic replace and is written through to the store.
 */
@Service
public class IssueBoard {

    private static final Comparator<Issue> BY_NUMBER = Comparator
            .comparing((Issue i) -> i.number() == null ? Integer.MAX_VALUE : i.number())
            .thenComparing(Issue::id);

    private final ConcurrentHashMap<String, Issue> issues = new ConcurrentHashMap<>();
    private final CoordinationRepository repository;

    public IssueBoard(CoordinationRepository repository) {
        this.repository = repository;
    }

    public Issue put(Issue issue) {
        issues.put(issue.id(), issue);
        repository.saveIssue(issue);
        return issue;
    }

    /** Loads issues without writing them back. */
    public void restore(Collection<Issue> restored) {
        restored.forEach(i -> issues.put(i.id(), i));
    }

    public Optional<Issue> find(String issueId) {
        return Optional.ofNullable(issues.get(issueId));
    }

    public Issue get(String issueId) {
        return find(issueId).orElseThrow(() -> new NotFoundException("Unknown issue: " + issueId));
    }

    public Optional<Issue> findByNumber(int number) {
        return issues.values().stream()
                .filter(i -> i.number() != null && i.number() == number)
                .findFirst();
    }

    /**
     * Applies {@code change} atomically to the current value and persists the result.
     */
    public Issue update(String issueId, UnaryOperator<Issue> change) {
        Issue updated = issues.computeIfPresent(issueId, (id, current) -> change.apply(current));
        if (updated == null) {
            throw new NotFoundException("Unknown issue: " + issueId);
        }
        repository.saveIssue(updated);
        return updated;
    }

    public List<Issue> byEpic(String epicId) {
        return issues.values().stream()
                .filter(i -> i.epicId().equals(epicId))
                .sorted(BY_NUMBER)
                .toList();
    }

    public List<Issue> inFlight() {
        return issues.values().stream()
                .filter(i -> i.status().isInFlight())
                .sorted(BY_NUMBER)
                .toList();
    }

    public List<Issue> assignedTo(String agentId) {
        return issues.values().stream()
                .filter(i -> agentId.equals(i.assigneeId()) && !i.status().isTerminal())
                .sorted(BY_NUMBER)
                .toList();
    }

    /** Open issues of the epic whose dependencies are all done. */
    public List<Issue> ready(String epicId) {
        return byEpic(epicId).stream()
                .filter(i -> i.status() == IssueStatus.OPEN && dependenciesMet(i))
                .toList();
    }

    /**
     * True when every dependency is DONE. Unknown dependency ids count as unmet.
     */
    public boolean dependenciesMet(Issue issue) {
        for (String dep : issue.dependencies()) {
            Issue dependency = issues.get(dep);
            if (dependency == null || dependency.status() != IssueStatus.DONE) {
                return false;
            }
        }
        return true;
    }

    /** Issues that list {@code issueId} as a dependency. */
    public List<Issue> dependents(String issueId) {
        return issues.values().stream()
                .filter(i -> i.dependencies().contains(issueId))
                .sorted(BY_NUMBER)
                .toList();
    }

    public void removeEpic(String epicId) {
        issues.values().removeIf(i -> i.epicId().equals(epicId));
    }
}
