package com.teamflow.core.coordinator;

import com.teamflow.core.model.AgentScore;
import com.teamflow.core.model.Assignment;
import com.teamflow.core.model.AssignmentOutcome;
import com.teamflow.core.model.Issue;
import com.teamflow.core.persistence.CoordinationRepository;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Active assignments (at most one per issue) plus the closed history kept for analytics.
 */
@Service
public class AssignmentLedger {

    private final ConcurrentHashMap<String, Assignment> active = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<Assignment> history = new CopyOnWriteArrayList<>();
    private final CoordinationRepository repository;

    public AssignmentLedger(CoordinationRepository repository) {
        this.repository = repository;
    }

    /**
     * @throws IllegalStateException if the issue already has an open assignment
     */
    public Assignment open(Issue issue, String agentId, AgentScore score, Instant at) {
        var assignment = new Assignment(UUID.randomUUID().toString(), issue.id(), issue.epicId(), agentId,
                score.total(), score.breakdown(), at, null, null);
        Assignment previous = active.putIfAbsent(issue.id(), assignment);
        if (previous != null) {
            throw new IllegalStateException("Issue " + issue.id() + " already assigned to " + previous.agentId());
        }
        repository.saveAssignment(assignment);
        return assignment;
    }

    public Optional<Assignment> activeFor(String issueId) {
        return Optional.ofNullable(active.get(issueId));
    }

    public Optional<Assignment> close(String issueId, AssignmentOutcome outcome, Instant at) {
        Assignment current = active.remove(issueId);
        if (current == null) {
            return Optional.empty();
        }
        Assignment closed = current.close(outcome, at);
        history.add(closed);
        repository.saveAssignment(closed);
        return Optional.of(closed);
    }

    public List<Assignment> activeForAgent(String agentId) {
        return active.values().stream()
                .filter(a -> a.agentId().equals(agentId))
                .sorted(Comparator.comparing(Assignment::claimedAt))
                .toList();
    }

    /** Open and closed assignments of an epic, oldest claim first. */
    public List<Assignment> forEpic(String epicId) {
        var all = new ArrayList<Assignment>();
        active.values().stream().filter(a -> a.epicId().equals(epicId)).forEach(all::add);
        history.stream().filter(a -> a.epicId().equals(epicId)).forEach(all::add);
        all.sort(Comparator.comparing(Assignment::claimedAt));
        return all;
    }

    public int activeCount() {
        return active.size();
    }

    public void restore(Collection<Assignment> restored) {
        for (Assignment a : restored) {
            if (a.isOpen()) {
                active.put(a.issueId(), a);
            } else {
                history.addIfAbsent(a);
            }
        }
    }

    public void removeEpic(String epicId) {
        active.values().removeIf(a -> a.epicId().equals(epicId));
        history.removeIf(a -> a.epicId().equals(epicId));
    }
}
