package com.teamflow.support;

import com.teamflow.core.model.AgentProfile;
import com.teamflow.core.model.Capability;
import com.teamflow.core.model.Issue;
import com.teamflow.core.model.PerformanceMetrics;
import com.teamflow.core.model.Priority;
import com.teamflow.core.model.WorkRequirements;

import java.time.Instant;
import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Small builders shared by the unit tests.
 */
public final class Fixtures {

    private Fixtures() {}

    public static Set<Capability> caps(String... names) {
        return Arrays.stream(names).map(Capability::of).collect(Collectors.toSet());
    }

    public static AgentProfile agent(String id, double successRate, double workload, double health,
                                     int tasksCompleted, String... capabilities) {
        return new AgentProfile(id, "coder", caps(capabilities), workload, health, 1.0,
                new PerformanceMetrics(successRate, tasksCompleted, 30.0, null),
                3, 0, 1, Instant.EPOCH);
    }

    public static Issue issue(String id, String epicId, String... required) {
        return Issue.open(id, epicId, null, "Issue " + id, WorkRequirements.requiring(caps(required)));
    }

    public static Issue issue(String id, String epicId, Priority priority, Set<String> dependencies,
                              String... required) {
        var req = new WorkRequirements(caps(required), null, null, null, null, null, priority, null, null,
                dependencies, null);
        return Issue.open(id, epicId, null, "Issue " + id, req);
    }
}
