package com.teamflow.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Set;

/**
 * Structured requirements of an issue, as produced by the work-requirement extractor.
 *
 * @param requiredCapabilities  capabilities the assignee must have
 * @param preferredCapabilities nice-to-have capabilities (only affect specialization)
 * @param languages             languages the work touches (partial credit dimension)
 * @param frameworks            frameworks the work touches (partial credit dimension)
 * @param domains               domain tags used for specialization
 * @param issueType             kind of work ("feature", "bugfix", "docs"...), nullable
 * @param priority              priority, defaults to MEDIUM
 * @param complexity            complexity, defaults to MEDIUM
 * @param estimatedMinutes      estimate used for the experience speed bonus, nullable
 * @param dependencies          ids of issues that must be done first
 * @param acceptanceCriteria    criteria a reviewer must confirm
 */
public record WorkRequirements(
    Set<Capability> requiredCapabilities,
    Set<Capability> preferredCapabilities,
    Set<Capability> languages,
    Set<Capability> frameworks,
    Set<Capability> domains,
    String issueType,
    Priority priority,
    Complexity complexity,
    Integer estimatedMinutes,
    Set<String> dependencies,
    List<String> acceptanceCriteria
) implements Serializable {

    public WorkRequirements {
        requiredCapabilities = requiredCapabilities == null ? Set.of() : Set.copyOf(requiredCapabilities);
        preferredCapabilities = preferredCapabilities == null ? Set.of() : Set.copyOf(preferredCapabilities);
        languages = languages == null ? Set.of() : Set.copyOf(languages);
        frameworks = frameworks == null ? Set.of() : Set.copyOf(frameworks);
        domains = domains == null ? Set.of() : Set.copyOf(domains);
        priority = priority == null ? Priority.MEDIUM : priority;
        complexity = complexity == null ? Complexity.MEDIUM : complexity;
        dependencies = dependencies == null ? Set.of() : Set.copyOf(dependencies);
        acceptanceCriteria = acceptanceCriteria == null ? List.of() : List.copyOf(acceptanceCriteria);
    }

    public static WorkRequirements none() {
        return new WorkRequirements(null, null, null, null, null, null, null, null, null, null, null);
    }

    public static WorkRequirements requiring(Set<Capability> required) {
        return new WorkRequirements(required, null, null, null, null, null, null, null, null, null, null);
    }

    /** Total number of entries the capability factor is normalized against. */
    public int requirementCount() {
        return requiredCapabilities.size() + languages.size() + frameworks.size();
    }
}
