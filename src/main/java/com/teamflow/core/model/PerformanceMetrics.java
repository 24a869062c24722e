package com.teamflow.core.model;

import java.io.Serializable;
import java.util.HashMap;
import java.util.Map;

/**
 * Rolling performance of an agent, updated after every closed issue.
 *
 * @param successRate             fraction of completed issues that were approved (0–1)
 * @param tasksCompleted          number of closed issues
 * @param averageMinutes          average completion time over all issues
 * @param averageMinutesByType    average completion time keyed by issue type
 */
public record PerformanceMetrics(
    double successRate,
    int tasksCompleted,
    double averageMinutes,
    Map<String, Double> averageMinutesByType
) implements Serializable {

    public PerformanceMetrics {
        averageMinutesByType = averageMinutesByType == null ? Map.of() : Map.copyOf(averageMinutesByType);
    }

    public static PerformanceMetrics fresh() {
        return new PerformanceMetrics(0.5, 0, 0.0, Map.of());
    }

    /** Average for the given issue type, falling back to the overall average. */
    public double averageMinutesFor(String issueType) {
        if (issueType != null && averageMinutesByType.containsKey(issueType)) {
            return averageMinutesByType.get(issueType);
        }
        return averageMinutes;
    }

    public PerformanceMetrics record(boolean success, double minutes, String issueType) {
        int n = tasksCompleted + 1;
        double rate = ((successRate * tasksCompleted) + (success ? 1.0 : 0.0)) / n;
        double avg = ((averageMinutes * tasksCompleted) + minutes) / n;
        var byType = new HashMap<>(averageMinutesByType);
        if (issueType != null) {
            // exponential smoothing so old samples fade out
            byType.merge(issueType, minutes, (old, sample) -> old * 0.7 + sample * 0.3);
        }
        return new PerformanceMetrics(rate, n, avg, byType);
    }
}
