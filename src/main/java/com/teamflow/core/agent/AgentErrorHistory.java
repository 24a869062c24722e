package com.teamflow.core.agent;

import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rolling record of each agent's most recent reported outcomes (success or failure).
 * Only the last {@link #CAPACITY} outcomes per agent are kept.
 */
@Service
public class AgentErrorHistory {

    static final int CAPACITY = 50;

    private final ConcurrentHashMap<String, Deque<Boolean>> outcomes = new ConcurrentHashMap<>();

    public void recordFailure(String agentId) {
        record(agentId, true);
    }

    public void recordSuccess(String agentId) {
        record(agentId, false);
    }

    /**
     * Fraction of failures among the agent's last {@code window} outcomes; 0 with no history.
     */
    public double failureRatio(String agentId, int window) {
        Deque<Boolean> history = outcomes.get(agentId);
        if (history == null) {
            return 0.0;
        }
        synchronized (history) {
            if (history.isEmpty()) {
                return 0.0;
            }
            int seen = 0;
            int failures = 0;
            var it = history.descendingIterator();
            while (it.hasNext() && seen < window) {
                if (it.next()) {
                    failures++;
                }
                seen++;
            }
            return (double) failures / seen;
        }
    }

    public int size(String agentId) {
        Deque<Boolean> history = outcomes.get(agentId);
        if (history == null) {
            return 0;
        }
        synchronized (history) {
            return history.size();
        }
    }

    public void clear(String agentId) {
        outcomes.remove(agentId);
    }

    private void record(String agentId, boolean failure) {
        Deque<Boolean> history = outcomes.computeIfAbsent(agentId, k -> new ArrayDeque<>());
        synchronized (history) {
            history.addLast(failure);
            while (history.size() > CAPACITY) {
                history.removeFirst();
            }
        }
    }
}
