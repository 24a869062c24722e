package com.teamflow.core.review;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers which agents reviewed each other recently. Pairs are unordered.
 */
public class RecentReviewPairs {

    private final ConcurrentHashMap<String, Instant> lastReviewed = new ConcurrentHashMap<>();
    private final Duration window;

    public RecentReviewPairs(Duration window) {
        this.window = window;
    }

    public void record(String reviewerId, String authorId, Instant at) {
        lastReviewed.merge(key(reviewerId, authorId), at, (a, b) -> a.isAfter(b) ? a : b);
    }

    public boolean recentlyPaired(String a, String b, Instant now) {
        Instant last = lastReviewed.get(key(a, b));
        return last != null && last.plus(window).isAfter(now);
    }

    private static String key(String a, String b) {
        return a.compareTo(b) <= 0 ? a + "|" + b : b + "|" + a;
    }
}
