package com.teamflow.core.teammate;

/**
 * @param epicRefreshed whether the epic's own tracker issue had changed and was applied
 * @param queued        tracker changes queued
 * @param applied       of those, changes that were applied (the rest were duplicates or stale)
 */
public record SyncResult(String epicId, boolean epicRefreshed, int queued, int applied) {}
