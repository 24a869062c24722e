package com.teamflow.core.epic;

import com.teamflow.core.model.Epic;
import com.teamflow.core.model.EpicState;
import com.teamflow.core.sync.TrackerSync;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Entering COMPLETED freezes assignments (only ACTIVE epics accept claims) and reports it on the tracker.
 */
@Component
public class CompletedEpicHook implements TransitionHook {

    private static final Logger log = LoggerFactory.getLogger(CompletedEpicHook.class);

    private final TrackerSync trackerSync;

    public CompletedEpicHook(TrackerSync trackerSync) {
        this.trackerSync = trackerSync;
    }

    @Override
    public EpicState target() {
        return EpicState.COMPLETED;
    }

    @Override
    public void onEnter(Epic epic, EpicState from, String reason) {
        log.info("Epic {} completed; assignments are frozen", epic.id());
        trackerSync.comment(epic.externalRef(), "Epic completed: " + epic.title());
    }
}
