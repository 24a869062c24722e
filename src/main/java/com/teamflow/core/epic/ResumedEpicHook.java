package com.teamflow.core.epic;

import com.teamflow.core.model.Epic;
import com.teamflow.core.model.EpicState;
import com.teamflow.core.sync.TrackerSync;
import org.springframework.stereotype.Component;

/**
 * Leaving BLOCKED for ACTIVE removes the blocked label again.
 */
@Component
public class ResumedEpicHook implements TransitionHook {

    private final TrackerSync trackerSync;

    public ResumedEpicHook(TrackerSync trackerSync) {
        this.trackerSync = trackerSync;
    }

    @Override
    public EpicState target() {
        return EpicState.ACTIVE;
    }

    @Override
    public void onEnter(Epic epic, EpicState from, String reason) {
        if (from == EpicState.BLOCKED) {
            trackerSync.clearBlocked(epic.externalRef());
        }
    }
}
