package com.teamflow.core.epic;

import com.teamflow.core.events.EventBus;
import com.teamflow.core.events.EventTypes;
import com.teamflow.core.events.TeamflowEvent;
import com.teamflow.core.model.Epic;
import com.teamflow.core.model.EpicState;
import com.teamflow.core.sync.TrackerSync;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Entering BLOCKED stops new claims for the epic and labels its tracker issue.
 */
@Component
public class BlockedEpicHook implements TransitionHook {

    private static final Logger log = LoggerFactory.getLogger(BlockedEpicHook.class);

    private final TrackerSync trackerSync;
    private final EventBus eventBus;

    public BlockedEpicHook(TrackerSync trackerSync, EventBus eventBus) {
        this.trackerSync = trackerSync;
        this.eventBus = eventBus;
    }

    @Override
    public EpicState target() {
        return EpicState.BLOCKED;
    }

    @Override
    public void onEnter(Epic epic, EpicState from, String reason) {
        String why = reason == null ? "no reason given" : reason;
        log.warn("Epic {} is blocked: {}", epic.id(), why);
        eventBus.publish(TeamflowEvent.of(EventTypes.EPIC_BLOCKED, epic.id(), null,
                Map.of("from", from.name(), "reason", why)));
        trackerSync.markBlocked(epic.externalRef(), why);
    }
}
