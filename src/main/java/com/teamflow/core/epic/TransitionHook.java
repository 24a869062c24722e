package com.teamflow.core.epic;

import com.teamflow.core.model.Epic;
import com.teamflow.core.model.EpicState;

/**
 * Side effect run once when an epic enters a state, before the new state is committed.
 * <p>
 * A hook that throws aborts the transition and nothing is committed.
 */
public interface TransitionHook {

    /** The state whose entry triggers this hook. */
    EpicState target();

    void onEnter(Epic epic, EpicState from, String reason);
}
