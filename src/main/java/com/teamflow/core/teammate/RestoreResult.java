package com.teamflow.core.teammate;

import com.teamflow.core.model.Epic;
import com.teamflow.core.model.ProgressReport;

public record RestoreResult(
    Epic epic,
    RestoreStrategy strategy,
    int issues,
    int assignments,
    int reviews,
    int blocked,
    ProgressReport progress
) {}
