package com.teamflow.core.review;

import com.teamflow.core.model.AgentProfile;

public record ReviewerChoice(AgentProfile reviewer, double score, double overlap, boolean fromEpicPool) {}
