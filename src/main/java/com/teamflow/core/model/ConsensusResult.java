package com.teamflow.core.model;

import java.io.Serializable;

public record ConsensusResult(
    String proposalId,
    double approveWeight,
    double totalWeight,
    double approveFraction,
    double threshold,
    boolean accepted
) implements Serializable {}
