package com.teamflow.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * An epic-level (architectural) proposal put to a weighted vote.
 *
 * @param id            proposal id
 * @param epicId        epic the decision belongs to
 * @param title         what is being decided
 * @param decisionClass standard or critical
 * @param leadId        voter whose vote carries the lead weight, nullable
 * @param votes         cast votes, one per voter
 */
public record ConsensusProposal(
    String id,
    String epicId,
    String title,
    DecisionClass decisionClass,
    String leadId,
    List<Vote> votes
) implements Serializable {

    public ConsensusProposal {
        decisionClass = decisionClass == null ? DecisionClass.STANDARD : decisionClass;
        votes = votes == null ? List.of() : List.copyOf(votes);
    }
}
