package io.hivestore.storage;

import io.hivestore.model.ConsensusProposal;

/**
 * A vote arrived after the proposal's timeout. The proposal has been moved to timeout by the time this is thrown.
 */
public final class ProposalTimedOutException extends IllegalStateException {
    private final transient ConsensusProposal proposal;

    public ProposalTimedOutException(ConsensusProposal proposal) {
        super("Proposal " + proposal.id() + " timed out before the vote");
        this.proposal = proposal;
    }

    public ConsensusProposal proposal() {
        return proposal;
    }
}
