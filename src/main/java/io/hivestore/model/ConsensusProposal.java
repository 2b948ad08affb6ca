package io.hivestore.model;

public record ConsensusProposal(
        String id,
        String swarmId,
        String proposalType,
        String proposalData,
        String proposedBy,
        double thresholdRequired,
        int votesFor,
        int votesAgainst,
        int votesTotal,
        ConsensusStatus status,
        long createdAtMs,
        Long resolvedAtMs,
        Long timeoutAtMs
) {
    /**
     * Fraction of cast votes in favor; 0 before the first vote.
     */
    public double supportRatio() {
        return votesTotal == 0 ? 0.0d : (double) votesFor / votesTotal;
    }
}
