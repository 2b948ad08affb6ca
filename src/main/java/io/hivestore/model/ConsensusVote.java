package io.hivestore.model;

public record ConsensusVote(
        String proposalId,
        String agentId,
        boolean inFavor,
        String reason,
        long createdAtMs
) {
}
