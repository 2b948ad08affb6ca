package io.hivestore.storage;

import io.hivestore.model.ConsensusProposal;
import io.hivestore.model.ConsensusStatus;
import io.hivestore.model.ConsensusVote;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Quorum bookkeeping for swarm proposals.
 *
 * <p>Only agents registered in the proposal's swarm may vote. After each vote the proposal is
 * achieved once {@code votesFor / votesTotal} reaches the threshold, and failed once that ratio
 * could not reach it even if every member that has not voted yet voted in favor. Anything else
 * stays pending until the next vote, an explicit status update or the timeout.
 */
public final class ConsensusEngine {
    private final Database database;

    public ConsensusEngine(Database database) {
        this.database = database;
    }

    public ConsensusProposal create(NewProposal p, long nowMs) {
        if (p.thresholdRequired() < 0.0d || p.thresholdRequired() > 1.0d) {
            throw new IllegalArgumentException("Threshold must be within [0,1]: " + p.thresholdRequired());
        }
        if (p.timeoutAtMs() != null && p.timeoutAtMs() <= nowMs) {
            throw new IllegalArgumentException("Timeout must lie in the future: " + p.timeoutAtMs());
        }
        database.update(StoreOperation.CREATE_PROPOSAL,
                p.id(),
                p.swarmId(),
                p.proposalType(),
                p.proposalData(),
                p.proposedBy(),
                p.thresholdRequired(),
                0,
                0,
                0,
                ConsensusStatus.PENDING,
                nowMs,
                null,
                p.timeoutAtMs()
        );
        return new ConsensusProposal(p.id(), p.swarmId(), p.proposalType(), p.proposalData(), p.proposedBy(),
                p.thresholdRequired(), 0, 0, 0, ConsensusStatus.PENDING, nowMs, null, p.timeoutAtMs());
    }

    public Optional<ConsensusProposal> get(String id) {
        return database.queryOne(StoreOperation.GET_PROPOSAL, ConsensusEngine::mapProposal, id);
    }

    /**
     * Records one vote and re-evaluates the quorum in the same transaction.
     *
     * @return empty if the proposal does not exist
     * @throws IllegalArgumentException  if the agent is not registered in the proposal's swarm
     * @throws ProposalTimedOutException if the proposal was past its timeout; it is timed out before this is thrown
     * @throws IllegalStateException     if the proposal is already resolved or the agent has already voted on it
     */
    public Optional<VoteOutcome> submitVote(String proposalId, String agentId, boolean inFavor, String reason, long nowMs) {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("Voting agent id must not be blank");
        }
        Optional<VoteOutcome> outcome = database.inTransaction("submitVote", () -> {
            Optional<ConsensusProposal> current = get(proposalId);
            if (current.isEmpty()) {
                return Optional.empty();
            }
            ConsensusProposal proposal = current.get();
            Optional<String> voterSwarm = database.queryOne(StoreOperation.GET_AGENT,
                    rs -> rs.getString("swarm_id"), agentId);
            if (voterSwarm.isEmpty() || !voterSwarm.get().equals(proposal.swarmId())) {
                throw new IllegalArgumentException(
                        "Agent " + agentId + " is not a member of swarm " + proposal.swarmId());
            }
            if (proposal.status().isTerminal()) {
                throw new IllegalStateException(
                        "Proposal " + proposalId + " is already " + proposal.status().wireValue());
            }
            if (proposal.timeoutAtMs() != null && nowMs >= proposal.timeoutAtMs()) {
                // commit the timeout before rejecting the vote
                database.update(StoreOperation.RESOLVE_PROPOSAL, ConsensusStatus.TIMEOUT, nowMs, proposalId);
                return Optional.of(new VoteOutcome(get(proposalId).orElseThrow(), false, true));
            }
            if (database.queryOne(StoreOperation.HAS_VOTED, rs -> true, proposalId, agentId).isPresent()) {
                throw new IllegalStateException("Agent " + agentId + " already voted on proposal " + proposalId);
            }
            database.update(StoreOperation.RECORD_VOTE, proposalId, agentId, inFavor, reason, nowMs);
            database.update(StoreOperation.APPLY_VOTE, inFavor ? 1 : 0, inFavor ? 0 : 1, proposalId);

            ConsensusProposal counted = get(proposalId).orElseThrow();
            long electorate = database.count(StoreOperation.COUNT_SWARM_AGENTS, counted.swarmId());
            ConsensusStatus verdict = evaluate(counted, electorate);
            if (verdict == ConsensusStatus.PENDING) {
                return Optional.of(new VoteOutcome(counted, true, false));
            }
            database.update(StoreOperation.RESOLVE_PROPOSAL, verdict, nowMs, proposalId);
            return Optional.of(new VoteOutcome(get(proposalId).orElseThrow(), true, true));
        });
        if (outcome.isPresent() && !outcome.get().accepted()) {
            throw new ProposalTimedOutException(outcome.get().proposal());
        }
        return outcome;
    }

    /**
     * Moves a pending proposal to a terminal status.
     *
     * @return false if the proposal does not exist
     * @throws IllegalArgumentException if {@code status} is not terminal
     * @throws IllegalStateException    if the proposal is already terminal
     */
    public boolean updateStatus(String id, ConsensusStatus status, long nowMs) {
        if (status == null || !status.isTerminal()) {
            throw new IllegalArgumentException("Proposal status can only move to a terminal value, got " + status);
        }
        return database.inTransaction("resolveProposal", () -> {
            if (database.update(StoreOperation.RESOLVE_PROPOSAL, status, nowMs, id) == 1) {
                return true;
            }
            Optional<ConsensusProposal> existing = get(id);
            if (existing.isEmpty()) {
                return false;
            }
            throw new IllegalStateException(
                    "Proposal " + id + " is already " + existing.get().status().wireValue());
        });
    }

    public List<ConsensusProposal> listRecent(String swarmId, int limit) {
        return database.query(StoreOperation.LIST_RECENT_PROPOSALS, ConsensusEngine::mapProposal,
                swarmId, limit <= 0 ? 10 : limit);
    }

    public List<ConsensusVote> listVotes(String proposalId) {
        return database.query(StoreOperation.LIST_VOTES, rs -> new ConsensusVote(
                rs.getString("proposal_id"),
                rs.getString("agent_id"),
                Rows.flag(rs, "vote"),
                rs.getString("reason"),
                rs.getLong("created_at")
        ), proposalId);
    }

    /**
     * Times out every pending proposal whose timeout_at has passed.
     *
     * @return number of proposals moved to timeout
     */
    public int expireOverdue(long nowMs) {
        return database.update(StoreOperation.EXPIRE_PROPOSALS, nowMs, nowMs);
    }

    /**
     * @param electorate agents registered in the proposal's swarm
     */
    static ConsensusStatus evaluate(ConsensusProposal p, long electorate) {
        long total = p.votesTotal();
        if (total <= 0L) {
            return ConsensusStatus.PENDING;
        }
        double threshold = p.thresholdRequired();
        if ((double) p.votesFor() / total >= threshold) {
            return ConsensusStatus.ACHIEVED;
        }
        long remaining = Math.max(0L, electorate - total);
        if ((double) (p.votesFor() + remaining) / (total + remaining) < threshold) {
            return ConsensusStatus.FAILED;
        }
        return ConsensusStatus.PENDING;
    }

    static ConsensusProposal mapProposal(ResultSet rs) throws SQLException {
        return new ConsensusProposal(
                rs.getString("id"),
                rs.getString("swarm_id"),
                rs.getString("proposal_type"),
                rs.getString("proposal_data"),
                rs.getString("proposed_by"),
                rs.getDouble("threshold_required"),
                rs.getInt("votes_for"),
                rs.getInt("votes_against"),
                rs.getInt("votes_total"),
                ConsensusStatus.fromWire(rs.getString("status")),
                rs.getLong("created_at"),
                Rows.nullableLong(rs, "resolved_at"),
                Rows.nullableLong(rs, "timeout_at")
        );
    }

    public record NewProposal(
            String id,
            String swarmId,
            String proposalType,
            String proposalData,
            String proposedBy,
            double thresholdRequired,
            Long timeoutAtMs
    ) {
    }

    /**
     * @param accepted whether the vote was counted
     * @param resolved whether the proposal reached a terminal status during this call
     */
    public record VoteOutcome(ConsensusProposal proposal, boolean accepted, boolean resolved) {
    }
}
