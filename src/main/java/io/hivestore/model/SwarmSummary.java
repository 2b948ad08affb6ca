package io.hivestore.model;

public record SwarmSummary(Swarm swarm, int agentCount) {
}
