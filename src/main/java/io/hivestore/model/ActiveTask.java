package io.hivestore.model;

public record ActiveTask(Task task, String agentName) {
}
