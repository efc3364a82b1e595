package io.pagekeys.model;

public record QueueStats(
        String queueName,
        int jobsRemaining,
        int highWaterMark,
        boolean active
) {
}
