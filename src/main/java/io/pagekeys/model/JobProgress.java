package io.pagekeys.model;

import java.util.List;

public record JobProgress(
        boolean running,
        List<QueueStats> queueStats,
        int totalActive,
        int totalQueues
) {
}
