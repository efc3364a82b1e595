package io.pagekeys.jobs;

public record JobCompletion(
        String jobName,
        Exception error
) {
    public boolean succeeded() {
        return error == null;
    }
}
