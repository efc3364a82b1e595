package io.pagekeys.jobs;

public final class JobRejectedException extends IllegalStateException {
    private final String queueName;

    public JobRejectedException(String queueName, Throwable cause) {
        super("Failed to dispatch job to queue: " + queueName, cause);
        this.queueName = queueName;
    }

    public String queueName() {
        return queueName;
    }
}
