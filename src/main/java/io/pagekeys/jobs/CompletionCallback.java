package io.pagekeys.jobs;

@FunctionalInterface
public interface CompletionCallback {
    /**
     * Runs on the job's worker thread after {@link Job#execute()} returns.
     *
     * @param error the exception thrown by the job, or {@code null} on success
     */
    void onComplete(Exception error);
}
