package io.pagekeys.jobs;

/**
 * A unit of background work. The name selects the queue the job runs on: jobs sharing
 * a name execute one at a time in submission order.
 */
public interface Job {
    String name();

    void execute() throws Exception;
}
