package io.pagekeys.jobs;

import java.util.concurrent.RejectedExecutionException;

/**
 * Runs submitted work on its own worker(s). Implementations reject submissions they
 * cannot hold instead of blocking the caller.
 */
public interface Dispatcher {
    void dispatch(Runnable work) throws RejectedExecutionException;

    void shutdown();
}
