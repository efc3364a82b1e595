/**
 * Runtime orchestration package.
 *
 * <p>{@link io.pagekeys.runtime.PageService} wires the page store, the rolling
 * migration pipeline and the job queue coordinator together: it serves reads with
 * self-healing write-back, canonicalizes writes, and starts key reconciliation sweeps.
 */
package io.pagekeys.runtime;
