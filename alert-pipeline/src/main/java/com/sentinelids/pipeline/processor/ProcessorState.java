package com.sentinelids.pipeline.processor;

/**
 * Lifecycle of an {@link AlertProcessor}: {@code STOPPED -> RUNNING -> DRAINING -> STOPPED}.
 *
 * @author Naveed Gung
 */
public enum ProcessorState {

    /** Not reading; no workers. */
    STOPPED,
    /** Reading batches and dispatching them to workers. */
    RUNNING,
    /** No new batches admitted; waiting for in-flight work within the grace period. */
    DRAINING
}
