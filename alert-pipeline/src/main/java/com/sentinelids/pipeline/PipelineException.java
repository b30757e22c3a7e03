package com.sentinelids.pipeline;

/**
 * Root of the pipeline's failure taxonomy.
 *
 * <p>
 * Adapters translate driver and framework exceptions into one of the
 * subclasses at their boundary, so the processor only needs to reason about
 * broker, record, durability and scoring failures.
 * </p>
 *
 * @author Naveed Gung
 */
public abstract class PipelineException extends RuntimeException {

    protected PipelineException(String message) {
        super(message);
    }

    protected PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
