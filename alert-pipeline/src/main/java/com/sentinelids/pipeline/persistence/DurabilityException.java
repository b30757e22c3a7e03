package com.sentinelids.pipeline.persistence;

import com.sentinelids.pipeline.PipelineException;

/**
 * An enriched alert could not be made durable.
 *
 * @author Naveed Gung
 */
public class DurabilityException extends PipelineException {

    public DurabilityException(String message) {
        super(message);
    }

    public DurabilityException(String message, Throwable cause) {
        super(message, cause);
    }
}
