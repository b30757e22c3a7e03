package com.sentinelids.pipeline.scoring;

import com.sentinelids.pipeline.PipelineException;

/**
 * The scoring capability failed or returned an unusable classification.
 *
 * @author Naveed Gung
 */
public class ScoringException extends PipelineException {

    public ScoringException(String message) {
        super(message);
    }

    public ScoringException(String message, Throwable cause) {
        super(message, cause);
    }
}
