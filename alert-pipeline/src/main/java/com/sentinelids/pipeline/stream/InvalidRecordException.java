package com.sentinelids.pipeline.stream;

import com.sentinelids.pipeline.PipelineException;

/**
 * A record could not be encoded into stream fields.
 *
 * @author Naveed Gung
 */
public class InvalidRecordException extends PipelineException {

    public InvalidRecordException(String message) {
        super(message);
    }

    public InvalidRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}
