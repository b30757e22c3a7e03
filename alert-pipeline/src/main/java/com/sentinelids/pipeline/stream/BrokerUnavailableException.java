package com.sentinelids.pipeline.stream;

import com.sentinelids.pipeline.PipelineException;

/**
 * The stream broker could not be reached or rejected a command.
 *
 * @author Naveed Gung
 */
public class BrokerUnavailableException extends PipelineException {

    public BrokerUnavailableException(String message) {
        super(message);
    }

    public BrokerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
