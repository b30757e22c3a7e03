package com.sentinelids.pipeline.processor;

import com.sentinelids.pipeline.stream.StreamMessage;

import java.time.Instant;

/**
 * One message handed to one worker. Owned by that worker until it completes
 * or fails; never shared.
 *
 * @author Naveed Gung
 */
public record WorkerTask(StreamMessage message, Instant startedAt) {
}
