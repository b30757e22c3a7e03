package com.sentinelids.pipeline.stream;

import java.util.Map;

/**
 * One entry read from a stream.
 *
 * @param id     broker-assigned entry id ({@code <millis>-<sequence>}), never reused
 * @param stream name of the stream the entry was read from
 * @param fields raw wire fields; decode values with {@link FieldCodec#decode(String)}
 *
 * @author Naveed Gung
 */
public record StreamMessage(String id, String stream, Map<String, String> fields) {

    public StreamMessage {
        fields = Map.copyOf(fields);
    }
}
