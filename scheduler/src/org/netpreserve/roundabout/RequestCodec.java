package org.netpreserve.roundabout;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.netpreserve.roundabout.queue.Codec;

import java.io.IOException;

/**
 * Stores requests as JSON. Requests whose metadata can't be represented in JSON fail to encode with a
 * {@link com.fasterxml.jackson.core.JsonProcessingException}.
 */
public class RequestCodec implements Codec<Request> {
    private final ObjectMapper mapper;

    public RequestCodec() {
        this(new ObjectMapper());
    }

    public RequestCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public byte[] encode(Request request) throws IOException {
        return mapper.writeValueAsBytes(request);
    }

    @Override
    public Request decode(byte[] data) throws IOException {
        return mapper.readValue(data, Request.class);
    }
}
