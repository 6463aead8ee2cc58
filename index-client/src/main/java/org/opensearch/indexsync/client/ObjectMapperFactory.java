package org.opensearch.indexsync.client;

import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

public class ObjectMapperFactory {
    private static final int MAX_STRING_LENGTH = 100 * 1024 * 1024; // ~100 MB, attachments can be large

    /**
     * Returns a default ObjectMapper with fail-on-unknown-properties disabled.
     */
    public static ObjectMapper createDefaultMapper() {
        ObjectMapper mapper = JsonMapper.builder().build();
        mapper.getFactory()
            .setStreamReadConstraints(StreamReadConstraints.builder()
                .maxStringLength(MAX_STRING_LENGTH)
                .build());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    private ObjectMapperFactory() {
        // Prevent instantiation
    }
}
