package io.typedhttp.client.codec;

import java.io.IOException;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Serializes the whole input as a document with the given mapper (JSON or XML).
 */
class MapperInputEncoder implements InputEncoder {

    private final String contentType;

    MapperInputEncoder(String contentType) {
        this.contentType = contentType;
    }

    @Override
    public EncodedInput encode(Object input, ObjectMapper mapper) throws IOException {
        return EncodedInput.body(mapper.writeValueAsBytes(input), contentType);
    }
}
