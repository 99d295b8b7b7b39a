package io.typedhttp.client.codec;

import java.io.IOException;
import java.lang.reflect.Type;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.typedhttp.spec.DecodingException;
import org.jspecify.annotations.Nullable;

/**
 * Decodes response bodies into declared types, reporting where in the document decoding failed.
 */
public final class ResponseDecoder {

    private final ObjectMapper mapper;

    public ResponseDecoder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Decodes {@code body} into {@code type}.
     *
     * @param body the response body
     * @param type the target type
     * @param endpoint the endpoint description used in the failure
     * @return the decoded value
     * @throws DecodingException if the body does not match the type
     */
    public Object decode(byte[] body, Type type, @Nullable String endpoint) throws DecodingException {
        try {
            Object value = mapper.readValue(body, mapper.constructType(type));
            if (value == null) {
                throw JsonMappingException.from(mapper.getDeserializationContext(), "Body decoded to null");
            }
            return value;
        } catch (IOException e) {
            throw new DecodingException(endpoint, location(e), e);
        }
    }

    static String location(IOException e) {
        if (e instanceof JsonMappingException mapping && !mapping.getPath().isEmpty()) {
            return mapping.getPathReference();
        }
        if (e instanceof JsonProcessingException processing) {
            JsonLocation location = processing.getLocation();
            if (location != null && location.getLineNr() > 0) {
                return "line " + location.getLineNr() + ", column " + location.getColumnNr();
            }
        }
        return "$";
    }
}
