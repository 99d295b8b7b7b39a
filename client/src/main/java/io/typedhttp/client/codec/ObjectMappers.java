package io.typedhttp.client.codec;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.typedhttp.spec.InputFormat;
import io.typedhttp.spec.OutputFormat;

/**
 * Pre-configured Jackson mappers.
 * <p>
 * Both mappers write dates as ISO-8601 strings and leave {@code null} properties out. When reading
 * they ignore unknown properties, but every creator property (each component of a record) must be
 * present and non-null, so a body of some other shape fails to decode. The shared instances are never handed out: every accessor
 * returns a copy that a service hook may reconfigure for a single request.
 */
public final class ObjectMappers {

    private static final JsonMapper JSON = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_CREATOR_PROPERTIES)
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .build();

    private static final XmlMapper XML = XmlMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_CREATOR_PROPERTIES)
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .build();

    private ObjectMappers() {
    }

    public static ObjectMapper json() {
        return JSON.copy();
    }

    public static ObjectMapper xml() {
        return XML.copy();
    }

    /**
     * Returns a fresh mapper for encoding input in the given format. Form and query formats are
     * flattened from the JSON tree, so they use the JSON mapper.
     *
     * @param format the input format
     * @return a mapper copy owned by the caller
     */
    public static ObjectMapper forInput(InputFormat format) {
        return format == InputFormat.XML ? xml() : json();
    }

    public static ObjectMapper forOutput(OutputFormat format) {
        return format == OutputFormat.XML ? xml() : json();
    }
}
