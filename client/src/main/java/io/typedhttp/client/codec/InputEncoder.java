package io.typedhttp.client.codec;

import java.io.IOException;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.typedhttp.spec.InputFormat;

/**
 * Turns an endpoint input into its wire form.
 * <p>
 * Encoders are stateless; the only source of variation between two encodings of the same input
 * is the multipart boundary.
 */
public interface InputEncoder {

    /**
     * Encodes the input.
     *
     * @param input the endpoint input
     * @param mapper the per-request mapper, already adjusted by the service
     * @return the encoded input
     * @throws IOException if the input cannot be serialized
     * @throws IllegalArgumentException if the input has a shape the format cannot express
     */
    EncodedInput encode(Object input, ObjectMapper mapper) throws IOException;

    static InputEncoder forFormat(InputFormat format) {
        return switch (format) {
            case JSON -> new MapperInputEncoder("application/json");
            case XML -> new MapperInputEncoder("application/xml");
            case URL_QUERY -> new QueryInputEncoder();
            case FORM_URL_ENCODED -> new FormUrlEncodedInputEncoder();
            case FORM_DATA -> new MultipartInputEncoder();
        };
    }
}
