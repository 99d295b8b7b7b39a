package io.typedhttp.client.codec;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.StringJoiner;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Encodes the input as {@code application/x-www-form-urlencoded} pairs appended to the URL.
 */
class QueryInputEncoder implements InputEncoder {

    @Override
    public EncodedInput encode(Object input, ObjectMapper mapper) {
        return EncodedInput.query(urlEncode(FormFields.flatten(input, mapper)));
    }

    static String urlEncode(List<FormFields.Field> fields) {
        StringJoiner joiner = new StringJoiner("&");
        for (FormFields.Field field : fields) {
            String value = field.isBinary() ? Base64.getEncoder().encodeToString(field.binary()) : field.text();
            joiner.add(URLEncoder.encode(field.name(), StandardCharsets.UTF_8)
                    + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8));
        }
        return joiner.toString();
    }
}
