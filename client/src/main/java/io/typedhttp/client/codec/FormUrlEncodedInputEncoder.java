package io.typedhttp.client.codec;

import java.nio.charset.StandardCharsets;

import com.fasterxml.jackson.databind.ObjectMapper;

class FormUrlEncodedInputEncoder implements InputEncoder {

    static final String CONTENT_TYPE = "application/x-www-form-urlencoded; charset=UTF-8";

    @Override
    public EncodedInput encode(Object input, ObjectMapper mapper) {
        String form = QueryInputEncoder.urlEncode(FormFields.flatten(input, mapper));
        return EncodedInput.body(form.getBytes(StandardCharsets.UTF_8), CONTENT_TYPE);
    }
}
