package io.typedhttp.client.codec;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.UUID;
import java.util.function.Supplier;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Encodes the input as {@code multipart/form-data}. Fields holding {@code byte[]} become file
 * parts named after the field; every other field becomes a text part.
 */
class MultipartInputEncoder implements InputEncoder {

    private static final String CRLF = "\r\n";

    private final Supplier<String> boundaries;

    MultipartInputEncoder() {
        this(() -> "typedhttp-" + UUID.randomUUID().toString().replace("-", ""));
    }

    MultipartInputEncoder(Supplier<String> boundaries) {
        this.boundaries = boundaries;
    }

    @Override
    public EncodedInput encode(Object input, ObjectMapper mapper) {
        String boundary = boundaries.get();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (FormFields.Field field : FormFields.flatten(input, mapper)) {
            write(out, "--" + boundary + CRLF);
            if (field.isBinary()) {
                write(out, "Content-Disposition: form-data; name=\"" + escape(field.name())
                        + "\"; filename=\"" + escape(field.name()) + "\"" + CRLF);
                write(out, "Content-Type: application/octet-stream" + CRLF + CRLF);
                out.writeBytes(field.binary());
            } else {
                write(out, "Content-Disposition: form-data; name=\"" + escape(field.name()) + "\"" + CRLF + CRLF);
                write(out, field.text());
            }
            write(out, CRLF);
        }
        write(out, "--" + boundary + "--" + CRLF);
        return EncodedInput.body(out.toByteArray(), "multipart/form-data; boundary=" + boundary);
    }

    private static void write(ByteArrayOutputStream out, String text) {
        out.writeBytes(text.getBytes(StandardCharsets.UTF_8));
    }

    private static String escape(String name) {
        return name.replace("\"", "%22").replace("\r", "%0D").replace("\n", "%0A");
    }
}
