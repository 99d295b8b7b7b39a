package io.typedhttp.client;

import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.typedhttp.client.codec.ObjectMappers;
import io.typedhttp.client.codec.ResponseDecoder;
import io.typedhttp.client.http.HttpResponse;
import io.typedhttp.spec.ConfigurationException;
import io.typedhttp.spec.ConnectivityException;
import io.typedhttp.spec.DecodingException;
import io.typedhttp.spec.Endpoint;
import io.typedhttp.spec.OutputFormat;
import io.typedhttp.spec.RequestException;
import io.typedhttp.spec.ServiceErrorException;
import io.typedhttp.spec.StatusCodeException;
import io.typedhttp.spec.ValidationException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the result of a transport call into the value of an invocation, or the first failure.
 * <ol>
 *   <li>no response: {@link ConnectivityException}</li>
 *   <li>raw response rejected by {@link WebService#validate}: {@link ValidationException}</li>
 *   <li>basic response (not for downloads): decoded, then passed to {@link WebService#validateBasicResponse}</li>
 *   <li>status outside 200-299: {@link ServiceErrorException} when the error response decodes,
 *       {@link StatusCodeException} otherwise</li>
 *   <li>output decoded with the endpoint's output format; downloads produce the body file</li>
 * </ol>
 */
public final class ResponseInterpreter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResponseInterpreter.class);

    static final int MAX_EXCERPT_LENGTH = 1024;

    private final WebService service;

    public ResponseInterpreter(WebService service) {
        this.service = service;
    }

    /**
     * Interprets the result of one transport call.
     *
     * @param endpoint the invoked endpoint
     * @param response the response, {@code null} if the transport failed
     * @param failure the transport failure, {@code null} if a response was received
     * @param download whether the body was streamed to {@link HttpResponse#bodyFile()}
     * @return the output value, the body file for downloads, or {@code null} for endpoints without output
     * @throws RequestException the first failure met
     */
    public @Nullable Object interpret(Endpoint<?, ?> endpoint, @Nullable HttpResponse response,
                                      @Nullable Throwable failure, boolean download) throws RequestException {
        String description = endpoint.describe();
        if (failure != null || response == null) {
            throw new ConnectivityException(description, unwrap(failure));
        }

        try {
            service.validate(response, endpoint);
        } catch (RequestException e) {
            throw e;
        } catch (Exception e) {
            throw new ValidationException(description, response.statusCode(), e);
        }

        ResponseDecoder decoder = new ResponseDecoder(decoderMapper(endpoint, description));

        Type basicResponseType = service.basicResponseType();
        if (basicResponseType != null && !download) {
            Object basicResponse = decoder.decode(response.body(), basicResponseType, description);
            try {
                service.validateBasicResponse(basicResponse, endpoint);
            } catch (RequestException e) {
                throw e;
            } catch (Exception e) {
                throw new ValidationException(description, response.statusCode(), e);
            }
        }

        if (!response.success()) {
            throw statusFailure(decoder, response, download, description);
        }

        if (!endpoint.hasOutput()) {
            return null;
        }
        if (download) {
            Path file = response.bodyFile();
            if (file == null) {
                throw new ConfigurationException(description, "Transport did not stream the body to a file");
            }
            return file;
        }
        Type outputType = endpoint.outputType();
        if (outputType == null) {
            return null;
        }
        return decoder.decode(response.body(), outputType, description);
    }

    private ObjectMapper decoderMapper(Endpoint<?, ?> endpoint, String description) throws RequestException {
        OutputFormat format = endpoint.outputFormat() == null ? OutputFormat.JSON : endpoint.outputFormat();
        ObjectMapper mapper = ObjectMappers.forOutput(format);
        try {
            service.configureDecoder(mapper);
        } catch (RequestException e) {
            throw e;
        } catch (Exception e) {
            throw new ConfigurationException(description, "Decoder hook failed: " + e.getMessage(), e);
        }
        return mapper;
    }

    private RequestException statusFailure(ResponseDecoder decoder, HttpResponse response, boolean download,
                                           String description) throws RequestException {
        byte[] body = errorBody(response, download, description);
        String excerpt = excerpt(body);
        Type errorResponseType = service.errorResponseType();
        if (errorResponseType != null) {
            try {
                Object errorResponse = decoder.decode(body, errorResponseType, description);
                return new ServiceErrorException(description, response.statusCode(), errorResponse, excerpt);
            } catch (DecodingException e) {
                LOGGER.debug("Error response of {} did not match {}: {}", description, errorResponseType, e.getMessage());
            }
        }
        return new StatusCodeException(description, response.statusCode(), excerpt);
    }

    private static byte[] errorBody(HttpResponse response, boolean download, String description)
            throws ConnectivityException {
        Path file = response.bodyFile();
        if (!download || file == null) {
            return response.body();
        }
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new ConnectivityException(description, e);
        }
    }

    static String excerpt(byte[] body) {
        String text = new String(body, StandardCharsets.UTF_8);
        return text.length() <= MAX_EXCERPT_LENGTH ? text : text.substring(0, MAX_EXCERPT_LENGTH);
    }

    private static Throwable unwrap(@Nullable Throwable failure) {
        Throwable cause = failure;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause == null ? new IOException("Transport completed without a response") : cause;
    }
}
