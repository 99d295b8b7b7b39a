package io.typedhttp.client;

import static io.typedhttp.util.Assert.checkNotNullParam;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import io.typedhttp.client.http.HttpClient;
import io.typedhttp.client.http.HttpRequest;
import io.typedhttp.client.http.HttpResponse;
import io.typedhttp.spec.ConfigurationException;
import io.typedhttp.spec.EmptyEndpoint;
import io.typedhttp.spec.Endpoint;
import io.typedhttp.spec.InEndpoint;
import io.typedhttp.spec.InOutEndpoint;
import io.typedhttp.spec.OutEndpoint;
import io.typedhttp.spec.Outcome;
import io.typedhttp.spec.RequestException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes endpoints of one {@link WebService}.
 * <p>
 * Every invocation builds a request, sends it through the transport and interprets the response.
 * The asynchronous {@code makeRequest} methods return immediately and deliver exactly one
 * {@link Outcome}: on the given callback executor, or on the transport's thread when none is given.
 * The synchronous variants block the calling thread until that outcome exists.
 * <p>
 * Instances are thread-safe and hold no per-invocation state.
 */
public class EndpointClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(EndpointClient.class);

    private static final String DOWNLOAD_PREFIX = "typed-http-";
    private static final String DOWNLOAD_SUFFIX = ".download";

    private final WebService service;
    private final HttpClient httpClient;
    private final EndpointRequestFactory requestFactory = new EndpointRequestFactory();
    private final ResponseInterpreter interpreter;

    EndpointClient(WebService service, HttpClient httpClient) {
        this.service = checkNotNullParam("service", service);
        this.httpClient = checkNotNullParam("httpClient", httpClient);
        this.interpreter = new ResponseInterpreter(service);
    }

    public static EndpointClientBuilder builder(WebService service) {
        return new EndpointClientBuilder(service);
    }

    public WebService getService() {
        return service;
    }

    // Asynchronous

    public void makeRequest(EmptyEndpoint endpoint, Consumer<Outcome<Void>> onComplete) {
        makeRequest(endpoint, null, null, onComplete);
    }

    public void makeRequest(EmptyEndpoint endpoint, @Nullable Executor callbackExecutor,
                            @Nullable ProgressListener progress, Consumer<Outcome<Void>> onComplete) {
        invoke(endpoint, null, false, callbackExecutor, progress, onComplete);
    }

    public <I> void makeRequest(InEndpoint<I> endpoint, I input, Consumer<Outcome<Void>> onComplete) {
        makeRequest(endpoint, input, null, null, onComplete);
    }

    public <I> void makeRequest(InEndpoint<I> endpoint, I input, @Nullable Executor callbackExecutor,
                                @Nullable ProgressListener progress, Consumer<Outcome<Void>> onComplete) {
        checkNotNullParam("input", input);
        invoke(endpoint, input, false, callbackExecutor, progress, onComplete);
    }

    public <O> void makeRequest(OutEndpoint<O> endpoint, Consumer<Outcome<O>> onComplete) {
        makeRequest(endpoint, null, null, onComplete);
    }

    public <O> void makeRequest(OutEndpoint<O> endpoint, @Nullable Executor callbackExecutor,
                                @Nullable ProgressListener progress, Consumer<Outcome<O>> onComplete) {
        invoke(endpoint, null, false, callbackExecutor, progress, onComplete);
    }

    public <I, O> void makeRequest(InOutEndpoint<I, O> endpoint, I input, Consumer<Outcome<O>> onComplete) {
        makeRequest(endpoint, input, null, null, onComplete);
    }

    public <I, O> void makeRequest(InOutEndpoint<I, O> endpoint, I input, @Nullable Executor callbackExecutor,
                                   @Nullable ProgressListener progress, Consumer<Outcome<O>> onComplete) {
        checkNotNullParam("input", input);
        invoke(endpoint, input, false, callbackExecutor, progress, onComplete);
    }

    /**
     * Invokes any endpoint and exposes the outcome as a future. The future completes with the
     * output value ({@code null} for endpoints without output) or exceptionally with a
     * {@link RequestException}.
     *
     * @param endpoint the endpoint
     * @param input the input, required exactly when the endpoint declares one
     * @param progress optional progress listener, called on the transport's thread
     * @param <I> the input type
     * @param <O> the output type
     * @return the future outcome
     */
    public <I, O> CompletableFuture<O> execute(Endpoint<I, O> endpoint, @Nullable I input,
                                               @Nullable ProgressListener progress) {
        checkNotNullParam("endpoint", endpoint);
        if (endpoint.hasInput()) {
            checkNotNullParam("input", input);
        }
        CompletableFuture<O> future = new CompletableFuture<>();
        this.<O>invoke(endpoint, input, false, null, progress, outcome -> {
            if (outcome.isSuccess()) {
                future.complete(outcome.value());
            } else {
                future.completeExceptionally(outcome.error());
            }
        });
        return future;
    }

    // Synchronous

    public void makeSynchronousRequest(EmptyEndpoint endpoint) throws RequestException {
        this.<Void>await(endpoint, null);
    }

    public <I> void makeSynchronousRequest(InEndpoint<I> endpoint, I input) throws RequestException {
        checkNotNullParam("input", input);
        this.<Void>await(endpoint, input);
    }

    public <O> O makeSynchronousRequest(OutEndpoint<O> endpoint) throws RequestException {
        return await(endpoint, null);
    }

    public <I, O> O makeSynchronousRequest(InOutEndpoint<I, O> endpoint, I input) throws RequestException {
        checkNotNullParam("input", input);
        return await(endpoint, input);
    }

    // Downloads

    /**
     * Streams the response body to a temporary file instead of decoding it. The outcome carries
     * the file's path; the file exists only until {@code onComplete} returns, so callers that
     * keep the content must move or copy it inside the callback.
     *
     * @param endpoint the endpoint
     * @param onComplete receives the path of the downloaded file, or the failure
     */
    public void makeDownloadRequest(OutEndpoint<?> endpoint, Consumer<Outcome<Path>> onComplete) {
        makeDownloadRequest(endpoint, null, null, onComplete);
    }

    public void makeDownloadRequest(OutEndpoint<?> endpoint, @Nullable Executor callbackExecutor,
                                    @Nullable ProgressListener progress, Consumer<Outcome<Path>> onComplete) {
        invoke(endpoint, null, true, callbackExecutor, progress, onComplete);
    }

    public <I> void makeDownloadRequest(InOutEndpoint<I, ?> endpoint, I input, Consumer<Outcome<Path>> onComplete) {
        makeDownloadRequest(endpoint, input, null, null, onComplete);
    }

    public <I> void makeDownloadRequest(InOutEndpoint<I, ?> endpoint, I input, @Nullable Executor callbackExecutor,
                                        @Nullable ProgressListener progress, Consumer<Outcome<Path>> onComplete) {
        checkNotNullParam("input", input);
        invoke(endpoint, input, true, callbackExecutor, progress, onComplete);
    }

    /**
     * Downloads the response body and moves it to {@code destination}, replacing any existing file.
     *
     * @param endpoint the endpoint
     * @param destination where the body is kept
     * @return {@code destination}
     * @throws RequestException if the invocation fails or the file cannot be moved
     */
    public Path makeSynchronousDownloadRequest(OutEndpoint<?> endpoint, Path destination) throws RequestException {
        return awaitDownload(endpoint, null, destination);
    }

    public <I> Path makeSynchronousDownloadRequest(InOutEndpoint<I, ?> endpoint, I input, Path destination)
            throws RequestException {
        checkNotNullParam("input", input);
        return awaitDownload(endpoint, input, destination);
    }

    private <T> T await(Endpoint<?, ?> endpoint, @Nullable Object input) throws RequestException {
        ResultHandoff<T> handoff = new ResultHandoff<>(endpoint.describe());
        invoke(endpoint, input, false, null, null, handoff);
        return handoff.await();
    }

    private Path awaitDownload(Endpoint<?, ?> endpoint, @Nullable Object input, Path destination)
            throws RequestException {
        checkNotNullParam("destination", destination);
        String description = endpoint.describe();
        ResultHandoff<Path> handoff = new ResultHandoff<>(description);
        this.<Path>invoke(endpoint, input, true, null, null, outcome -> {
            if (!outcome.isSuccess()) {
                handoff.accept(outcome);
                return;
            }
            try {
                Files.move(outcome.value(), destination, StandardCopyOption.REPLACE_EXISTING);
                handoff.accept(Outcome.success(destination));
            } catch (IOException e) {
                handoff.accept(Outcome.failure(new ConfigurationException(description,
                        "Could not move download to " + destination, e)));
            }
        });
        return handoff.await();
    }

    private <T> void invoke(Endpoint<?, ?> endpoint, @Nullable Object input, boolean download,
                            @Nullable Executor callbackExecutor, @Nullable ProgressListener progress,
                            Consumer<Outcome<T>> onComplete) {
        checkNotNullParam("endpoint", endpoint);
        checkNotNullParam("onComplete", onComplete);

        Invocation<T> invocation = new Invocation<>(endpoint, download,
                new SerialExecutor(callbackExecutor == null ? Runnable::run : callbackExecutor),
                progress, onComplete);
        invocation.start(input);
    }

    /**
     * State of one call: the serial executor, the temporary download file and the
     * exactly-once completion.
     */
    private final class Invocation<T> {

        private final Endpoint<?, ?> endpoint;
        private final boolean download;
        private final SerialExecutor executor;
        private final @Nullable ProgressReporter reporter;
        private final Consumer<Outcome<T>> onComplete;
        private final AtomicBoolean completed = new AtomicBoolean();
        private @Nullable Path downloadFile;

        Invocation(Endpoint<?, ?> endpoint, boolean download, SerialExecutor executor,
                   @Nullable ProgressListener progress, Consumer<Outcome<T>> onComplete) {
            this.endpoint = endpoint;
            this.download = download;
            this.executor = executor;
            this.reporter = progress == null ? null : new ProgressReporter(progress, executor);
            this.onComplete = onComplete;
        }

        void start(@Nullable Object input) {
            HttpRequest request;
            try {
                request = requestFactory.create(service, endpoint, input);
                if (download) {
                    downloadFile = createDownloadFile();
                }
            } catch (RequestException e) {
                complete(Outcome.failure(e));
                return;
            } catch (RuntimeException e) {
                complete(Outcome.failure(new ConfigurationException(endpoint.describe(),
                        "Unexpected failure building the request", e)));
                return;
            }

            LOGGER.debug("Sending {} {}", request.method(), request.uri());
            CompletableFuture<HttpResponse> response;
            try {
                response = downloadFile != null
                        ? httpClient.download(request, downloadFile, reporter)
                        : httpClient.send(request, reporter);
            } catch (RuntimeException e) {
                response = CompletableFuture.failedFuture(e);
            }
            response.whenComplete(this::onResponse);
        }

        private Path createDownloadFile() throws ConfigurationException {
            try {
                return Files.createTempFile(DOWNLOAD_PREFIX, DOWNLOAD_SUFFIX);
            } catch (IOException e) {
                throw new ConfigurationException(endpoint.describe(), "Could not create download file", e);
            }
        }

        @SuppressWarnings("unchecked")
        private void onResponse(@Nullable HttpResponse response, @Nullable Throwable failure) {
            Outcome<T> outcome;
            try {
                outcome = Outcome.success((T) interpreter.interpret(endpoint, response, failure, download));
            } catch (RequestException e) {
                outcome = Outcome.failure(e);
            } catch (RuntimeException e) {
                outcome = Outcome.failure(new ConfigurationException(endpoint.describe(),
                        "Unexpected failure interpreting the response", e));
            }
            complete(outcome);
        }

        private void complete(Outcome<T> outcome) {
            if (!completed.compareAndSet(false, true)) {
                LOGGER.warn("Ignoring second outcome for {}", endpoint.describe());
                return;
            }
            if (outcome.isSuccess()) {
                LOGGER.debug("{} succeeded", endpoint.describe());
            } else {
                LOGGER.debug("{} failed: {}", endpoint.describe(), outcome.error().getMessage());
            }
            executor.execute(() -> {
                if (reporter != null) {
                    reporter.close();
                }
                try {
                    onComplete.accept(outcome);
                } catch (RuntimeException e) {
                    LOGGER.warn("Completion callback for {} failed", endpoint.describe(), e);
                } finally {
                    deleteDownloadFile();
                }
            });
        }

        private void deleteDownloadFile() {
            Path file = downloadFile;
            if (file == null) {
                return;
            }
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                LOGGER.warn("Could not delete download file {}", file, e);
            }
        }
    }
}
