package io.typedhttp.client;

import java.util.concurrent.Executor;

import io.typedhttp.client.http.TransferListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts transport byte counts into fractions and hands them to a {@link ProgressListener} on
 * the invocation's serial executor. Once {@link #close()} has run on that executor, pending and
 * later updates are dropped.
 */
final class ProgressReporter implements TransferListener {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProgressReporter.class);

    private final ProgressListener listener;
    private final Executor executor;
    private volatile boolean closed;

    ProgressReporter(ProgressListener listener, Executor executor) {
        this.listener = listener;
        this.executor = executor;
    }

    @Override
    public void onTransfer(long bytesTransferred, long totalBytes) {
        if (closed) {
            return;
        }
        double fraction = fraction(bytesTransferred, totalBytes);
        executor.execute(() -> {
            if (closed) {
                return;
            }
            try {
                listener.onProgress(fraction);
            } catch (RuntimeException e) {
                LOGGER.warn("Progress listener failed", e);
            }
        });
    }

    /**
     * Stops delivery. Must run on the serial executor, as part of the completion task.
     */
    void close() {
        closed = true;
    }

    static double fraction(long bytesTransferred, long totalBytes) {
        if (totalBytes <= 0) {
            return totalBytes == 0 ? 1.0 : ProgressListener.INDETERMINATE;
        }
        return Math.max(0.0, Math.min(1.0, (double) bytesTransferred / totalBytes));
    }
}
