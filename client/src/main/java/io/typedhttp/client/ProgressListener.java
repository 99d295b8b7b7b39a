package io.typedhttp.client;

/**
 * Receives the progress of the response body of one invocation.
 * <p>
 * Calls for one invocation never overlap, arrive in order and all happen before the completion
 * callback of that invocation.
 */
@FunctionalInterface
public interface ProgressListener {

    /** Reported when the total size of the body is unknown. */
    double INDETERMINATE = -1.0;

    /**
     * @param fraction the received share of the body in {@code [0.0, 1.0]}, or {@link #INDETERMINATE}
     */
    void onProgress(double fraction);
}
