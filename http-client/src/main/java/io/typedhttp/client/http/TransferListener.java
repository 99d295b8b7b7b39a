package io.typedhttp.client.http;

/**
 * Receives byte-level progress of a response body as it arrives.
 */
@FunctionalInterface
public interface TransferListener {

    /** Value of {@code totalBytes} when the response does not announce its length. */
    long UNKNOWN_LENGTH = -1L;

    /**
     * Called each time a chunk of the response body has been received.
     *
     * @param bytesTransferred the number of body bytes received so far
     * @param totalBytes the announced body length, or {@link #UNKNOWN_LENGTH}
     */
    void onTransfer(long bytesTransferred, long totalBytes);
}
