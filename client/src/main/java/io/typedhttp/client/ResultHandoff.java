package io.typedhttp.client;

import java.util.concurrent.CountDownLatch;
import java.util.function.Consumer;

import io.typedhttp.spec.ConnectivityException;
import io.typedhttp.spec.Outcome;
import io.typedhttp.spec.RequestException;
import org.jspecify.annotations.Nullable;

/**
 * Single-use slot that carries the outcome of an asynchronous invocation to a blocked caller.
 *
 * @param <T> the value type
 */
final class ResultHandoff<T> implements Consumer<Outcome<T>> {

    private final CountDownLatch done = new CountDownLatch(1);
    private final String endpoint;
    private volatile @Nullable Outcome<T> outcome;

    ResultHandoff(String endpoint) {
        this.endpoint = endpoint;
    }

    @Override
    public void accept(Outcome<T> outcome) {
        if (done.getCount() == 0) {
            throw new IllegalStateException("Outcome of " + endpoint + " already delivered");
        }
        this.outcome = outcome;
        done.countDown();
    }

    /**
     * Blocks until the outcome is delivered.
     *
     * @return the success value
     * @throws RequestException the failure of the invocation, or a {@link ConnectivityException}
     *                          if the waiting thread was interrupted
     */
    @Nullable T await() throws RequestException {
        try {
            done.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectivityException(endpoint, e);
        }
        Outcome<T> delivered = outcome;
        if (delivered == null) {
            throw new IllegalStateException("Outcome of " + endpoint + " missing");
        }
        return delivered.getOrThrow();
    }
}
