package io.typedhttp.client;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.Executor;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs tasks one at a time, in submission order, on a delegate executor. One instance serves one
 * invocation, so its progress and completion callbacks stay ordered even on a thread pool.
 */
final class SerialExecutor implements Executor {

    private static final Logger LOGGER = LoggerFactory.getLogger(SerialExecutor.class);

    private final Queue<Runnable> tasks = new ArrayDeque<>();
    private final Executor delegate;
    private @Nullable Runnable active;

    SerialExecutor(Executor delegate) {
        this.delegate = delegate;
    }

    @Override
    public synchronized void execute(Runnable task) {
        tasks.add(() -> {
            try {
                task.run();
            } finally {
                scheduleNext();
            }
        });
        if (active == null) {
            scheduleNext();
        }
    }

    private synchronized void scheduleNext() {
        active = tasks.poll();
        if (active != null) {
            Runnable next = active;
            try {
                delegate.execute(next);
            } catch (RuntimeException e) {
                LOGGER.warn("Callback executor rejected a task, running it on the calling thread", e);
                next.run();
            }
        }
    }
}
