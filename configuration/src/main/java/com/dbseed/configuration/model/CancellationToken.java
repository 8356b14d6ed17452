package com.dbseed.configuration.model;

import com.dbseed.configuration.exception.OperationCancelledException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal shared between the party which triggered some long-running operation and the operation itself.
 * Operation must check the token between its blocking steps and may register callbacks to abort in-flight I/O.
 */
@Slf4j
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CountDownLatch cancelledLatch = new CountDownLatch(1);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    public static CancellationToken none() {
        return new CancellationToken();
    }

    /**
     * Requests cancellation. Callbacks are invoked once, on the calling thread.
     */
    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }

        cancelledLatch.countDown();
        for (Runnable callback : callbacks) {
            runCallback(callback);
        }
        callbacks.clear();
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }

    public void throwIfCancellationRequested() throws OperationCancelledException {
        if (cancelled.get()) {
            throw new OperationCancelledException("Operation was cancelled.");
        }
    }

    /**
     * Blocks for provided duration unless cancellation is requested earlier.
     *
     * @param duration how long to wait
     * @throws OperationCancelledException if cancellation was requested before or during the wait
     * @throws InterruptedException        if waiting thread was interrupted
     */
    public void sleep(Duration duration) throws InterruptedException {
        throwIfCancellationRequested();
        if (cancelledLatch.await(duration.toMillis(), TimeUnit.MILLISECONDS)) {
            throw new OperationCancelledException("Operation was cancelled while waiting.");
        }
    }

    /**
     * Registers callback which will be called when cancellation is requested. If already cancelled, callback is called immediately.
     *
     * @return handle which unregisters the callback when closed
     */
    public Registration register(Runnable callback) {
        callbacks.add(callback);
        if (cancelled.get() && callbacks.remove(callback)) {
            runCallback(callback);
        }
        return () -> callbacks.remove(callback);
    }

    private void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (Exception e) {
            log.warn("Cancellation callback failed.", e);
        }
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
