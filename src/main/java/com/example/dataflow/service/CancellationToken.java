package com.example.dataflow.service;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot cancellation signal shared between the controller and a single refresh task.
 * Cancelling is idempotent and safe from any thread.
 */
public final class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Waits up to the given time for cancellation.
     *
     * @return true if cancelled, false if the wait timed out.
     */
    public boolean awaitCancellation(long timeout, TimeUnit unit) throws InterruptedException {
        return cancelled.await(timeout, unit);
    }
}
