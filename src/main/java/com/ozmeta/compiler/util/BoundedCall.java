package com.ozmeta.compiler.util;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a collaborator call on a daemon thread and gives up after a timeout.
 * The call is interrupted when the timeout expires.
 */
public final class BoundedCall {

    private BoundedCall() {
        // Utility class
    }

    public static <T> T call(String description, Duration timeout, Callable<T> action)
            throws TimeoutException, ExecutionException, InterruptedException {
        ExecutorService executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "ozmeta-" + description);
            thread.setDaemon(true);
            return thread;
        });
        try {
            Future<T> future = executor.submit(action);
            try {
                return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                throw new TimeoutException(description + " did not finish within " + timeout);
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
