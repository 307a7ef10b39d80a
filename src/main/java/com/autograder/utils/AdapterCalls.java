package com.autograder.utils;

import com.autograder.exceptions.AdapterTimeoutException;
import com.autograder.exceptions.AutograderException;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs calls into external adapters with a bounded wait
 */
public final class AdapterCalls {

    private AdapterCalls() {}

    /**
     * Runs {@code call} on {@code executor} and waits at most {@code timeout} for it. A call that
     * does not finish in time is cancelled, which interrupts the thread running it.
     * Unchecked exceptions thrown by the call are rethrown unchanged.
     *
     * @throws AdapterTimeoutException when the call does not complete in time
     */
    public static <T> T callWithTimeout(String operation, Supplier<T> call, Duration timeout,
                                        ExecutorService executor) {
        Callable<T> task = call::get;
        Future<T> future = executor.submit(task);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new AdapterTimeoutException(operation, timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new AutograderException(operation + " failed: " + cause, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new AutograderException(operation + " was interrupted", e);
        }
    }
}
