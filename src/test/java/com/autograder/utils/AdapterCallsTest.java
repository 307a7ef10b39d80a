package com.autograder.utils;

import com.autograder.exceptions.AdapterTimeoutException;
import com.autograder.exceptions.GradingAdapterException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class AdapterCallsTest {

    private final ExecutorService executor = Executors.newCachedThreadPool();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void testReturnsValue() {
        String value = AdapterCalls.callWithTimeout("echo", () -> "done", Duration.ofSeconds(1), executor);

        assertEquals("done", value);
    }

    @Test
    void testTimeout() {
        AdapterTimeoutException e = assertThrows(AdapterTimeoutException.class,
                () -> AdapterCalls.callWithTimeout("slow call", () -> {
                    try {
                        Thread.sleep(2000);
                    } catch (InterruptedException ignored) {
                        Thread.currentThread().interrupt();
                    }
                    return "late";
                }, Duration.ofMillis(50), executor));

        assertTrue(e.getMessage().contains("slow call"));
    }

    @Test
    void testTimedOutCallIsInterrupted() throws InterruptedException {
        CountDownLatch interrupted = new CountDownLatch(1);

        assertThrows(AdapterTimeoutException.class,
                () -> AdapterCalls.callWithTimeout("hung extraction", () -> {
                    try {
                        Thread.sleep(10_000);
                    } catch (InterruptedException e) {
                        interrupted.countDown();
                    }
                    return "late";
                }, Duration.ofMillis(50), executor));

        assertTrue(interrupted.await(2, TimeUnit.SECONDS));
    }

    @Test
    void testTimeoutsDoNotPinThreadsOfABoundedPool() {
        ExecutorService single = Executors.newSingleThreadExecutor();
        try {
            for (int i = 0; i < 3; i++) {
                assertThrows(AdapterTimeoutException.class,
                        () -> AdapterCalls.callWithTimeout("hung grading", () -> {
                            try {
                                Thread.sleep(10_000);
                            } catch (InterruptedException e) {
                                Thread.currentThread().interrupt();
                            }
                            return 0;
                        }, Duration.ofMillis(50), single));
            }

            assertEquals("done", AdapterCalls.callWithTimeout("echo", () -> "done", Duration.ofSeconds(2), single));
        } finally {
            single.shutdownNow();
        }
    }

    @Test
    void testUncheckedExceptionsAreRethrownUnchanged() {
        GradingAdapterException e = assertThrows(GradingAdapterException.class,
                () -> AdapterCalls.callWithTimeout("grading", () -> {
                    throw new GradingAdapterException("model unavailable");
                }, Duration.ofSeconds(1), executor));

        assertEquals("model unavailable", e.getMessage());
    }
}
