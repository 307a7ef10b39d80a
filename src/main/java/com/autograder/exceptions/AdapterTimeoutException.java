package com.autograder.exceptions;

import java.time.Duration;

/**
 * An external adapter call did not answer within the configured timeout
 */
public class AdapterTimeoutException extends AutograderException {

    public AdapterTimeoutException(String operation, Duration timeout) {
        super(operation + " timed out after " + timeout.toMillis() + " ms");
    }
}
