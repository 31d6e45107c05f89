package com.apimock.exception;

/**
 * A runtime exception for failures while loading, converting or storing API descriptions
 * and mock environments.
 * <p>
 * It is thrown by the loading and translation layers and caught at the public import and
 * export entry points, where it is turned into a user notification and a log entry.
 */
public class ApiMockException extends RuntimeException {

    /**
     * @param message a description of what could not be done
     */
    public ApiMockException(String message) {
        super(message);
    }

    /**
     * @param message a description of what could not be done
     * @param cause   the underlying failure, for example a parser or I/O error
     */
    public ApiMockException(String message, Throwable cause) {
        super(message, cause);
    }
}
