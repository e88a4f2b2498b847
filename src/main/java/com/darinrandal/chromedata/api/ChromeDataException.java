package com.darinrandal.chromedata.api;

import org.eclipse.jdt.annotation.NonNullByDefault;
import org.eclipse.jdt.annotation.Nullable;

/**
 * Raised when a request to a ChromeData service cannot be completed.
 */
@NonNullByDefault
public class ChromeDataException extends Exception {

    private static final long serialVersionUID = 1L;

    private final int statusCode;

    public ChromeDataException(String message) {
        this(message, -1, null);
    }

    public ChromeDataException(String message, @Nullable Throwable cause) {
        this(message, -1, cause);
    }

    public ChromeDataException(String message, int statusCode, @Nullable Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status of the failed exchange, or {@code -1} when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
