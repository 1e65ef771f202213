package com.contact.resolution.sync;

/**
 * Thrown when the upstream source fails to deliver a page.
 */
public class ContactSourceException extends RuntimeException {

    private final long offset;
    private final Integer statusCode;

    public ContactSourceException(String message, long offset) {
        this(message, offset, null, null);
    }

    public ContactSourceException(String message, long offset, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.offset = offset;
        this.statusCode = statusCode;
    }

    public long getOffset() {
        return offset;
    }

    /**
     * HTTP-like status reported by the source, or null when there was no response.
     */
    public Integer getStatusCode() {
        return statusCode;
    }
}
