package com.alphix.liquidity.client;

/**
 * A remote collaborator answered with an error or with data we could not interpret.
 */
public class CollaboratorException extends RuntimeException {

    private final int statusCode;

    public CollaboratorException(final String message) {
        this(message, 0, null);
    }

    public CollaboratorException(final String message, final Throwable cause) {
        this(message, 0, cause);
    }

    public CollaboratorException(final String message, final int statusCode, final Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }
}
