package com.kendb3.api.exception;

/**
 * Client-supplied data could not be applied to a model instance, e.g. a
 * malformed identifier list or a value of the wrong type.
 */
public class ApiDataException extends ApiException {

    private static final long serialVersionUID = 1L;

    public ApiDataException(String message) {
        super(message);
    }

    public ApiDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
