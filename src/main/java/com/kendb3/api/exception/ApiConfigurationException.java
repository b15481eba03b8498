package com.kendb3.api.exception;

/**
 * A programming mistake in field registration: wrong group type, ambiguous or
 * missing marker match, registration after assembly. Raised while models are
 * being declared and registered, never while serving requests.
 */
public class ApiConfigurationException extends ApiException {

    private static final long serialVersionUID = 1L;

    public ApiConfigurationException(String message) {
        super(message);
    }

    public ApiConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
