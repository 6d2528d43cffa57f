package com.quantumskylink.orchestration.pipeline;

/**
 * Thrown when an execution's input bag does not fit the workflow's request
 * shape. The run fails with {@code VALIDATION}.
 */
public class RequestBindingException extends RuntimeException {

    public RequestBindingException(String message) {
        super(message);
    }

    public RequestBindingException(String message, Throwable cause) {
        super(message, cause);
    }
}
