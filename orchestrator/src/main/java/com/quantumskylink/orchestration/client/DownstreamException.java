package com.quantumskylink.orchestration.client;

import com.quantumskylink.orchestration.model.FailureKind;

/**
 * Thrown when a collaborator call fails at the transport level or answers
 * with a non-2xx status.
 */
public class DownstreamException extends RuntimeException {

    /** Marker for failures that never produced an HTTP status. */
    public static final int NO_STATUS = -1;

    private final String  service;
    private final int     statusCode;
    private final boolean cancelled;

    public DownstreamException(String service, String message, int statusCode) {
        super(message);
        this.service    = service;
        this.statusCode = statusCode;
        this.cancelled  = false;
    }

    public DownstreamException(String service, String message, Throwable cause) {
        this(service, message, cause, false);
    }

    private DownstreamException(String service, String message, Throwable cause, boolean cancelled) {
        super(message, cause);
        this.service    = service;
        this.statusCode = NO_STATUS;
        this.cancelled  = cancelled;
    }

    public static DownstreamException cancelled(String service, String message, InterruptedException cause) {
        return new DownstreamException(service, message, cause, true);
    }

    public String  getService()    { return service; }
    public int     getStatusCode() { return statusCode; }
    public boolean isCancelled()   { return cancelled; }

    /** 4xx answers are rejections of this request; 429 and everything else may pass on retry. */
    public boolean isRetryable() {
        if (cancelled) return false;
        return !isClientError() || statusCode == 429;
    }

    public FailureKind failureKind() {
        if (cancelled) return FailureKind.CANCELLED;
        return isClientError() && statusCode != 429 ? FailureKind.BUSINESS : FailureKind.INFRASTRUCTURE;
    }

    private boolean isClientError() {
        return statusCode >= 400 && statusCode < 500;
    }
}
