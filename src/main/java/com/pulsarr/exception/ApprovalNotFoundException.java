package com.pulsarr.exception;

/**
 * Exception thrown when an approval action targets a request id that does not exist.
 */
public class ApprovalNotFoundException extends RouterException {

    private final long requestId;

    public ApprovalNotFoundException(long requestId) {
        super("Approval request not found: " + requestId);
        this.requestId = requestId;
    }

    public long getRequestId() {
        return requestId;
    }
}
