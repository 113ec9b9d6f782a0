package com.aporkolab.broker.exception;

/**
 * Resubmission was requested for a work item that is not in the failure store.
 */
public class FailedWorkNotFoundException extends BrokerException {

    public static final String CODE = "FAILED_WORK_NOT_FOUND";

    public FailedWorkNotFoundException(String workId) {
        super(CODE, String.format("Failed work item '%s' not found", workId));
        with("workId", workId);
    }
}
