package com.aporkolab.broker.deadletter;

/**
 * Categorizes why a work item ended up in the failure store.
 */
public enum FailureType {

    /** Payload could not be converted to the work type */
    DESERIALIZATION_ERROR,

    /** Handler kept failing until the attempt limit was reached */
    MAX_RETRIES_EXCEEDED,

    /** Found in the dead-letter queue without an engine record, e.g. rejected by another consumer */
    DEAD_LETTERED,

    UNKNOWN
}
