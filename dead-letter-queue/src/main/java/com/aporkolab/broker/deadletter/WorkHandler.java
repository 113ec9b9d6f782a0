package com.aporkolab.broker.deadletter;

/**
 * Business logic run by the {@link RetryDeadLetterEngine}. Throwing counts as a failed attempt.
 *
 * @param <T> work item type
 */
@FunctionalInterface
public interface WorkHandler<T> {

    /**
     * @return result attached to the success event, may be null
     */
    Object process(T work, RetryContext context) throws Exception;
}
