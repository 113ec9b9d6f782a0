package com.aporkolab.broker.deadletter;

import com.aporkolab.broker.client.InboundDelivery;

/**
 * What a {@link WorkHandler} knows about the attempt it is running.
 *
 * @param attempt zero-based; equals the number of earlier failed attempts
 */
public record RetryContext(String workId, int attempt, int maxAttempts, InboundDelivery delivery) {

    public boolean isLastAttempt() {
        return attempt >= maxAttempts;
    }
}
