package com.aporkolab.broker.client;

/**
 * Decides whether a rejected delivery goes back to its queue.
 */
public enum RedeliveryPolicy {

    /**
     * Two strikes: the first failure requeues, a failure of a redelivered message does not.
     */
    REQUEUE_ONCE {
        @Override
        public boolean shouldRequeue(boolean redelivered) {
            return !redelivered;
        }
    },

    /**
     * Every failure is rejected without requeue, so the queue's dead-letter target receives it.
     */
    NEVER_REQUEUE {
        @Override
        public boolean shouldRequeue(boolean redelivered) {
            return false;
        }
    };

    public abstract boolean shouldRequeue(boolean redelivered);
}
