package com.aporkolab.broker.client;

/**
 * Result of a queue declaration: current depth and consumer count.
 */
public record QueueInfo(String queue, int messageCount, int consumerCount) {
}
