package io.agentrelay.broker;

public record BrokerStats(
        boolean running,
        int queueDepth,
        int queueCapacity,
        int topics,
        int subscriptions,
        long published,
        long delivered,
        long subscriberFailures,
        long saturatedRejections,
        long workerRestarts
) {
}
