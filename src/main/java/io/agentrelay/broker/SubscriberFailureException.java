package io.agentrelay.broker;

public final class SubscriberFailureException extends RuntimeException {
    private final String topic;
    private final long subscriptionId;

    public SubscriberFailureException(String topic, long subscriptionId, Throwable cause) {
        super("Subscriber " + subscriptionId + " failed on topic " + topic + ": " + cause.getMessage(), cause);
        this.topic = topic;
        this.subscriptionId = subscriptionId;
    }

    public String topic() {
        return topic;
    }

    public long subscriptionId() {
        return subscriptionId;
    }
}
