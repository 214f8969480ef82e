package io.agentrelay.broker;

/**
 * Thrown to a publisher when the delivery queue is full. The message was not enqueued; the
 * publisher decides whether to retry, drop or escalate.
 */
public final class BrokerSaturatedException extends IllegalStateException {
    private final String topic;
    private final int capacity;

    public BrokerSaturatedException(String topic, int capacity) {
        super("Message broker queue is full (capacity=" + capacity + "), publish rejected for topic: " + topic);
        this.topic = topic;
        this.capacity = capacity;
    }

    public String topic() {
        return topic;
    }

    public int capacity() {
        return capacity;
    }
}
