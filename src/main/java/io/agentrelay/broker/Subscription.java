package io.agentrelay.broker;

import io.agentrelay.model.Message;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Handle for exactly one registration of a callback on a topic.
 */
public final class Subscription {
    private final long id;
    private final String topic;
    private final Consumer<Message> callback;
    private final AtomicBoolean active;
    private final ReentrantLock deliveryLock;

    Subscription(long id, String topic, Consumer<Message> callback) {
        this.id = id;
        this.topic = topic;
        this.callback = callback;
        this.active = new AtomicBoolean(true);
        this.deliveryLock = new ReentrantLock();
    }

    public long id() {
        return id;
    }

    public String topic() {
        return topic;
    }

    public boolean isActive() {
        return active.get();
    }

    Consumer<Message> callback() {
        return callback;
    }

    boolean deactivate() {
        return active.compareAndSet(true, false);
    }

    ReentrantLock deliveryLock() {
        return deliveryLock;
    }

    @Override
    public String toString() {
        return "Subscription{id=" + id + ", topic='" + topic + "', active=" + active.get() + "}";
    }
}
