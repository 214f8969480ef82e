package io.agentrelay.broker;

import io.agentrelay.model.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

/**
 * In-process publish/subscribe hub.
 *
 * <p>One daemon worker drains a single bounded FIFO queue and invokes the subscribers of each
 * message's topic in registration order. Publishers never wait for subscribers: {@link #publish}
 * either enqueues immediately or fails with {@link BrokerSaturatedException}.
 *
 * <p>A callback exception is contained to that subscriber. An {@link Error} thrown by a callback ends
 * the worker: the remaining subscribers of that message are skipped, the fatal listener is told and a
 * fresh worker continues with the next queued message.
 */
public final class MessageBroker implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MessageBroker.class);
    private static final long POLL_INTERVAL_MS = 100L;

    private enum State {
        NEW,
        RUNNING,
        STOPPING,
        STOPPED
    }

    private final String name;
    private final int queueCapacity;
    private final long drainTimeoutMs;
    private final Consumer<Throwable> fatalListener;
    private final Object subscriptionLock;
    private final Map<String, CopyOnWriteArrayList<Subscription>> subscribers;
    private final ReentrantReadWriteLock lifecycle;
    private final AtomicLong subscriptionSeq;
    private final AtomicLong workerSeq;
    private final AtomicLong published;
    private final AtomicLong delivered;
    private final AtomicLong subscriberFailures;
    private final AtomicLong saturatedRejections;
    private final AtomicLong workerRestarts;
    private final BlockingQueue<Delivery> queue;
    private volatile State state;
    private volatile Thread worker;

    public MessageBroker(int queueCapacity) {
        this("agentrelay-broker", queueCapacity, 5_000L, null);
    }

    public MessageBroker(String name, int queueCapacity, long drainTimeoutMs, Consumer<Throwable> fatalListener) {
        this.name = name == null || name.isBlank() ? "agentrelay-broker" : name.trim();
        this.queueCapacity = Math.max(1, queueCapacity);
        this.drainTimeoutMs = Math.max(1L, drainTimeoutMs);
        this.fatalListener = fatalListener == null
                ? error -> log.error("{} worker crashed; restarting", this.name, error)
                : fatalListener;
        this.subscriptionLock = new Object();
        this.subscribers = new ConcurrentHashMap<>();
        this.lifecycle = new ReentrantReadWriteLock();
        this.subscriptionSeq = new AtomicLong(0L);
        this.workerSeq = new AtomicLong(0L);
        this.published = new AtomicLong(0L);
        this.delivered = new AtomicLong(0L);
        this.subscriberFailures = new AtomicLong(0L);
        this.saturatedRejections = new AtomicLong(0L);
        this.workerRestarts = new AtomicLong(0L);
        this.queue = new ArrayBlockingQueue<>(this.queueCapacity);
        this.state = State.NEW;
    }

    public Subscription subscribe(String topic, Consumer<Message> callback) {
        requireTopic(topic);
        Objects.requireNonNull(callback, "callback");
        Subscription subscription = new Subscription(subscriptionSeq.incrementAndGet(), topic, callback);
        synchronized (subscriptionLock) {
            subscribers.computeIfAbsent(topic, ignored -> new CopyOnWriteArrayList<>()).add(subscription);
        }
        log.info("Subscriber {} added for topic: {}", subscription.id(), topic);
        return subscription;
    }

    public void unsubscribe(Subscription subscription) {
        if (subscription == null) {
            return;
        }
        boolean removed;
        synchronized (subscriptionLock) {
            removed = subscription.deactivate();
            CopyOnWriteArrayList<Subscription> registrations = subscribers.get(subscription.topic());
            if (registrations != null) {
                registrations.remove(subscription);
                if (registrations.isEmpty()) {
                    subscribers.remove(subscription.topic());
                }
            }
        }
        // Wait out a delivery that already started; later ones see the handle inactive.
        ReentrantLock deliveryLock = subscription.deliveryLock();
        if (!deliveryLock.isHeldByCurrentThread()) {
            deliveryLock.lock();
            deliveryLock.unlock();
        }
        if (removed) {
            log.info("Subscriber {} removed for topic: {}", subscription.id(), subscription.topic());
        }
    }

    public void publish(String topic, Map<String, Object> data) {
        publish(topic, Message.of(topic, data));
    }

    public void publish(String topic, Message message) {
        requireTopic(topic);
        Objects.requireNonNull(message, "message");
        lifecycle.readLock().lock();
        try {
            State current = state;
            if (current == State.STOPPING || current == State.STOPPED) {
                throw new IllegalStateException("Message broker " + name + " is stopped, publish refused for topic: " + topic);
            }
            if (!queue.offer(new Delivery(topic, message))) {
                saturatedRejections.incrementAndGet();
                throw new BrokerSaturatedException(topic, queueCapacity);
            }
            published.incrementAndGet();
        } finally {
            lifecycle.readLock().unlock();
        }
        log.debug("Message published: {}", topic);
    }

    public void start() {
        lifecycle.writeLock().lock();
        try {
            if (state == State.RUNNING) {
                return;
            }
            if (state == State.STOPPING) {
                throw new IllegalStateException("Message broker " + name + " is still stopping");
            }
            state = State.RUNNING;
            // A worker that overran the last stop() is still draining; it keeps the queue.
            if (worker == null) {
                launchWorker();
            }
        } finally {
            lifecycle.writeLock().unlock();
        }
        log.info("Message broker {} started (capacity={})", name, queueCapacity);
    }

    public void stop() {
        lifecycle.writeLock().lock();
        try {
            if (state == State.NEW) {
                if (queue.isEmpty()) {
                    state = State.STOPPED;
                    return;
                }
                state = State.STOPPING;
                launchWorker();
            } else if (state == State.RUNNING) {
                state = State.STOPPING;
            } else {
                return;
            }
        } finally {
            lifecycle.writeLock().unlock();
        }

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(drainTimeoutMs);
        boolean interrupted = false;
        Thread current = worker;
        while (current != null && current.isAlive()) {
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMs <= 0L) {
                break;
            }
            try {
                current.join(remainingMs);
            } catch (InterruptedException e) {
                interrupted = true;
                break;
            }
            current = worker;
        }
        if (current != null && current.isAlive()) {
            log.warn("Message broker {} did not drain within {} ms, {} messages still queued",
                    name, drainTimeoutMs, queue.size());
        }

        lifecycle.writeLock().lock();
        try {
            state = State.STOPPED;
        } finally {
            lifecycle.writeLock().unlock();
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        log.info("Message broker {} stopped", name);
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return state == State.RUNNING;
    }

    public int subscriberCount(String topic) {
        List<Subscription> registrations = subscribers.get(topic);
        return registrations == null ? 0 : registrations.size();
    }

    public BrokerStats stats() {
        int subscriptions = 0;
        for (List<Subscription> registrations : subscribers.values()) {
            subscriptions += registrations.size();
        }
        return new BrokerStats(
                isRunning(),
                queue.size(),
                queueCapacity,
                subscribers.size(),
                subscriptions,
                published.get(),
                delivered.get(),
                subscriberFailures.get(),
                saturatedRejections.get(),
                workerRestarts.get()
        );
    }

    private void launchWorker() {
        Thread thread = new Thread(this::drain, name + "-worker-" + workerSeq.incrementAndGet());
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler((crashed, error) -> onWorkerCrash(error));
        worker = thread;
        thread.start();
    }

    private void drain() {
        while (true) {
            Delivery next;
            try {
                next = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                if (state == State.RUNNING) {
                    continue;
                }
                Thread.currentThread().interrupt();
                retireWorker(true);
                return;
            }
            if (next == null) {
                if (state != State.RUNNING && retireWorker(false)) {
                    return;
                }
                continue;
            }
            deliver(next);
        }
    }

    /**
     * Clears {@link #worker} if the calling worker may exit. Runs under the lifecycle lock so that a
     * concurrent {@link #start()} either sees the worker gone or keeps it running.
     */
    private boolean retireWorker(boolean force) {
        lifecycle.readLock().lock();
        try {
            if (!force && (state == State.RUNNING || !queue.isEmpty())) {
                return false;
            }
            if (worker == Thread.currentThread()) {
                worker = null;
            }
            return true;
        } finally {
            lifecycle.readLock().unlock();
        }
    }

    private void deliver(Delivery delivery) {
        List<Subscription> registrations = subscribers.get(delivery.topic());
        if (registrations == null || registrations.isEmpty()) {
            return;
        }
        for (Subscription subscription : registrations) {
            if (!subscription.isActive()) {
                continue;
            }
            ReentrantLock deliveryLock = subscription.deliveryLock();
            deliveryLock.lock();
            try {
                if (!subscription.isActive()) {
                    continue;
                }
                subscription.callback().accept(delivery.message());
                delivered.incrementAndGet();
            } catch (Exception e) {
                subscriberFailures.incrementAndGet();
                SubscriberFailureException failure = new SubscriberFailureException(delivery.topic(), subscription.id(), e);
                log.error("Error in subscriber for {}: {}", delivery.topic(), failure.getMessage(), failure);
            } finally {
                deliveryLock.unlock();
            }
        }
    }

    private void onWorkerCrash(Throwable error) {
        workerRestarts.incrementAndGet();
        try {
            fatalListener.accept(error);
        } catch (RuntimeException listenerError) {
            log.error("{} fatal listener failed", name, listenerError);
        }
        lifecycle.readLock().lock();
        try {
            if (worker != Thread.currentThread()) {
                return;
            }
            if (state == State.RUNNING || state == State.STOPPING) {
                log.warn("Restarting {} worker after crash: {}", name, error.toString());
                launchWorker();
            } else {
                worker = null;
            }
        } finally {
            lifecycle.readLock().unlock();
        }
    }

    private static void requireTopic(String topic) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic cannot be empty");
        }
    }

    private record Delivery(String topic, Message message) {
    }
}
