package com.tabrelay.client;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Handle for one event-name subscription. Events are queued in arrival order into a
 * bounded queue that the owner drains; when the queue is full the newest event is
 * dropped. Closing the handle unsubscribes.
 */
@Slf4j
public class EventSubscription implements AutoCloseable {

    @Getter private final String eventName;
    private final BlockingQueue<JsonNode> queue;
    private final Consumer<JsonNode> sink = this::offer;
    private final Consumer<EventSubscription> onClose;
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicLong dropped = new AtomicLong();

    public EventSubscription(String eventName, int capacity, Consumer<EventSubscription> onClose) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be positive: " + capacity);
        this.eventName = eventName;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.onClose = onClose;
    }

    /** The callback to register with whatever produces the events. */
    public Consumer<JsonNode> sink() {
        return sink;
    }

    private void offer(JsonNode params) {
        if (closed.get()) return;
        if (!queue.offer(params)) {
            long total = dropped.incrementAndGet();
            log.warn("Event queue full for {}; dropped event ({} dropped so far)", eventName, total);
        }
    }

    /**
     * Take the next event, waiting up to {@code timeout}.
     *
     * @return the event params, or null if none arrived in time
     */
    public JsonNode poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    /** Take every event queued right now. */
    public List<JsonNode> drain() {
        List<JsonNode> events = new ArrayList<>();
        queue.drainTo(events);
        return events;
    }

    public int pending() {
        return queue.size();
    }

    public long droppedCount() {
        return dropped.get();
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            onClose.accept(this);
        }
    }
}
