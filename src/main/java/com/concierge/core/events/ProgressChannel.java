package com.concierge.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Bounded queue of progress events for one consumer.
 * <p>
 * The producing side never blocks: when the queue is full the event is dropped
 * and counted. Consumers poll at their own pace. Once closed, further events
 * are ignored.
 */
public class ProgressChannel implements Consumer<ConciergeEvent>, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProgressChannel.class);

    private final BlockingQueue<ConciergeEvent> queue;
    private final AtomicLong dropped = new AtomicLong();
    private volatile boolean closed;
    private volatile Runnable closeAction = () -> { };

    public ProgressChannel(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    @Override
    public void accept(ConciergeEvent event) {
        if (closed) {
            return;
        }
        if (!queue.offer(event)) {
            long total = dropped.incrementAndGet();
            log.debug("Progress channel full, dropped {} ({} dropped so far)", event.eventType(), total);
        }
    }

    /** Waits up to {@code timeout} for the next event. */
    public Optional<ConciergeEvent> poll(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    /** Removes and returns every event currently queued. */
    public List<ConciergeEvent> drain() {
        List<ConciergeEvent> events = new ArrayList<>();
        queue.drainTo(events);
        return events;
    }

    void onClose(Runnable action) {
        this.closeAction = action;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            closeAction.run();
        }
    }

    public long droppedCount() {
        return dropped.get();
    }

    public int size() {
        return queue.size();
    }
}
