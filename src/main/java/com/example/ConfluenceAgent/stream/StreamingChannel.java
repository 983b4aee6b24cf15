package com.example.ConfluenceAgent.stream;

import com.example.ConfluenceAgent.model.StreamEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Ordered, unbounded pipe between one background producer and one consumer.
 *
 * The producer calls {@link #put(StreamEvent)} any number of times and then {@link #finish()}
 * exactly once. The consumer subscribes to {@link #stream()}, which emits every event in
 * insertion order and completes after the terminal sentinel.
 *
 * A channel belongs to a single invocation and is never reused.
 */
public class StreamingChannel {

    private static final Logger log = LoggerFactory.getLogger(StreamingChannel.class);

    /** Terminal marker, compared by identity. */
    private static final StreamEvent END = new StreamEvent("end", "", null);

    private final BlockingQueue<StreamEvent> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean finished = new AtomicBoolean(false);
    private final AtomicBoolean subscribed = new AtomicBoolean(false);

    /**
     * Append an event to the tail of the buffer. Never blocks.
     *
     * @return false if the channel was already finished and the event was dropped
     */
    public boolean put(StreamEvent event) {
        Objects.requireNonNull(event, "event");
        if (finished.get()) {
            log.warn("Dropping event after channel finished: stage={}, message='{}'",
                    event.stage(), event.message());
            return false;
        }
        queue.add(event);
        return true;
    }

    /**
     * Mark the channel finished and enqueue the terminal sentinel.
     * Only the first call has an effect.
     */
    public void finish() {
        if (!finished.compareAndSet(false, true)) {
            log.warn("StreamingChannel.finish() called more than once; ignoring");
            return;
        }
        queue.add(END);
    }

    public boolean isFinished() {
        return finished.get();
    }

    /**
     * Lazy, finite, single-use view of the buffer.
     * Blocking takes run on the boundedElastic scheduler.
     */
    public Flux<StreamEvent> stream() {
        return Flux.defer(() -> {
            if (!subscribed.compareAndSet(false, true)) {
                return Flux.error(new IllegalStateException("StreamingChannel can only be consumed once"));
            }
            return Flux.<StreamEvent>generate(sink -> {
                StreamEvent item;
                try {
                    item = queue.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    sink.error(e);
                    return;
                }
                // Both checks: only the sentinel enqueued by finish() ends the stream
                if (item == END && finished.get()) {
                    sink.complete();
                } else {
                    sink.next(item);
                }
            }).subscribeOn(Schedulers.boundedElastic());
        });
    }
}
