package com.questrail.wirecalc.observability;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 *
 * <p>Events arrive from server threads; {@link #await(Class, Predicate, Duration)}
 * lets a test block until a matching one has been recorded.</p>
 */
public final class RecordingObservabilitySink implements ServerObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public void onServerEvent(ServerLifecycleEvent event) {
        record(event);
    }

    @Override
    public void onConnectionEvent(ConnectionEvent event) {
        record(event);
    }

    @Override
    public void onExchange(ExchangeEvent event) {
        record(event);
    }

    @Override
    public void onInputDropped(DroppedInputEvent event) {
        record(event);
    }

    @Override
    public void onError(ServerErrorEvent event) {
        record(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized <T> List<T> eventsOfType(Class<T> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .collect(Collectors.toList());
    }

    public synchronized List<DroppedInputEvent> dropped(DroppedInputEvent.Reason reason) {
        return eventsOfType(DroppedInputEvent.class).stream()
            .filter(e -> e.reason() == reason)
            .collect(Collectors.toList());
    }

    /**
     * Blocks until an event of {@code type} matching {@code condition} is recorded.
     *
     * @throws AssertionError if none arrives within {@code timeout}
     */
    public synchronized <T> T await(Class<T> type, Predicate<? super T> condition, Duration timeout)
            throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            for (Object event : events) {
                if (type.isInstance(event) && condition.test(type.cast(event))) {
                    return type.cast(event);
                }
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new AssertionError("No matching " + type.getSimpleName() + " within " + timeout
                    + "; recorded: " + events);
            }
            TimeUnit.NANOSECONDS.timedWait(this, remaining);
        }
    }

    private synchronized void record(Object event) {
        events.add(event);
        notifyAll();
    }
}
