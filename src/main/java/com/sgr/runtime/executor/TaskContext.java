package com.sgr.runtime.executor;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Mutable state of one task invocation. Safe for concurrent writers: every
 * role writes its own output slot, failures are appended.
 */
public class TaskContext {

    private final String input;
    private final Instant started;
    private final Instant deadline;

    private final Map<String, String> outputs = Collections.synchronizedMap(new LinkedHashMap<>());
    private final List<PartialFailure> failures = new CopyOnWriteArrayList<>();
    private final List<String> notes = new CopyOnWriteArrayList<>();
    private final Set<Future<?>> inFlight = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final AtomicBoolean routingNoMatch = new AtomicBoolean();

    public TaskContext(String input, Duration timeout) {
        this.input = input;
        this.started = Instant.now();
        this.deadline = started.plus(timeout);
    }

    public String input() {
        return input;
    }

    public Instant started() {
        return started;
    }

    public Instant deadline() {
        return deadline;
    }

    public Duration remaining() {
        Duration left = Duration.between(Instant.now(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public void recordOutput(String role, String text) {
        outputs.put(role, text);
    }

    /**
     * Records a failure and stores its marker as the role's output.
     *
     * @return the marker
     */
    public String recordFailure(String role, FailureKind kind, String message) {
        PartialFailure failure = new PartialFailure(role, kind, message);
        failures.add(failure);
        outputs.put(role, failure.marker());
        return failure.marker();
    }

    /**
     * Records something the caller should know about that is not a failure.
     */
    public void recordNote(String note) {
        notes.add(note);
    }

    public void markRoutingNoMatch() {
        routingNoMatch.set(true);
    }

    public boolean isRoutingNoMatch() {
        return routingNoMatch.get();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (cancelled.get() || Thread.currentThread().isInterrupted()) {
            throw new TaskCancelledException("Task cancelled");
        }
    }

    public <T extends Future<?>> T register(T future) {
        inFlight.add(future);
        if (cancelled.get()) {
            future.cancel(true);
        }
        return future;
    }

    public void unregister(Future<?> future) {
        inFlight.remove(future);
    }

    /**
     * Cancels the task and interrupts everything still in flight.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            for (Future<?> future : inFlight) {
                future.cancel(true);
            }
        }
    }

    public Map<String, String> outputsSnapshot() {
        synchronized (outputs) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        }
    }

    public List<PartialFailure> failures() {
        return List.copyOf(failures);
    }

    public List<String> notes() {
        return List.copyOf(notes);
    }
}
