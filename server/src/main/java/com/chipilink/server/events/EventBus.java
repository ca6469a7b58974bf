package com.chipilink.server.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process pub/sub mediator between producers and consumers of domain events.
 * <p>
 * Subscriptions use exact, {@code "prefix.*"} or {@code "*"} patterns. Matching handlers run
 * concurrently on a fixed dispatch pool; {@link #publish(Event)} waits for all of them, bounded
 * by the handler timeout. A failing handler never affects other handlers or the publisher.
 * The last {@code historyCapacity} events are kept for inspection.
 * <p>
 * The dispatch pool hands tasks straight to a worker and grows up to {@code maxDispatchThreads},
 * so a handler that ignores cancellation keeps only its own worker busy. Handlers that cannot
 * get a worker at all are counted as failed instead of waiting behind stuck ones.
 */
public class EventBus implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    public static final int DEFAULT_HISTORY_CAPACITY = 1000;
    public static final int DEFAULT_MAX_DISPATCH_THREADS = 256;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, List<Registration>> subscriptions = new LinkedHashMap<>();
    private final Deque<Event> history = new ArrayDeque<>();

    private final int historyCapacity;
    private final Duration handlerTimeout;
    private final ThreadPoolExecutor dispatchPool;

    private volatile boolean running;

    public EventBus() {
        this(DEFAULT_HISTORY_CAPACITY, 8, Duration.ofSeconds(10));
    }

    public EventBus(int historyCapacity, int dispatchThreads, Duration handlerTimeout) {
        this(historyCapacity, dispatchThreads, Math.max(dispatchThreads, DEFAULT_MAX_DISPATCH_THREADS), handlerTimeout);
    }

    public EventBus(int historyCapacity, int dispatchThreads, int maxDispatchThreads, Duration handlerTimeout) {
        if (historyCapacity < 1) {
            throw new IllegalArgumentException("historyCapacity must be positive");
        }
        if (handlerTimeout == null || handlerTimeout.isNegative() || handlerTimeout.isZero()) {
            throw new IllegalArgumentException("handlerTimeout must be positive");
        }
        this.historyCapacity = historyCapacity;
        this.handlerTimeout = handlerTimeout;
        AtomicInteger seq = new AtomicInteger();
        int core = Math.max(1, dispatchThreads);
        this.dispatchPool = new ThreadPoolExecutor(core, Math.max(core, maxDispatchThreads),
                60L, TimeUnit.SECONDS, new SynchronousQueue<>(), r -> {
            Thread t = new Thread(r, "event-bus-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    // ---------------------------------------------------------------- lifecycle

    public void start() {
        running = true;
        log.info("[BUS] started historyCapacity={} handlerTimeout={}ms", historyCapacity, handlerTimeout.toMillis());
    }

    /** Stops accepting events. Subscriptions and history are kept; {@link #start()} resumes. */
    public void shutdown() {
        running = false;
        log.info("[BUS] stopped");
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public void close() {
        shutdown();
        dispatchPool.shutdown();
        try {
            if (!dispatchPool.awaitTermination(handlerTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                dispatchPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            dispatchPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ---------------------------------------------------------------- subscriptions

    public void subscribe(String pattern, EventHandler handler) {
        subscribe(pattern, handler, HandlerSeverity.BEST_EFFORT);
    }

    public void subscribe(EventSubscriber subscriber) {
        subscribe(subscriber.pattern(), subscriber, subscriber.severity());
    }

    public void subscribe(String pattern, EventHandler handler, HandlerSeverity severity) {
        requirePattern(pattern);
        if (handler == null) {
            throw new IllegalArgumentException("handler must not be null");
        }
        Registration registration = new Registration(pattern, handler,
                severity == null ? HandlerSeverity.BEST_EFFORT : severity);
        lock.lock();
        try {
            subscriptions.computeIfAbsent(pattern, k -> new ArrayList<>()).add(registration);
        } finally {
            lock.unlock();
        }
        log.info("[SUBSCRIBE] pattern={} handler={} severity={}", pattern, handler.name(), registration.severity());
    }

    /**
     * Removes one registration of exactly this pattern and handler instance.
     *
     * @return true if a registration was removed
     */
    public boolean unsubscribe(String pattern, EventHandler handler) {
        if (pattern == null || handler == null) {
            return false;
        }
        lock.lock();
        try {
            List<Registration> regs = subscriptions.get(pattern);
            if (regs == null) {
                return false;
            }
            Iterator<Registration> it = regs.iterator();
            while (it.hasNext()) {
                if (it.next().handler() == handler) {
                    it.remove();
                    if (regs.isEmpty()) {
                        subscriptions.remove(pattern);
                    }
                    log.info("[UNSUBSCRIBE] pattern={} handler={}", pattern, handler.name());
                    return true;
                }
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    public boolean unsubscribe(EventSubscriber subscriber) {
        return unsubscribe(subscriber.pattern(), subscriber);
    }

    /** Pattern to number of registered handlers. */
    public Map<String, Integer> getSubscribers() {
        lock.lock();
        try {
            Map<String, Integer> counts = new LinkedHashMap<>();
            subscriptions.forEach((pattern, regs) -> counts.put(pattern, regs.size()));
            return counts;
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------- publishing

    public DispatchReport publish(String eventType, Map<String, ?> payload, String sourceModule) {
        return publish(Event.of(eventType, payload, sourceModule));
    }

    public DispatchReport publish(String eventType, Map<String, ?> payload, String sourceModule, EventPriority priority) {
        return publish(Event.of(eventType, payload, sourceModule, priority));
    }

    /**
     * Records the event and dispatches it to every subscription matching at this moment.
     * Returns once every handler has completed, failed or timed out. Never throws.
     */
    public DispatchReport publish(Event event) {
        if (event == null) {
            log.warn("[DROP] null event ignored");
            return DispatchReport.dropped(null);
        }
        if (!running) {
            log.warn("[DROP] bus not running type={} id={} source={}",
                    event.eventType(), event.eventId(), event.sourceModule());
            return DispatchReport.dropped(event.eventId());
        }

        List<Registration> targets = new ArrayList<>();
        lock.lock();
        try {
            history.addLast(event);
            while (history.size() > historyCapacity) {
                history.removeFirst();
            }
            for (Map.Entry<String, List<Registration>> entry : subscriptions.entrySet()) {
                if (EventPatterns.matches(event.eventType(), entry.getKey())) {
                    targets.addAll(entry.getValue());
                }
            }
        } finally {
            lock.unlock();
        }

        if (targets.isEmpty()) {
            log.debug("[PUBLISH] type={} id={} no subscribers", event.eventType(), event.eventId());
            return new DispatchReport(event.eventId(), true, 0, 0, 0, 0, List.of());
        }
        return dispatch(event, targets);
    }

    private DispatchReport dispatch(Event event, List<Registration> targets) {
        List<Future<?>> futures = new ArrayList<>(targets.size());
        int failed = 0;
        List<String> criticalFailures = new ArrayList<>();

        for (Registration reg : targets) {
            try {
                futures.add(dispatchPool.submit(() -> {
                    reg.handler().handle(event);
                    return null;
                }));
            } catch (RejectedExecutionException e) {
                futures.add(null);
                failed++;
                reportFailure(reg, event, "no dispatch worker free (busy=" + dispatchPool.getActiveCount() + ")",
                        null, criticalFailures);
            }
        }

        int succeeded = 0;
        int timedOut = 0;
        long deadline = System.nanoTime() + handlerTimeout.toNanos();
        boolean interrupted = false;

        for (int i = 0; i < targets.size(); i++) {
            Future<?> future = futures.get(i);
            if (future == null) {
                continue;
            }
            Registration reg = targets.get(i);
            if (interrupted) {
                future.cancel(true);
                timedOut++;
                continue;
            }
            try {
                future.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
                succeeded++;
            } catch (ExecutionException e) {
                failed++;
                reportFailure(reg, event, "handler failed", e.getCause(), criticalFailures);
            } catch (TimeoutException e) {
                future.cancel(true);
                timedOut++;
                reportFailure(reg, event, "handler timed out after " + handlerTimeout.toMillis() + "ms",
                        null, criticalFailures);
            } catch (InterruptedException e) {
                interrupted = true;
                future.cancel(true);
                timedOut++;
                Thread.currentThread().interrupt();
            }
        }

        if (log.isDebugEnabled()) {
            log.debug("[PUBLISH] type={} id={} matched={} ok={} failed={} timedOut={}",
                    event.eventType(), event.eventId(), targets.size(), succeeded, failed, timedOut);
        }
        return new DispatchReport(event.eventId(), true, targets.size(), succeeded, failed, timedOut, criticalFailures);
    }

    private void reportFailure(Registration reg, Event event, String what, Throwable cause, List<String> criticalFailures) {
        String name = reg.handler().name();
        if (reg.severity() == HandlerSeverity.CRITICAL) {
            criticalFailures.add(name);
            log.error("[HANDLER] {} handler={} pattern={} type={} id={}",
                    what, name, reg.pattern(), event.eventType(), event.eventId(), cause);
        } else {
            log.warn("[HANDLER] {} handler={} pattern={} type={} id={}",
                    what, name, reg.pattern(), event.eventType(), event.eventId(), cause);
        }
    }

    // ---------------------------------------------------------------- history

    public List<Event> getHistory(int limit) {
        return getHistory(null, limit);
    }

    /**
     * Up to {@code limit} most recent buffered events, oldest first, optionally filtered by pattern.
     */
    public List<Event> getHistory(String pattern, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<Event> result = new ArrayList<>(Math.min(limit, historyCapacity));
        lock.lock();
        try {
            Iterator<Event> newestFirst = history.descendingIterator();
            while (newestFirst.hasNext() && result.size() < limit) {
                Event e = newestFirst.next();
                if (pattern == null || pattern.isBlank() || EventPatterns.matches(e.eventType(), pattern)) {
                    result.add(e);
                }
            }
        } finally {
            lock.unlock();
        }
        Collections.reverse(result);
        return result;
    }

    /** Workers currently running a handler, including handlers that timed out but never returned. */
    public int busyWorkers() {
        return dispatchPool.getActiveCount();
    }

    public int historySize() {
        lock.lock();
        try {
            return history.size();
        } finally {
            lock.unlock();
        }
    }

    private static void requirePattern(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("pattern must not be blank");
        }
    }

    private record Registration(String pattern, EventHandler handler, HandlerSeverity severity) {
    }
}
