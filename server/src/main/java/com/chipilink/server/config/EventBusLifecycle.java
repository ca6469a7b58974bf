package com.chipilink.server.config;

import com.chipilink.server.events.EventBus;
import com.chipilink.server.events.EventSubscriber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Subscribes every {@link EventSubscriber} bean, then opens the bus. Runs in an early phase so
 * the bus accepts events before the web server takes traffic and stops after it.
 */
@Component
public class EventBusLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(EventBusLifecycle.class);

    private final EventBus bus;
    private final ObjectProvider<EventSubscriber> subscribers;
    private boolean subscribed;

    public EventBusLifecycle(EventBus bus, ObjectProvider<EventSubscriber> subscribers) {
        this.bus = bus;
        this.subscribers = subscribers;
    }

    @Override
    public void start() {
        if (!subscribed) {
            subscribers.orderedStream().forEach(bus::subscribe);
            subscribed = true;
            log.info("[BOOT] event subscribers={}", bus.getSubscribers());
        }
        bus.start();
    }

    @Override
    public void stop() {
        bus.shutdown();
    }

    @Override
    public boolean isRunning() {
        return bus.isRunning();
    }

    @Override
    public int getPhase() {
        return 0;
    }
}
