package com.chipilink.server.http;

import com.chipilink.server.events.Event;
import com.chipilink.server.events.EventBus;
import com.chipilink.server.ws.ConnectionRegistry;
import com.chipilink.server.ws.RegistryStats;
import com.chipilink.server.ws.RoomCatalog;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Read-only operational view of the registry and the bus.
 */
@RestController
@RequestMapping("/realtime")
public class RealtimeController {

    static final int MAX_EVENTS = 200;

    private final ConnectionRegistry registry;
    private final EventBus bus;

    public RealtimeController(ConnectionRegistry registry, EventBus bus) {
        this.registry = registry;
        this.bus = bus;
    }

    @GetMapping("/stats")
    public RegistryStats stats() {
        return registry.stats();
    }

    @GetMapping("/rooms")
    public Map<String, List<RoomCatalog.Entry>> rooms() {
        return Map.of("rooms", RoomCatalog.entries());
    }

    @GetMapping("/events")
    public Map<String, Object> events(@RequestParam(value = "pattern", required = false) String pattern,
                                      @RequestParam(value = "limit", defaultValue = "50") int limit) {
        List<Event> events = bus.getHistory(pattern, Math.min(Math.max(limit, 0), MAX_EVENTS));
        return Map.of("events", events, "total", events.size());
    }

    @GetMapping("/subscribers")
    public Map<String, Integer> subscribers() {
        return bus.getSubscribers();
    }
}
