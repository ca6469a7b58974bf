package com.chipilink.server.emit;

import com.chipilink.server.events.Event;
import com.chipilink.server.events.EventBus;
import com.chipilink.server.events.EventPriority;
import com.chipilink.server.model.RealtimeMessage;
import com.chipilink.server.ws.ConnectionRegistry;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class AdminActivityRelayTest {

    private final ConnectionRegistry registry = mock(ConnectionRegistry.class);

    @Test
    void relaysConfiguredEventTypesToAdminRoom() {
        AdminActivityRelay relay = new AdminActivityRelay(registry, "store.order.*, users.wallet.topup");

        relay.handle(Event.of("store.order.submitted", Map.of("order_id", "o-1"), "store", EventPriority.HIGH));

        ArgumentCaptor<RealtimeMessage> msg = ArgumentCaptor.forClass(RealtimeMessage.class);
        verify(registry).broadcastToRoom(eq("admin"), msg.capture());
        assertThat(msg.getValue().type()).isEqualTo("activity");
        assertThat(msg.getValue().payload())
                .containsEntry("event_type", "store.order.submitted")
                .containsEntry("source_module", "store")
                .containsEntry("priority", "HIGH")
                .containsEntry("data", Map.of("order_id", "o-1"));
    }

    @Test
    void ignoresEventsOutsideTheConfiguredPatterns() {
        AdminActivityRelay relay = new AdminActivityRelay(registry, "store.order.*");

        relay.handle(Event.of("rapidpin.like", Map.of(), "rapidpin"));
        relay.handle(Event.of("store.order", Map.of(), "store"));

        verifyNoInteractions(registry);
    }

    @Test
    void emptyConfigurationDisablesRelay() {
        AdminActivityRelay relay = new AdminActivityRelay(registry, "");

        relay.handle(Event.of("store.order.submitted", Map.of(), "store"));

        verifyNoInteractions(registry);
    }

    @Test
    void receivesEveryEventThroughTheBus() {
        AdminActivityRelay relay = new AdminActivityRelay(registry, "users.wallet.*");
        try (EventBus bus = new EventBus(10, 2, Duration.ofSeconds(2))) {
            bus.subscribe(relay);
            bus.start();

            bus.publish("users.wallet.topup", Map.of("amount", 10), "wallet");
            bus.publish("store.product.updated", Map.of(), "store");

            assertThat(bus.getSubscribers()).containsEntry("*", 1);
        }
        verify(registry).broadcastToRoom(eq("admin"), any(RealtimeMessage.class));
    }
}
