package com.chipilink.server.events;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventBusTest {

    private EventBus bus;

    @BeforeEach
    void setUp() {
        bus = new EventBus(EventBus.DEFAULT_HISTORY_CAPACITY, 4, Duration.ofSeconds(5));
        bus.start();
    }

    @AfterEach
    void tearDown() {
        bus.close();
    }

    @Test
    void prefixAndExactSubscriptionsBothFire() {
        AtomicInteger calls = new AtomicInteger();
        bus.subscribe("pinpanclub.*", e -> calls.incrementAndGet());
        bus.subscribe("pinpanclub.match.created", e -> calls.incrementAndGet());
        bus.subscribe("store.*", e -> calls.incrementAndGet());

        DispatchReport report = bus.publish("pinpanclub.match.created", Map.of("match_id", "m1"), "pinpanclub");

        assertThat(calls.get()).isEqualTo(2);
        assertThat(report.matched()).isEqualTo(2);
        assertThat(report.succeeded()).isEqualTo(2);
    }

    @Test
    void eachMatchingHandlerIsInvokedExactlyOnce() {
        AtomicInteger exact = new AtomicInteger();
        AtomicInteger prefix = new AtomicInteger();
        AtomicInteger any = new AtomicInteger();
        bus.subscribe("store.order.created", e -> exact.incrementAndGet());
        bus.subscribe("store.*", e -> prefix.incrementAndGet());
        bus.subscribe("*", e -> any.incrementAndGet());

        bus.publish(Event.of("store.order.created", Map.of(), "store"));

        assertThat(exact.get()).isEqualTo(1);
        assertThat(prefix.get()).isEqualTo(1);
        assertThat(any.get()).isEqualTo(1);
    }

    @Test
    void duplicateRegistrationsFireIndependently() {
        AtomicInteger calls = new AtomicInteger();
        EventHandler handler = e -> calls.incrementAndGet();
        bus.subscribe("a.b", handler);
        bus.subscribe("a.b", handler);

        bus.publish("a.b", Map.of(), "test");

        assertThat(calls.get()).isEqualTo(2);
        assertThat(bus.getSubscribers()).containsEntry("a.b", 2);
    }

    @Test
    void failingHandlerDoesNotPreventOthers() {
        AtomicInteger delivered = new AtomicInteger();
        bus.subscribe("wallet.*", e -> {
            throw new IllegalStateException("ledger down");
        });
        bus.subscribe("wallet.*", e -> delivered.incrementAndGet());

        DispatchReport[] report = new DispatchReport[1];
        assertThatCode(() -> report[0] = bus.publish("wallet.topup", Map.of("amount", 10), "wallet"))
                .doesNotThrowAnyException();

        assertThat(delivered.get()).isEqualTo(1);
        assertThat(report[0].failed()).isEqualTo(1);
        assertThat(report[0].succeeded()).isEqualTo(1);
        assertThat(report[0].hasCriticalFailures()).isFalse();
    }

    @Test
    void criticalHandlerFailureIsNamedInReport() {
        bus.subscribe(new EventSubscriber() {
            @Override
            public String pattern() {
                return "wallet.*";
            }

            @Override
            public HandlerSeverity severity() {
                return HandlerSeverity.CRITICAL;
            }

            @Override
            public String name() {
                return "ledger-mirror";
            }

            @Override
            public void handle(Event event) {
                throw new IllegalStateException("board rejected item");
            }
        });

        DispatchReport report = bus.publish("wallet.topup", Map.of(), "wallet");

        assertThat(report.criticalFailures()).containsExactly("ledger-mirror");
    }

    @Test
    void handlersRunConcurrently() {
        CountDownLatch bothStarted = new CountDownLatch(2);
        AtomicInteger sawOther = new AtomicInteger();
        EventHandler waitsForPeer = e -> {
            bothStarted.countDown();
            if (bothStarted.await(2, TimeUnit.SECONDS)) {
                sawOther.incrementAndGet();
            }
        };
        bus.subscribe("x", waitsForPeer);
        bus.subscribe("x", waitsForPeer);

        DispatchReport report = bus.publish("x", Map.of(), "test");

        assertThat(report.succeeded()).isEqualTo(2);
        assertThat(sawOther.get()).isEqualTo(2);
    }

    @Test
    void publishReturnsOnlyAfterHandlersComplete() {
        AtomicBoolean finished = new AtomicBoolean();
        bus.subscribe("slow", e -> {
            Thread.sleep(100);
            finished.set(true);
        });

        bus.publish("slow", Map.of(), "test");

        assertThat(finished).isTrue();
    }

    @Test
    void hungHandlerIsCutOffByTimeout() {
        EventBus quick = new EventBus(10, 2, Duration.ofMillis(200));
        quick.start();
        try {
            AtomicInteger other = new AtomicInteger();
            quick.subscribe("t", e -> Thread.sleep(10_000));
            quick.subscribe("t", e -> other.incrementAndGet());

            long started = System.nanoTime();
            DispatchReport report = quick.publish("t", Map.of(), "test");
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

            assertThat(report.timedOut()).isEqualTo(1);
            assertThat(report.succeeded()).isEqualTo(1);
            assertThat(other.get()).isEqualTo(1);
            assertThat(elapsedMs).isLessThan(2_000);
        } finally {
            quick.close();
        }
    }

    @Test
    void handlersIgnoringCancellationDoNotStarveLaterEvents() {
        EventBus quick = new EventBus(10, 2, Duration.ofMillis(200));
        quick.start();
        AtomicBoolean release = new AtomicBoolean();
        try {
            AtomicInteger healthy = new AtomicInteger();
            quick.subscribe("slow.*", e -> {
                while (!release.get()) {
                    Thread.onSpinWait();
                }
            });
            quick.subscribe("ok", e -> healthy.incrementAndGet());

            assertThat(quick.publish("slow.a", Map.of(), "test").timedOut()).isEqualTo(1);
            assertThat(quick.publish("slow.b", Map.of(), "test").timedOut()).isEqualTo(1);
            assertThat(quick.publish("slow.c", Map.of(), "test").timedOut()).isEqualTo(1);

            DispatchReport report = quick.publish("ok", Map.of(), "test");

            assertThat(report.succeeded()).isEqualTo(1);
            assertThat(report.timedOut()).isZero();
            assertThat(healthy.get()).isEqualTo(1);
            assertThat(quick.busyWorkers()).isGreaterThanOrEqualTo(3);
        } finally {
            release.set(true);
            quick.close();
        }
    }

    @Test
    void saturatedDispatchPoolFailsFastInsteadOfQueueing() {
        EventBus capped = new EventBus(10, 1, 1, Duration.ofMillis(200));
        capped.start();
        AtomicBoolean release = new AtomicBoolean();
        try {
            AtomicInteger healthy = new AtomicInteger();
            capped.subscribe("slow", e -> {
                while (!release.get()) {
                    Thread.onSpinWait();
                }
            });
            capped.subscribe("ok", e -> healthy.incrementAndGet(), HandlerSeverity.CRITICAL);
            capped.publish("slow", Map.of(), "test");

            DispatchReport report = capped.publish("ok", Map.of(), "test");

            assertThat(report.failed()).isEqualTo(1);
            assertThat(report.timedOut()).isZero();
            assertThat(report.criticalFailures()).hasSize(1);
            assertThat(healthy.get()).isZero();
        } finally {
            release.set(true);
            capped.close();
        }
    }

    @Test
    void historyKeepsNewestThousandEvents() {
        for (int i = 0; i <= 1000; i++) {
            bus.publish("seq." + i, Map.of(), "test");
        }

        List<Event> history = bus.getHistory(2000);

        assertThat(bus.historySize()).isEqualTo(1000);
        assertThat(history).hasSize(1000);
        assertThat(history.get(0).eventType()).isEqualTo("seq.1");
        assertThat(history.get(999).eventType()).isEqualTo("seq.1000");
    }

    @Test
    void historyCanBeFilteredAndLimited() {
        bus.publish("store.order.created", Map.of("n", 1), "store");
        bus.publish("pinpanclub.match.created", Map.of(), "pinpanclub");
        bus.publish("store.order.paid", Map.of("n", 2), "store");
        bus.publish("store.order.shipped", Map.of("n", 3), "store");

        List<Event> lastTwoStore = bus.getHistory("store.*", 2);

        assertThat(lastTwoStore).extracting(Event::eventType)
                .containsExactly("store.order.paid", "store.order.shipped");
        assertThat(bus.getHistory("*", 0)).isEmpty();
        assertThat(bus.getHistory(null, 10)).hasSize(4);
    }

    @Test
    void laterSubscriptionDoesNotSeeEarlierEvents() {
        bus.publish("a.b", Map.of(), "test");
        AtomicInteger calls = new AtomicInteger();
        bus.subscribe("a.*", e -> calls.incrementAndGet());

        assertThat(calls.get()).isZero();

        bus.publish("a.c", Map.of(), "test");
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void unsubscribeRemovesOnlyThatPair() {
        AtomicInteger first = new AtomicInteger();
        AtomicInteger second = new AtomicInteger();
        EventHandler h1 = e -> first.incrementAndGet();
        EventHandler h2 = e -> second.incrementAndGet();
        bus.subscribe("a.b", h1);
        bus.subscribe("a.b", h2);
        bus.subscribe("a.*", h1);

        assertThat(bus.unsubscribe("a.b", h1)).isTrue();
        assertThat(bus.unsubscribe("a.b", h1)).isFalse();
        assertThat(bus.unsubscribe("missing", h1)).isFalse();

        bus.publish("a.b", Map.of(), "test");

        assertThat(first.get()).isEqualTo(1);
        assertThat(second.get()).isEqualTo(1);
        assertThat(bus.getSubscribers()).containsEntry("a.b", 1).containsEntry("a.*", 1);
    }

    @Test
    void stoppedBusDropsEventsSilently() {
        AtomicInteger calls = new AtomicInteger();
        bus.subscribe("*", e -> calls.incrementAndGet());
        bus.shutdown();

        DispatchReport report = bus.publish("a.b", Map.of(), "test");

        assertThat(report.accepted()).isFalse();
        assertThat(calls.get()).isZero();
        assertThat(bus.historySize()).isZero();

        bus.start();
        bus.publish("a.b", Map.of(), "test");
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void eventPayloadIsImmutable() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("k", "v");
        Event event = Event.of("a.b", payload, "test", EventPriority.HIGH);
        payload.put("k", "changed");

        assertThat(event.payload()).containsEntry("k", "v");
        assertThat(event.priority()).isEqualTo(EventPriority.HIGH);
        assertThat(event.eventId()).isNotBlank();
        assertThatThrownBy(() -> event.payload().put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
    }
}
