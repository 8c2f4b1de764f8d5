package me.golemcore.pilot.adapter.outbound.notification;

import me.golemcore.pilot.infrastructure.config.PilotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

class LocalNotificationBusTest {

    private static final String KEY = "org_1";

    private LocalNotificationBus bus;

    @BeforeEach
    void setUp() {
        PilotProperties properties = new PilotProperties();
        properties.getNotifications().setQueueCapacity(2);
        bus = new LocalNotificationBus(properties);
    }

    @Test
    void shouldFanOutToEverySubscriberOfKey() {
        BlockingQueue<Map<String, Object>> first = bus.subscribe(KEY);
        BlockingQueue<Map<String, Object>> second = bus.subscribe(KEY);

        bus.publish(KEY, Map.of("type", "verification_code_required"));

        assertEquals("verification_code_required", first.poll().get("type"));
        assertEquals("verification_code_required", second.poll().get("type"));
    }

    @Test
    void shouldIsolateKeys() {
        BlockingQueue<Map<String, Object>> other = bus.subscribe("org_2");

        bus.publish(KEY, Map.of("type", "x"));

        assertNull(other.poll());
    }

    @Test
    void shouldDeliverInPublishOrder() {
        BlockingQueue<Map<String, Object>> queue = bus.subscribe(KEY);

        bus.publish(KEY, Map.of("n", 1));
        bus.publish(KEY, Map.of("n", 2));

        assertEquals(1, queue.poll().get("n"));
        assertEquals(2, queue.poll().get("n"));
    }

    @Test
    void shouldKeepSubscriberThatJoinsWhileLastOneLeaves() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int i = 0; i < 500; i++) {
                String key = "org_race_" + i;
                BlockingQueue<Map<String, Object>> leaving = bus.subscribe(key);
                CountDownLatch start = new CountDownLatch(1);
                Future<?> unsubscribe = pool.submit(() -> {
                    start.await();
                    bus.unsubscribe(key, leaving);
                    return null;
                });
                Future<BlockingQueue<Map<String, Object>>> subscribe = pool.submit(() -> {
                    start.await();
                    return bus.subscribe(key);
                });
                start.countDown();
                unsubscribe.get(5, TimeUnit.SECONDS);
                BlockingQueue<Map<String, Object>> joined = subscribe.get(5, TimeUnit.SECONDS);

                bus.publish(key, Map.of("n", i));

                assertEquals(i, joined.poll().get("n"));
                assertEquals(1, bus.subscriberCount(key));
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void shouldDropKeyAfterLastUnsubscribe() {
        BlockingQueue<Map<String, Object>> first = bus.subscribe(KEY);
        BlockingQueue<Map<String, Object>> second = bus.subscribe(KEY);

        bus.unsubscribe(KEY, first);
        assertEquals(1, bus.subscriberCount(KEY));

        bus.unsubscribe(KEY, second);
        assertFalse(bus.hasKey(KEY));
    }

    @Test
    void shouldIgnoreUnknownQueueOnUnsubscribe() {
        bus.subscribe(KEY);

        bus.unsubscribe(KEY, new LinkedBlockingQueue<>());
        bus.unsubscribe("missing", new LinkedBlockingQueue<>());

        assertEquals(1, bus.subscriberCount(KEY));
    }

    @Test
    void shouldDropMessagesForFullSubscriberOnly() {
        BlockingQueue<Map<String, Object>> slow = bus.subscribe(KEY);
        BlockingQueue<Map<String, Object>> fast = bus.subscribe(KEY);

        bus.publish(KEY, Map.of("n", 1));
        fast.poll();
        bus.publish(KEY, Map.of("n", 2));
        bus.publish(KEY, Map.of("n", 3));

        assertEquals(2, slow.size());
        assertEquals(1, slow.poll().get("n"));
        assertEquals(2, fast.size());
    }

    @Test
    void shouldPublishWithoutSubscribers() {
        bus.publish(KEY, Map.of("n", 1));

        assertFalse(bus.hasKey(KEY));
    }

    @Test
    void shouldClearSubscribersOnClose() {
        bus.subscribe(KEY);

        bus.close();

        assertFalse(bus.hasKey(KEY));
    }
}
