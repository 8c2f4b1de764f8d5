package me.golemcore.pilot.adapter.outbound.notification;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.pilot.infrastructure.config.PilotProperties;
import me.golemcore.pilot.port.outbound.NotificationBus;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * In-process notification bus. Each subscriber owns a bounded queue; when a
 * queue is full the message is dropped for that subscriber only.
 */
@Component
@ConditionalOnProperty(name = "pilot.notifications.mode", havingValue = "local", matchIfMissing = true)
@Slf4j
public class LocalNotificationBus implements NotificationBus {

    private final Map<String, List<BlockingQueue<Map<String, Object>>>> subscribers = new ConcurrentHashMap<>();
    private final int queueCapacity;

    public LocalNotificationBus(PilotProperties properties) {
        this.queueCapacity = properties.getNotifications().getQueueCapacity();
    }

    @Override
    public BlockingQueue<Map<String, Object>> subscribe(String key) {
        BlockingQueue<Map<String, Object>> queue = new LinkedBlockingQueue<>(queueCapacity);
        subscribers.compute(key, (k, queues) -> {
            List<BlockingQueue<Map<String, Object>>> target = queues != null ? queues : new CopyOnWriteArrayList<>();
            target.add(queue);
            return target;
        });
        return queue;
    }

    @Override
    public void unsubscribe(String key, BlockingQueue<Map<String, Object>> queue) {
        subscribers.computeIfPresent(key, (k, queues) -> {
            queues.remove(queue);
            return queues.isEmpty() ? null : queues;
        });
    }

    @Override
    public void publish(String key, Map<String, Object> message) {
        List<BlockingQueue<Map<String, Object>>> queues = subscribers.get(key);
        if (queues == null) {
            return;
        }
        for (BlockingQueue<Map<String, Object>> queue : queues) {
            if (!queue.offer(message)) {
                log.warn("[Notifications] Subscriber queue full for key {}, message dropped", key);
            }
        }
    }

    @Override
    public void close() {
        subscribers.clear();
    }

    int subscriberCount(String key) {
        List<BlockingQueue<Map<String, Object>>> queues = subscribers.get(key);
        return queues == null ? 0 : queues.size();
    }

    boolean hasKey(String key) {
        return subscribers.containsKey(key);
    }
}
