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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.pilot.infrastructure.config.PilotProperties;
import me.golemcore.pilot.port.outbound.NotificationBus;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Notification bus backed by Redis pub/sub, so subscribers on any instance see
 * messages published on any other.
 *
 * <p>
 * Each key maps to one channel ({@code channelPrefix + key}). The instance
 * holds a single Redis listener per channel for as long as at least one local
 * subscriber exists; incoming messages are decoded once and fanned out to the
 * local queues.
 */
@Component
@ConditionalOnProperty(name = "pilot.notifications.mode", havingValue = "redis")
@Slf4j
public class RedisNotificationBus implements NotificationBus {

    private static final TypeReference<Map<String, Object>> MESSAGE_TYPE = new TypeReference<>() {
    };

    private final StringRedisTemplate redisTemplate;
    private final RedisMessageListenerContainer listenerContainer;
    private final ObjectMapper objectMapper;
    private final String channelPrefix;
    private final int queueCapacity;

    private final Object mutex = new Object();
    private final Map<String, ChannelSubscription> channels = new HashMap<>();

    public RedisNotificationBus(StringRedisTemplate redisTemplate, RedisMessageListenerContainer listenerContainer,
            ObjectMapper objectMapper, PilotProperties properties) {
        this.redisTemplate = redisTemplate;
        this.listenerContainer = listenerContainer;
        this.objectMapper = objectMapper;
        this.channelPrefix = properties.getNotifications().getChannelPrefix();
        this.queueCapacity = properties.getNotifications().getQueueCapacity();
    }

    @Override
    public BlockingQueue<Map<String, Object>> subscribe(String key) {
        BlockingQueue<Map<String, Object>> queue = new LinkedBlockingQueue<>(queueCapacity);
        synchronized (mutex) {
            ChannelSubscription subscription = channels.get(key);
            if (subscription == null) {
                subscription = new ChannelSubscription(key);
                listenerContainer.addMessageListener(subscription.listener, new ChannelTopic(channelPrefix + key));
                channels.put(key, subscription);
                log.debug("[Notifications] Listening on channel {}{}", channelPrefix, key);
            }
            subscription.queues.add(queue);
        }
        return queue;
    }

    @Override
    public void unsubscribe(String key, BlockingQueue<Map<String, Object>> queue) {
        synchronized (mutex) {
            ChannelSubscription subscription = channels.get(key);
            if (subscription == null || !subscription.queues.remove(queue)) {
                return;
            }
            if (subscription.queues.isEmpty()) {
                channels.remove(key);
                listenerContainer.removeMessageListener(subscription.listener,
                        new ChannelTopic(channelPrefix + key));
                log.debug("[Notifications] Stopped listening on channel {}{}", channelPrefix, key);
            }
        }
    }

    @Override
    public void publish(String key, Map<String, Object> message) {
        try {
            redisTemplate.convertAndSend(channelPrefix + key, objectMapper.writeValueAsString(message));
        } catch (JsonProcessingException e) {
            log.warn("[Notifications] Failed to encode message for key {}: {}", key, e.getMessage());
        } catch (RuntimeException e) { // NOSONAR - publish is fire-and-forget
            log.warn("[Notifications] Failed to publish message for key {}: {}", key, e.getMessage());
        }
    }

    @Override
    @PreDestroy
    public void close() {
        synchronized (mutex) {
            for (Map.Entry<String, ChannelSubscription> entry : channels.entrySet()) {
                listenerContainer.removeMessageListener(entry.getValue().listener,
                        new ChannelTopic(channelPrefix + entry.getKey()));
            }
            channels.clear();
        }
    }

    boolean isListening(String key) {
        synchronized (mutex) {
            return channels.containsKey(key);
        }
    }

    private void dispatch(String key, List<BlockingQueue<Map<String, Object>>> queues, byte[] body) {
        Map<String, Object> message;
        try {
            message = objectMapper.readValue(new String(body, StandardCharsets.UTF_8), MESSAGE_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("[Notifications] Dropping undecodable message on key {}: {}", key, e.getOriginalMessage());
            return;
        }
        for (BlockingQueue<Map<String, Object>> queue : queues) {
            if (!queue.offer(message)) {
                log.warn("[Notifications] Subscriber queue full for key {}, message dropped", key);
            }
        }
    }

    private final class ChannelSubscription {
        private final List<BlockingQueue<Map<String, Object>>> queues = new CopyOnWriteArrayList<>();
        private final MessageListener listener;

        private ChannelSubscription(String key) {
            this.listener = (message, pattern) -> dispatch(key, queues, message.getBody());
        }
    }
}
