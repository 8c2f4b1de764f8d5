package me.golemcore.pilot.port.outbound;

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

import java.util.Map;
import java.util.concurrent.BlockingQueue;

/**
 * Key-scoped publish/subscribe fan-out. Every active subscriber of a key
 * receives every message published to that key, in publish order; subscribers
 * of other keys never see it.
 */
public interface NotificationBus {

    /**
     * Registers a new subscriber queue for {@code key}.
     */
    BlockingQueue<Map<String, Object>> subscribe(String key);

    /**
     * Removes a subscriber queue. Unknown queues are ignored.
     */
    void unsubscribe(String key, BlockingQueue<Map<String, Object>> queue);

    /**
     * Fire-and-forget publish. Delivery errors are logged, never thrown.
     */
    void publish(String key, Map<String, Object> message);

    /**
     * Stops all background listeners and drops every subscriber.
     */
    void close();
}
