package me.golemcore.pipeline.port.inbound;

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

/**
 * Processes one type of inbound webhook event. Runs at most once per
 * successfully processed event id.
 */
public interface WebhookEventHandler {

    String eventType();

    /**
     * Handle the event and return the result to store for later duplicate
     * deliveries.
     *
     * @param payload
     *            the complete, unredacted event body
     * @throws IllegalArgumentException
     *             when the payload is malformed
     */
    Map<String, Object> handle(Map<String, Object> payload);
}
