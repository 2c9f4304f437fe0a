package me.golemcore.pipeline.port.outbound;

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

import me.golemcore.pipeline.domain.model.WebhookClaim;
import me.golemcore.pipeline.domain.model.WebhookEvent;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

public interface WebhookEventRepository {

    /**
     * Atomically claim an event id. A new id is inserted as processing. A
     * failed row, or a processing row claimed before {@code staleBefore}, is
     * re-claimed. Any other row is returned unchanged as an existing claim.
     */
    WebhookClaim claim(WebhookEvent candidate, Instant staleBefore);

    WebhookEvent update(String eventId, UnaryOperator<WebhookEvent> mutation);

    Optional<WebhookEvent> findByEventId(String eventId);

    List<WebhookEvent> findAll();
}
