package me.golemcore.pipeline.adapter.outbound.storage;

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
import me.golemcore.pipeline.domain.model.WebhookEventStatus;
import me.golemcore.pipeline.port.outbound.StoragePort;
import me.golemcore.pipeline.port.outbound.WebhookEventRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

@Repository
public class JsonWebhookEventRepository extends JsonDocumentRepository<WebhookEvent>
        implements WebhookEventRepository {

    public JsonWebhookEventRepository(StoragePort storagePort, ObjectMapper objectMapper) {
        super(storagePort, objectMapper, "webhooks", "events.json", WebhookEvent.class);
    }

    @Override
    public WebhookClaim claim(WebhookEvent candidate, Instant staleBefore) {
        return write(items -> {
            for (int i = 0; i < items.size(); i++) {
                WebhookEvent existing = items.get(i);
                if (!existing.getEventId().equals(candidate.getEventId())) {
                    continue;
                }
                if (!isReclaimable(existing, staleBefore)) {
                    return WebhookClaim.existing(copy(existing));
                }
                WebhookEvent reclaimed = copy(existing);
                reclaimed.setStatus(WebhookEventStatus.PROCESSING);
                reclaimed.setErrorMessage(null);
                reclaimed.setAttempts(existing.getAttempts() + 1);
                reclaimed.setPayload(candidate.getPayload());
                reclaimed.setClaimedAt(candidate.getReceivedAt());
                items.set(i, reclaimed);
                return WebhookClaim.claimed(copy(reclaimed));
            }
            WebhookEvent stored = copy(candidate);
            stored.setStatus(WebhookEventStatus.PROCESSING);
            stored.setAttempts(1);
            stored.setClaimedAt(candidate.getReceivedAt());
            items.add(stored);
            return WebhookClaim.claimed(copy(stored));
        });
    }

    private static boolean isReclaimable(WebhookEvent existing, Instant staleBefore) {
        if (existing.getStatus() == WebhookEventStatus.FAILED) {
            return true;
        }
        if (existing.getStatus() != WebhookEventStatus.PROCESSING || staleBefore == null) {
            return false;
        }
        Instant claimedAt = existing.getClaimedAt() != null ? existing.getClaimedAt() : existing.getReceivedAt();
        return claimedAt != null && claimedAt.isBefore(staleBefore);
    }

    @Override
    public WebhookEvent update(String eventId, UnaryOperator<WebhookEvent> mutation) {
        return write(items -> {
            for (int i = 0; i < items.size(); i++) {
                if (items.get(i).getEventId().equals(eventId)) {
                    WebhookEvent updated = mutation.apply(copy(items.get(i)));
                    items.set(i, updated);
                    return copy(updated);
                }
            }
            throw new IllegalArgumentException("Webhook event not found: " + eventId);
        });
    }

    @Override
    public Optional<WebhookEvent> findByEventId(String eventId) {
        return read(items -> items.stream()
                .filter(e -> e.getEventId().equals(eventId))
                .findFirst()
                .map(this::copy));
    }

    @Override
    public List<WebhookEvent> findAll() {
        return read(this::copyAll);
    }
}
