package com.teamflow.dispatch.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.teamflow.core.sync.InboundEventQueue;
import com.teamflow.core.sync.TrackerEvent;
import com.teamflow.core.sync.TrackerEventNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Optional;

/**
 * Push producer for the inbound queue: receives issue tracker webhooks.
 */
@RestController
@RequestMapping("/api/v1/webhooks")
public class WebhookController {

    private static final Logger log = LoggerFactory.getLogger(WebhookController.class);

    private final TrackerEventNormalizer normalizer;
    private final InboundEventQueue queue;

    public WebhookController(TrackerEventNormalizer normalizer, InboundEventQueue queue) {
        this.normalizer = normalizer;
        this.queue = queue;
    }

    /**
     * POST /api/v1/webhooks/tracker. 202 when queued, 200 when the delivery is not an issue event.
     */
    @PostMapping("/tracker")
    public ResponseEntity<Map<String, Object>> tracker(
            @RequestHeader(value = "X-GitHub-Event", required = false) String eventName,
            @RequestHeader(value = "X-GitHub-Delivery", required = false) String deliveryId,
            @RequestBody JsonNode payload) {
        Optional<TrackerEvent> event = normalizer.fromWebhook(deliveryId, eventName, payload);
        if (event.isEmpty()) {
            log.debug("Ignoring tracker delivery {} ({})", deliveryId, eventName);
            return ResponseEntity.ok(Map.of("queued", false));
        }
        queue.submit(event.get());
        return ResponseEntity.accepted().body(Map.of(
                "queued", true,
                "eventId", event.get().eventId(),
                "type", event.get().type().name()));
    }
}
