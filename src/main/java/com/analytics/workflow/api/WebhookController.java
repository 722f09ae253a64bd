package com.analytics.workflow.api;

import com.analytics.workflow.domain.model.QueueStatusView;
import com.analytics.workflow.domain.model.WebhookReceipt;
import com.analytics.workflow.domain.webhook.WebhookRelayQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Inbound POS webhooks.
 * 
 * The raw body is queued untouched and acknowledged with 202; the order
 * upsert happens in the queue worker (or inline when the queue is down).
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/webhooks")
@RequiredArgsConstructor
public class WebhookController {
    
    private final WebhookRelayQueue relayQueue;
    
    @PostMapping("/pos/{tenantId}")
    public ResponseEntity<WebhookReceipt> receivePosWebhook(
            @PathVariable String tenantId,
            @RequestBody String payload) {
        
        WebhookReceipt receipt = relayQueue.enqueue(tenantId, payload);
        
        log.info("POS webhook accepted: tenant={}, item={}, mode={}",
                tenantId, receipt.getItemId(), receipt.getProcessingMode());
        
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(receipt);
    }
    
    @GetMapping("/queue/status")
    public ResponseEntity<QueueStatusView> queueStatus() {
        return ResponseEntity.ok(relayQueue.status());
    }
}
