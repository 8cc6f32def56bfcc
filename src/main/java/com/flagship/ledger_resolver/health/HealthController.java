package com.flagship.ledger_resolver.health;

import com.flagship.ledger_resolver.observability.ResolutionMetrics;
import com.flagship.ledger_resolver.registry.LedgerRegistry;
import com.flagship.ledger_resolver.resolution.MultiLedgerManager;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Simple health check endpoint for liveness/readiness probes.
 * Unlike the Actuator health endpoint, this does not require authorization.
 */
@RestController
public class HealthController {

    private final MultiLedgerManager manager;
    private final ResolutionMetrics metrics;

    public HealthController(MultiLedgerManager manager, ResolutionMetrics metrics) {
        this.manager = manager;
        this.metrics = metrics;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        LedgerRegistry registry = manager.getRegistry();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());
        response.put("productionLedgers", registry.getProduction().size());
        response.put("nonProductionLedgers", registry.getNonProduction().size());
        response.put("writeLedger", registry.getWriteLedgerId().orElse(null));
        response.put("openPools", metrics.getOpenPools());

        if (registry.isEmpty()) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }
}
