package com.flagship.ledger_resolver.api;

import com.flagship.ledger_resolver.api.dto.LedgerConfigEntry;
import com.flagship.ledger_resolver.api.dto.LedgerConfigListResponse;
import com.flagship.ledger_resolver.api.dto.LedgerConfigUpdateRequest;
import com.flagship.ledger_resolver.api.dto.ResolvedLedgerResponse;
import com.flagship.ledger_resolver.registry.LedgerConfig;
import com.flagship.ledger_resolver.registry.LedgerDescriptor;
import com.flagship.ledger_resolver.resolution.LedgerRequestType;
import com.flagship.ledger_resolver.resolution.LedgerRequestsExecutor;
import com.flagship.ledger_resolver.resolution.MultiLedgerManager;
import com.flagship.ledger_resolver.resolution.ResolvedLedger;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Admin and resolution endpoints for the configured ledgers.
 */
@RestController
@RequestMapping("/ledger")
@RequiredArgsConstructor
@Slf4j
public class LedgerController {

    private final MultiLedgerManager manager;
    private final LedgerRequestsExecutor requestsExecutor;

    /**
     * The configuration in use, split by production class, without genesis transactions.
     */
    @GetMapping("/multiple/config")
    public ResponseEntity<LedgerConfigListResponse> getLedgerConfig() {
        return ResponseEntity.ok(LedgerConfigListResponse.from(manager.getRegistry()));
    }

    /**
     * Replaces the whole configuration. Pools that carry over unchanged keep their connections.
     */
    @PutMapping("/multiple/config")
    public ResponseEntity<LedgerConfigListResponse> updateLedgerConfig(
            @Valid @RequestBody LedgerConfigUpdateRequest request) {
        List<LedgerConfig> configs = request.getLedgerConfigList().stream()
                .map(LedgerConfigEntry::toLedgerConfig)
                .collect(Collectors.toList());
        log.info("Received ledger configuration update with {} ledgers", configs.size());
        manager.updateLedgerConfig(configs);
        return ResponseEntity.ok(LedgerConfigListResponse.from(manager.getRegistry()));
    }

    @GetMapping("/get-write-ledger")
    public ResponseEntity<Map<String, String>> getWriteLedger() {
        LedgerDescriptor writeLedger = manager.getWriteLedger();
        return ResponseEntity.ok(Map.of("ledger_id", writeLedger.getId()));
    }

    @GetMapping("/get-write-ledgers")
    public ResponseEntity<Map<String, List<String>>> getWriteLedgers() {
        return ResponseEntity.ok(Map.of("write_ledgers", manager.getWriteLedgers()));
    }

    @PutMapping("/{ledgerId}/set-write-ledger")
    public ResponseEntity<Map<String, String>> setWriteLedger(@PathVariable("ledgerId") String ledgerId) {
        manager.setWriteLedger(ledgerId);
        return ResponseEntity.ok(Map.of("write_ledger", ledgerId));
    }

    /**
     * Resolves the ledger a DID is registered on.
     *
     * @param did bare or {@code did:<method>:} prefixed DID
     */
    @GetMapping("/did-ledger")
    public ResponseEntity<ResolvedLedgerResponse> getDidLedger(
            @RequestParam("did") String did,
            @RequestParam(value = "use_cache", defaultValue = "true") boolean useCache) {
        ResolvedLedger resolved = manager.lookupDid(MultiLedgerManager.extractDidFromIdentifier(did), useCache);
        return ResponseEntity.ok(ResolvedLedgerResponse.from(resolved));
    }

    /**
     * Resolves the ledger that should serve a read request for a schema,
     * credential definition, revocation registry or DID.
     */
    @GetMapping("/identifier-ledger")
    public ResponseEntity<ResolvedLedgerResponse> getIdentifierLedger(
            @RequestParam("identifier") String identifier,
            @RequestParam("request_type") LedgerRequestType requestType) {
        ResolvedLedger resolved = requestsExecutor.getLedgerForIdentifier(identifier, requestType);
        return ResponseEntity.ok(ResolvedLedgerResponse.from(resolved));
    }
}
