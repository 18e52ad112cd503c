package dao.relay.oracle.controller;

import dao.relay.oracle.model.OracleStatusSnapshot;
import dao.relay.oracle.service.OracleEngine;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only view of the oracle state.
 */
@RestController
@RequestMapping("/api")
public class OracleMonitoringController {

    private final OracleEngine engine;

    public OracleMonitoringController(OracleEngine engine) {
        this.engine = engine;
    }

    /**
     * GET /api/status
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> getStatus() {
        OracleStatusSnapshot s = engine.statusSnapshot();
        Map<String, Object> response = new LinkedHashMap<>();

        response.put("state", s.state().label());
        response.put("activeEra", s.activeEra());
        response.put("lastProcessedEra", s.lastProcessedEra());
        response.put("lastReportedEras", s.lastReportedEras());
        response.put("watchdogAccumulatedSeconds", s.watchdogAccumulatedSeconds());
        response.put("lastBoundaryBlock", s.lastBoundaryBlock());
        response.put("lastReportAt", s.lastReportEpochSeconds());
        response.put("lastReportAtReadable", s.lastReportEpochSeconds() > 0
                ? Instant.ofEpochSecond(s.lastReportEpochSeconds()).toString() : "N/A");
        response.put("totalStashFreeBalance", s.totalStashFreeBalance().toString());

        Map<String, Object> endpoints = new LinkedHashMap<>();
        endpoints.put("relayUrl", s.relayUrl());
        endpoints.put("paraUrl", s.paraUrl());
        endpoints.put("relayFailures", s.relayFailures());
        endpoints.put("paraFailures", s.paraFailures());
        endpoints.put("relayExceptions", s.relayExceptions());
        endpoints.put("paraExceptions", s.paraExceptions());
        response.put("endpoints", endpoints);

        response.put("reports", Map.of(
                "succeeded", s.reportsSucceeded(),
                "reverted", s.reportsReverted(),
                "likelyFailing", s.reportsLikelyFailing()
        ));
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/health
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> getHealth() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("state", engine.getState().label());
        return ResponseEntity.ok(response);
    }
}
