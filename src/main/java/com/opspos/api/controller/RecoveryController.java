package com.opspos.api.controller;

import com.opspos.recovery.RecoveryAlert;
import com.opspos.recovery.RecoveryAlertHandler;
import com.opspos.recovery.RecoveryManager;
import com.opspos.recovery.ServiceStats;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for supervised services.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/recovery/services -- state, attempts and circuit breaker per service</li>
 *   <li>GET /api/recovery/services/{name}</li>
 *   <li>POST /api/recovery/services/{name}/recover -- one manual recovery attempt</li>
 *   <li>POST /api/recovery/services/{name}/reset -- clear exhaustion and restart</li>
 *   <li>GET /api/recovery/alerts -- services that exhausted their recovery attempts</li>
 *   <li>POST /api/recovery/alerts/{name}/acknowledge</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/recovery")
public class RecoveryController {

    private static final Logger log = LoggerFactory.getLogger(RecoveryController.class);

    private final RecoveryManager recoveryManager;
    private final RecoveryAlertHandler recoveryAlertHandler;

    public RecoveryController(RecoveryManager recoveryManager, RecoveryAlertHandler recoveryAlertHandler) {
        this.recoveryManager = recoveryManager;
        this.recoveryAlertHandler = recoveryAlertHandler;
    }

    @GetMapping("/services")
    public ResponseEntity<List<ServiceStats>> getServices() {
        return ResponseEntity.ok(recoveryManager.getAllServiceStats());
    }

    @GetMapping("/services/{name}")
    public ResponseEntity<ServiceStats> getService(@PathVariable String name) {
        return ResponseEntity.ok(recoveryManager.getServiceStats(name));
    }

    @PostMapping("/services/{name}/recover")
    public ResponseEntity<ServiceStats> recover(@PathVariable String name) {
        log.info("Manual recovery requested for service {}", name);
        recoveryManager.recoverService(name);
        return ResponseEntity.ok(recoveryManager.getServiceStats(name));
    }

    @PostMapping("/services/{name}/reset")
    public ResponseEntity<ServiceStats> reset(@PathVariable String name) {
        log.info("Recovery reset requested for service {}", name);
        recoveryManager.resetService(name);
        recoveryAlertHandler.acknowledge(name);
        recoveryManager.startService(name);
        return ResponseEntity.ok(recoveryManager.getServiceStats(name));
    }

    @GetMapping("/alerts")
    public ResponseEntity<List<RecoveryAlert>> getAlerts() {
        return ResponseEntity.ok(recoveryAlertHandler.getActiveAlerts());
    }

    @PostMapping("/alerts/{name}/acknowledge")
    public ResponseEntity<Map<String, Object>> acknowledge(@PathVariable String name) {
        return ResponseEntity.ok(Map.of("serviceName", name, "acknowledged", recoveryAlertHandler.acknowledge(name)));
    }
}
