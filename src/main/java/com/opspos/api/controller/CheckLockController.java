package com.opspos.api.controller;

import com.opspos.api.dto.request.LockRequest;
import com.opspos.api.dto.request.OverrideRequest;
import com.opspos.api.dto.request.TerminalRequest;
import com.opspos.domain.model.LockAcquireResult;
import com.opspos.domain.model.LockStatusView;
import com.opspos.domain.model.OverrideCommand;
import com.opspos.domain.model.OverrideResult;
import com.opspos.lock.CheckLockManager;
import jakarta.validation.Valid;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for check locks.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/checks/{checkId}/lock -- acquire (ACTIVE or VIEW)</li>
 *   <li>POST /api/checks/{checkId}/lock/release</li>
 *   <li>GET /api/checks/{checkId}/lock?terminalId= -- holder and green/yellow/red indicator</li>
 *   <li>POST /api/checks/{checkId}/lock/override -- manager override (428 until the risk of
 *       forking an offline holder's check is acknowledged)</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/checks/{checkId}/lock")
public class CheckLockController {

    private static final Logger log = LoggerFactory.getLogger(CheckLockController.class);

    private final CheckLockManager checkLockManager;

    public CheckLockController(CheckLockManager checkLockManager) {
        this.checkLockManager = checkLockManager;
    }

    @PostMapping
    public ResponseEntity<LockAcquireResult> acquire(
            @PathVariable String checkId, @RequestBody @Valid LockRequest request) {
        return ResponseEntity.ok(checkLockManager.acquire(
                checkId, request.getTerminalId(), request.getEmployeeId(), request.getLockType()));
    }

    @PostMapping("/release")
    public ResponseEntity<Map<String, Object>> release(
            @PathVariable String checkId, @RequestBody @Valid TerminalRequest request) {
        boolean released = checkLockManager.release(checkId, request.getTerminalId());
        return ResponseEntity.ok(Map.of("checkId", checkId, "released", released));
    }

    @GetMapping
    public ResponseEntity<LockStatusView> getLockStatus(
            @PathVariable String checkId, @RequestParam String terminalId) {
        return ResponseEntity.ok(checkLockManager.getLockStatus(checkId, terminalId));
    }

    @PostMapping("/override")
    public ResponseEntity<OverrideResult> override(
            @PathVariable String checkId, @RequestBody @Valid OverrideRequest request) {
        log.info("Lock override on check {} requested by terminal {} (manager {})",
                checkId, request.getRequestingTerminalId(), request.getManagerEmployeeId());
        OverrideCommand command = OverrideCommand.builder()
                .checkId(checkId)
                .requestingTerminalId(request.getRequestingTerminalId())
                .requestingEmployeeId(request.getRequestingEmployeeId())
                .managerEmployeeId(request.getManagerEmployeeId())
                .managerPin(request.getManagerPin())
                .riskAcknowledged(request.isRiskAcknowledged())
                .build();
        return ResponseEntity.ok(checkLockManager.override(command));
    }
}
