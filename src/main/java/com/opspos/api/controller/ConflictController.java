package com.opspos.api.controller;

import com.opspos.api.dto.request.ResolveConflictRequest;
import com.opspos.entity.CheckConflictEntity;
import com.opspos.lock.ConflictReconciliationService;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for check conflicts.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/conflicts -- pending conflicts, optionally for one terminal</li>
 *   <li>GET /api/conflicts/{conflictId}</li>
 *   <li>POST /api/conflicts/{conflictId}/resolve -- KEEP_ORIGINAL, KEEP_CLONE or MERGE</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/conflicts")
public class ConflictController {

    private final ConflictReconciliationService conflictReconciliationService;

    public ConflictController(ConflictReconciliationService conflictReconciliationService) {
        this.conflictReconciliationService = conflictReconciliationService;
    }

    @GetMapping
    public ResponseEntity<List<CheckConflictEntity>> getPendingConflicts(
            @RequestParam(required = false) String terminalId) {
        return ResponseEntity.ok(terminalId != null
                ? conflictReconciliationService.getPendingConflictsForTerminal(terminalId)
                : conflictReconciliationService.getPendingConflicts());
    }

    @GetMapping("/{conflictId}")
    public ResponseEntity<CheckConflictEntity> getConflict(@PathVariable Long conflictId) {
        return ResponseEntity.ok(conflictReconciliationService.getConflict(conflictId));
    }

    @PostMapping("/{conflictId}/resolve")
    public ResponseEntity<CheckConflictEntity> resolve(
            @PathVariable Long conflictId, @RequestBody @Valid ResolveConflictRequest request) {
        return ResponseEntity.ok(
                conflictReconciliationService.resolve(conflictId, request.getResolution(), request.getEmployeeId()));
    }
}
