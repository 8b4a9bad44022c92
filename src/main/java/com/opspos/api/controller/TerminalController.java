package com.opspos.api.controller;

import com.opspos.entity.CheckConflictEntity;
import com.opspos.lock.CheckLockManager;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * POST /api/terminals/{terminalId}/heartbeat -- terminal presence heartbeat. The response lists
 * the pending conflicts the terminal took part in when it has just reappeared, empty otherwise.
 */
@RestController
@RequestMapping("/api/terminals")
public class TerminalController {

    private final CheckLockManager checkLockManager;

    public TerminalController(CheckLockManager checkLockManager) {
        this.checkLockManager = checkLockManager;
    }

    @PostMapping("/{terminalId}/heartbeat")
    public ResponseEntity<List<CheckConflictEntity>> heartbeat(@PathVariable String terminalId) {
        return ResponseEntity.ok(checkLockManager.recordTerminalHeartbeat(terminalId));
    }
}
