package com.opspos.api.controller;

import com.opspos.connectivity.ConnectivityMonitor;
import com.opspos.connectivity.ConnectivityStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /api/connectivity -- current connectivity snapshot (mode and per-authority reachability).
 */
@RestController
@RequestMapping("/api/connectivity")
public class ConnectivityController {

    private final ConnectivityMonitor connectivityMonitor;

    public ConnectivityController(ConnectivityMonitor connectivityMonitor) {
        this.connectivityMonitor = connectivityMonitor;
    }

    @GetMapping
    public ResponseEntity<ConnectivityStatus> getStatus() {
        return ResponseEntity.ok(connectivityMonitor.getStatus());
    }
}
