package com.opspos.api.controller;

import com.opspos.api.dto.request.AddItemRequest;
import com.opspos.api.dto.request.OpenCheckRequest;
import com.opspos.api.dto.request.PaymentRequest;
import com.opspos.api.dto.request.TerminalRequest;
import com.opspos.api.dto.request.UpdateItemQuantityRequest;
import com.opspos.domain.model.CheckSnapshot;
import com.opspos.service.CheckService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for checks. Every mutation requires the calling terminal to hold the
 * check's ACTIVE lock (409 LOCK_CONFLICT otherwise).
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/checks -- open a check, locked by the opening terminal</li>
 *   <li>GET /api/checks/{checkId}</li>
 *   <li>POST /api/checks/{checkId}/items -- add a line item</li>
 *   <li>PUT /api/checks/{checkId}/items/{lineItemId} -- change quantity (0 removes)</li>
 *   <li>POST /api/checks/{checkId}/payments -- record a tender</li>
 *   <li>POST /api/checks/{checkId}/close -- close a fully paid check</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/checks")
public class CheckController {

    private final CheckService checkService;

    public CheckController(CheckService checkService) {
        this.checkService = checkService;
    }

    @PostMapping
    public ResponseEntity<CheckSnapshot> openCheck(@RequestBody @Valid OpenCheckRequest request) {
        CheckSnapshot check = checkService.openCheck(
                request.getPropertyId(),
                request.getTerminalId(),
                request.getEmployeeId(),
                request.getGuestCount(),
                request.getTaxRate());
        return ResponseEntity.status(HttpStatus.CREATED).body(check);
    }

    @GetMapping("/{checkId}")
    public ResponseEntity<CheckSnapshot> getCheck(@PathVariable String checkId) {
        return ResponseEntity.ok(checkService.getCheck(checkId));
    }

    @PostMapping("/{checkId}/items")
    public ResponseEntity<CheckSnapshot> addItem(
            @PathVariable String checkId, @RequestBody @Valid AddItemRequest request) {
        return ResponseEntity.ok(checkService.addItem(
                checkId,
                request.getTerminalId(),
                request.getMenuItemId(),
                request.getName(),
                request.getQuantity(),
                request.getUnitPrice()));
    }

    @PutMapping("/{checkId}/items/{lineItemId}")
    public ResponseEntity<CheckSnapshot> updateItemQuantity(
            @PathVariable String checkId,
            @PathVariable String lineItemId,
            @RequestBody @Valid UpdateItemQuantityRequest request) {
        return ResponseEntity.ok(
                checkService.updateItemQuantity(checkId, request.getTerminalId(), lineItemId, request.getQuantity()));
    }

    @PostMapping("/{checkId}/payments")
    public ResponseEntity<CheckSnapshot> applyPayment(
            @PathVariable String checkId, @RequestBody @Valid PaymentRequest request) {
        return ResponseEntity.ok(checkService.applyPayment(
                checkId, request.getTerminalId(), request.getTenderType(), request.getAmount(), request.getTipAmount()));
    }

    @PostMapping("/{checkId}/close")
    public ResponseEntity<CheckSnapshot> closeCheck(
            @PathVariable String checkId, @RequestBody @Valid TerminalRequest request) {
        return ResponseEntity.ok(checkService.closeCheck(checkId, request.getTerminalId()));
    }
}
