package com.opspos.api.controller;

import com.opspos.calendar.BusinessDateService;
import com.opspos.entity.FiscalPeriodEntity;
import com.opspos.fiscal.FiscalPeriodService;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for a property's fiscal periods.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/properties/{propertyId}/fiscal-periods -- all periods, newest first</li>
 *   <li>GET /api/properties/{propertyId}/fiscal-periods/open -- open periods, oldest first</li>
 *   <li>GET /api/properties/{propertyId}/fiscal-periods/{businessDate}</li>
 *   <li>POST /api/properties/{propertyId}/fiscal-periods/{businessDate}/close -- manual close</li>
 *   <li>POST /api/properties/{propertyId}/fiscal-periods/{businessDate}/reopen</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/properties/{propertyId}/fiscal-periods")
public class FiscalPeriodController {

    private final FiscalPeriodService fiscalPeriodService;
    private final BusinessDateService businessDateService;

    public FiscalPeriodController(FiscalPeriodService fiscalPeriodService, BusinessDateService businessDateService) {
        this.fiscalPeriodService = fiscalPeriodService;
        this.businessDateService = businessDateService;
    }

    @GetMapping
    public ResponseEntity<List<FiscalPeriodEntity>> getPeriods(@PathVariable String propertyId) {
        return ResponseEntity.ok(fiscalPeriodService.getPeriods(propertyId));
    }

    @GetMapping("/open")
    public ResponseEntity<List<FiscalPeriodEntity>> getOpenPeriods(@PathVariable String propertyId) {
        return ResponseEntity.ok(fiscalPeriodService.getOpenPeriods(propertyId));
    }

    @GetMapping("/{businessDate}")
    public ResponseEntity<FiscalPeriodEntity> getPeriod(
            @PathVariable String propertyId, @PathVariable String businessDate) {
        return ResponseEntity.ok(
                fiscalPeriodService.getPeriod(propertyId, businessDateService.parseBusinessDate(businessDate)));
    }

    @PostMapping("/{businessDate}/close")
    public ResponseEntity<FiscalPeriodEntity> closePeriod(
            @PathVariable String propertyId, @PathVariable String businessDate) {
        return ResponseEntity.ok(fiscalPeriodService.closePeriodManually(
                propertyId, businessDateService.parseBusinessDate(businessDate)));
    }

    @PostMapping("/{businessDate}/reopen")
    public ResponseEntity<FiscalPeriodEntity> reopenPeriod(
            @PathVariable String propertyId, @PathVariable String businessDate) {
        return ResponseEntity.ok(
                fiscalPeriodService.reopenPeriod(propertyId, businessDateService.parseBusinessDate(businessDate)));
    }
}
