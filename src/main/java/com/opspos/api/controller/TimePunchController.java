package com.opspos.api.controller;

import com.opspos.api.dto.request.ClockInRequest;
import com.opspos.entity.TimePunchEntity;
import com.opspos.service.TimePunchService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * POST /api/time-punches/clock-in and POST /api/time-punches/{punchId}/clock-out.
 */
@RestController
@RequestMapping("/api/time-punches")
public class TimePunchController {

    private final TimePunchService timePunchService;

    public TimePunchController(TimePunchService timePunchService) {
        this.timePunchService = timePunchService;
    }

    @PostMapping("/clock-in")
    public ResponseEntity<TimePunchEntity> clockIn(@RequestBody @Valid ClockInRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(timePunchService.clockIn(request.getPropertyId(), request.getEmployeeId()));
    }

    @PostMapping("/{punchId}/clock-out")
    public ResponseEntity<TimePunchEntity> clockOut(@PathVariable String punchId) {
        return ResponseEntity.ok(timePunchService.clockOut(punchId));
    }
}
