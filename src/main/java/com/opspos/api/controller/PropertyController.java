package com.opspos.api.controller;

import com.opspos.api.dto.request.BusinessDateSettingsRequest;
import com.opspos.api.dto.request.CurrentBusinessDateRequest;
import com.opspos.api.dto.request.PropertyRequest;
import com.opspos.calendar.BusinessDateService;
import com.opspos.domain.vo.BusinessDateRange;
import com.opspos.entity.PropertyEntity;
import com.opspos.service.PropertyService;
import jakarta.validation.Valid;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
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
 * REST endpoints for properties and their business date.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/properties -- all properties</li>
 *   <li>GET /api/properties/{id} -- one property</li>
 *   <li>POST /api/properties -- register a property (configuration validated)</li>
 *   <li>PUT /api/properties/{id}/business-date-settings -- timezone, rollover, mode</li>
 *   <li>PUT /api/properties/{id}/current-business-date -- pin or unpin the operating day</li>
 *   <li>GET /api/properties/{id}/business-date -- resolved and time-derived business date</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/properties")
public class PropertyController {

    private final PropertyService propertyService;
    private final BusinessDateService businessDateService;
    private final Clock clock;

    public PropertyController(PropertyService propertyService, BusinessDateService businessDateService, Clock clock) {
        this.propertyService = propertyService;
        this.businessDateService = businessDateService;
        this.clock = clock;
    }

    @GetMapping
    public ResponseEntity<List<PropertyEntity>> getProperties() {
        return ResponseEntity.ok(propertyService.getAllProperties());
    }

    @GetMapping("/{propertyId}")
    public ResponseEntity<PropertyEntity> getProperty(@PathVariable String propertyId) {
        return ResponseEntity.ok(propertyService.getProperty(propertyId));
    }

    @PostMapping
    public ResponseEntity<PropertyEntity> createProperty(@RequestBody @Valid PropertyRequest request) {
        PropertyEntity property = PropertyEntity.builder()
                .id(request.getId())
                .name(request.getName())
                .timezone(request.getTimezone())
                .rolloverTime(request.getRolloverTime())
                .rolloverMode(request.getRolloverMode())
                .autoClockOutEnabled(request.isAutoClockOutEnabled())
                .build();
        return ResponseEntity.status(HttpStatus.CREATED).body(propertyService.createProperty(property));
    }

    @PutMapping("/{propertyId}/business-date-settings")
    public ResponseEntity<PropertyEntity> updateBusinessDateSettings(
            @PathVariable String propertyId, @RequestBody BusinessDateSettingsRequest request) {
        return ResponseEntity.ok(propertyService.updateBusinessDateSettings(
                propertyId,
                request.getTimezone(),
                request.getRolloverTime(),
                request.getRolloverMode(),
                request.getAutoClockOutEnabled()));
    }

    @PutMapping("/{propertyId}/current-business-date")
    public ResponseEntity<PropertyEntity> setCurrentBusinessDate(
            @PathVariable String propertyId, @RequestBody CurrentBusinessDateRequest request) {
        return ResponseEntity.ok(propertyService.setCurrentBusinessDate(propertyId, request.getBusinessDate()));
    }

    @GetMapping("/{propertyId}/business-date")
    public ResponseEntity<Map<String, Object>> getBusinessDate(@PathVariable String propertyId) {
        PropertyEntity property = propertyService.getProperty(propertyId);
        Instant now = clock.instant();
        LocalDate businessDate = businessDateService.resolveBusinessDate(now, property);
        BusinessDateRange range = businessDateService.getBusinessDateRange(businessDate, property);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("propertyId", propertyId);
        result.put("businessDate", businessDate);
        result.put("derivedBusinessDate", businessDateService.deriveBusinessDate(now, property));
        result.put("pinned", property.getCurrentBusinessDate() != null);
        result.put("start", range.getStart());
        result.put("end", range.getEnd());
        return ResponseEntity.ok(result);
    }
}
