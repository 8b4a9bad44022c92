package com.opspos.api.dto.request;

import com.opspos.domain.enums.RolloverMode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update of a property's business-date settings; null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BusinessDateSettingsRequest {

    private String timezone;
    private String rolloverTime;
    private RolloverMode rolloverMode;
    private Boolean autoClockOutEnabled;
}
