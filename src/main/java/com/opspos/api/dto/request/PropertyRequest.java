package com.opspos.api.dto.request;

import com.opspos.domain.enums.RolloverMode;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for registering a property. Timezone and rollover time may be left out to use
 * the configured defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PropertyRequest {

    @NotBlank
    private String id;

    private String name;

    /** IANA zone id, e.g. "America/New_York". */
    private String timezone;

    /** HH:MM, 24h. */
    private String rolloverTime;

    private RolloverMode rolloverMode;

    private boolean autoClockOutEnabled;
}
