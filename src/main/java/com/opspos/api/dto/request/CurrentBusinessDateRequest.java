package com.opspos.api.dto.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Pins the property's operating day (YYYY-MM-DD). A null date returns the property to the
 * time-derived business date.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CurrentBusinessDateRequest {

    private String businessDate;
}
