package com.opspos.api.dto.response;

import java.time.Instant;
import lombok.Getter;

/**
 * Success envelope. {@code terminalId} names the terminal that answered, which matters when a
 * relay host forwards requests for several terminals.
 */
@Getter
public class ApiResponse<T> {

    private final boolean success = true;
    private final String terminalId;
    private final T data;
    private final Instant timestamp;

    private ApiResponse(String terminalId, T data) {
        this.terminalId = terminalId;
        this.data = data;
        this.timestamp = Instant.now();
    }

    public static <T> ApiResponse<T> of(String terminalId, T data) {
        return new ApiResponse<>(terminalId, data);
    }
}
