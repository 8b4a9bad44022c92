package com.opspos.exception;

import java.util.Map;

/**
 * Rejects a business-date or rollover configuration at configuration time so that
 * a bad value never reaches the scheduler.
 */
public class InvalidConfigurationException extends BaseException {

    public InvalidConfigurationException(String message) {
        super(ErrorCode.CONFIGURATION_ERROR, message);
    }

    public InvalidConfigurationException(String message, Map<String, Object> details) {
        super(ErrorCode.CONFIGURATION_ERROR, message, details);
    }
}
