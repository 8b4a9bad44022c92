package com.opspos.exception;

import java.util.HashMap;
import java.util.Map;

/**
 * Thrown when a terminal tries to mutate a check it does not hold the active lock on,
 * or when a lock change keeps losing compare-and-swap races.
 */
public class LockConflictException extends BaseException {

    public LockConflictException(String checkId, String holderTerminalId, String message) {
        super(ErrorCode.LOCK_CONFLICT, message, details(checkId, holderTerminalId));
    }

    private static Map<String, Object> details(String checkId, String holderTerminalId) {
        Map<String, Object> details = new HashMap<>();
        details.put("checkId", checkId);
        if (holderTerminalId != null) {
            details.put("lockHolderTerminalId", holderTerminalId);
        }
        return details;
    }
}
