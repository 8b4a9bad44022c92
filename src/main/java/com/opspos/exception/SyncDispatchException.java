package com.opspos.exception;

public class SyncDispatchException extends BaseException {

    public SyncDispatchException(String message, Throwable cause) {
        super(ErrorCode.UPSTREAM_ERROR, message, cause);
    }

    public SyncDispatchException(String message) {
        super(ErrorCode.UPSTREAM_ERROR, message);
    }
}
