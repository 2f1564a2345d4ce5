package com.aiinpocket.ngplus.exception;

/**
 * 兩次完成同時競爭同一個週期計分，重新送出指令是安全的。
 */
public class ConcurrencyConflictException extends RuntimeException {

    public ConcurrencyConflictException(String message) {
        super(message);
    }

    public ConcurrencyConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
