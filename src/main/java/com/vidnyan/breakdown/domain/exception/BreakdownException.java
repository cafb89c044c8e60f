package com.vidnyan.breakdown.domain.exception;

/**
 * Root of the failures the breakdown engine reports.
 */
public class BreakdownException extends RuntimeException {

    public BreakdownException(String message) {
        super(message);
    }

    public BreakdownException(String message, Throwable cause) {
        super(message, cause);
    }
}
