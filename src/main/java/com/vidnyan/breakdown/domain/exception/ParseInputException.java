package com.vidnyan.breakdown.domain.exception;

/**
 * The supplied tree is structurally invalid for the expected declaration kind,
 * or a front-end could not produce a tree at all.
 */
public class ParseInputException extends BreakdownException {

    public ParseInputException(String message) {
        super(message);
    }

    public ParseInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
