package com.vidnyan.breakdown.domain.exception;

/**
 * Nesting went past the configured recursion ceiling.
 */
public class DepthExceededException extends BreakdownException {

    private final int ceiling;

    public DepthExceededException(int ceiling, String where) {
        super("Nesting deeper than " + ceiling + " levels in " + where);
        this.ceiling = ceiling;
    }

    public int getCeiling() {
        return ceiling;
    }
}
