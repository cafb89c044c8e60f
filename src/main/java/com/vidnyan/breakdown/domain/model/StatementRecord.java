package com.vidnyan.breakdown.domain.model;

/**
 * One normalized statement or sub-expression of a method body.
 */
public record StatementRecord(
    StatementKind kind,
    String summary
) {

    /**
     * Syntactic role the record was derived from.
     */
    public enum StatementKind {
        DECLARATION,
        BINARY_OPERATION,
        CALL,
        LITERAL,
        UNCLASSIFIED
    }

    public static StatementRecord unclassified(String summary) {
        return new StatementRecord(StatementKind.UNCLASSIFIED, summary);
    }

    @Override
    public String toString() {
        return kind + ": " + summary;
    }
}
